package edu.kit.tournament.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Week by period grid of matches. Weeks, periods and teams are numbered
 * from 1. Instances are immutable.
 */
public final class Schedule {

  private final int numTeams;
  private final Match[][] matches;

  /**
   * @param matches indexed by {@code [week - 1][period - 1]}; a null entry
   *                is an empty cell. The array is copied.
   */
  public Schedule(int numTeams, Match[][] matches) {
    if (matches.length != numTeams - 1) {
      throw new IllegalArgumentException("Expected " + (numTeams - 1) + " weeks, got " + matches.length);
    }
    this.numTeams = numTeams;
    this.matches = new Match[matches.length][];
    for (int w = 0; w < matches.length; w++) {
      if (matches[w].length != numTeams / 2) {
        throw new IllegalArgumentException("Expected " + (numTeams / 2) + " periods in week " + (w + 1));
      }
      this.matches[w] = matches[w].clone();
    }
  }

  public int getNumTeams() {
    return numTeams;
  }

  public int getNumWeeks() {
    return matches.length;
  }

  public int getNumPeriods() {
    return numTeams / 2;
  }

  /**
   * Returns the match played in the given week and period, or null if
   * the cell is empty.
   */
  public Match getMatch(int week, int period) {
    return matches[week - 1][period - 1];
  }

  /**
   * Returns all matches of one week ordered by period, skipping empty cells.
   */
  public List<Match> getMatchesOfWeek(int week) {
    List<Match> result = new ArrayList<>();
    for (Match m : matches[week - 1]) {
      if (m != null) {
        result.add(m);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Counts the weeks in which the given team plays in the given period.
   */
  public int countAppearances(int team, int period) {
    int count = 0;
    for (Match[] week : matches) {
      Match m = week[period - 1];
      if (m != null && m.involves(team)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int w = 1; w <= getNumWeeks(); w++) {
      sb.append("\tWeek ").append(w);
    }
    sb.append('\n');
    for (int p = 1; p <= getNumPeriods(); p++) {
      sb.append("Period ").append(p);
      for (int w = 1; w <= getNumWeeks(); w++) {
        Match m = getMatch(w, p);
        sb.append('\t').append(String.format("%-7s", m == null ? "-----" : m.toString()));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
