package edu.kit.tournament.encoding;

import edu.kit.tournament.model.Fact;
import edu.kit.tournament.model.Slot;

/**
 * Numbers the facts of a tournament with n teams densely from 1.
 * <p>
 * Facts are ordered by team pair (lexicographically, lower team first),
 * then week, period and slot, so the id of a fact is computed rather than
 * looked up and the numbering only depends on n.
 */
public class VariableIndexer {

  private final int numTeams;
  private final int numWeeks;
  private final int numPeriods;

  // pairIndex[a][b] for a < b, and its inverse
  private final int[][] pairIndex;
  private final int[][] pairs;

  public VariableIndexer(int numTeams) {
    if (numTeams < 2 || numTeams % 2 != 0) {
      throw new IllegalArgumentException("Number of teams must be even and at least 2, got " + numTeams);
    }
    this.numTeams = numTeams;
    this.numWeeks = numTeams - 1;
    this.numPeriods = numTeams / 2;

    int numPairs = numTeams * (numTeams - 1) / 2;
    pairIndex = new int[numTeams + 1][numTeams + 1];
    pairs = new int[numPairs][];
    int idx = 0;
    for (int a = 1; a <= numTeams; a++) {
      for (int b = a + 1; b <= numTeams; b++) {
        pairIndex[a][b] = idx;
        pairs[idx] = new int[] { a, b };
        idx++;
      }
    }
  }

  public int idFor(Fact fact) {
    checkRange(fact.getFirst(), numTeams, "team");
    checkRange(fact.getSecond(), numTeams, "team");
    checkRange(fact.getWeek(), numWeeks, "week");
    checkRange(fact.getPeriod(), numPeriods, "period");
    int pair = pairIndex[fact.getFirst()][fact.getSecond()];
    int offset = ((pair * numWeeks + fact.getWeek() - 1) * numPeriods + fact.getPeriod() - 1) * 2
        + fact.getSlot().ordinal();
    return offset + 1;
  }

  public int idFor(int a, int b, int week, int period, Slot slot) {
    return idFor(Fact.of(a, b, week, period, slot));
  }

  public Fact factFor(int id) {
    if (!isFactVariable(id)) {
      throw new IllegalArgumentException("Variable " + id + " does not denote a fact (1.." + getNumVariables() + ")");
    }
    int offset = id - 1;
    Slot slot = Slot.values()[offset % 2];
    offset /= 2;
    int period = offset % numPeriods + 1;
    offset /= numPeriods;
    int week = offset % numWeeks + 1;
    int[] pair = pairs[offset / numWeeks];
    return Fact.of(pair[0], pair[1], week, period, slot);
  }

  public boolean isFactVariable(int id) {
    return id >= 1 && id <= getNumVariables();
  }

  public int getNumVariables() {
    return pairs.length * numWeeks * numPeriods * 2;
  }

  public int getNumTeams() {
    return numTeams;
  }

  public int getNumWeeks() {
    return numWeeks;
  }

  public int getNumPeriods() {
    return numPeriods;
  }

  private static void checkRange(int value, int max, String what) {
    if (value < 1 || value > max) {
      throw new IllegalArgumentException(what + " " + value + " out of range 1.." + max);
    }
  }
}
