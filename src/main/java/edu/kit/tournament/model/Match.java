package edu.kit.tournament.model;

/**
 * A single game between a home and an away team.
 */
public final class Match {

  private final int home;
  private final int away;

  public Match(int home, int away) {
    if (home == away) {
      throw new IllegalArgumentException("Team " + home + " cannot play against itself");
    }
    this.home = home;
    this.away = away;
  }

  public int getHome() {
    return home;
  }

  public int getAway() {
    return away;
  }

  public boolean involves(int team) {
    return home == team || away == team;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Match other = (Match) obj;
    return home == other.home && away == other.away;
  }

  @Override
  public int hashCode() {
    return 31 * home + away;
  }

  @Override
  public String toString() {
    return home + " v " + away;
  }
}
