package edu.kit.tournament.model;

/**
 * Checks the structural rules of a round-robin schedule independently of
 * how the schedule was produced.
 */
public final class ScheduleValidator {

  /** A team may use the same period at most this often over the tournament. */
  public static final int MAX_APPEARANCES_PER_PERIOD = 2;

  private ScheduleValidator() {
  }

  public static void validate(Schedule schedule) throws InvariantViolationException {
    int n = schedule.getNumTeams();

    // Every team plays exactly once per week
    for (int w = 1; w <= schedule.getNumWeeks(); w++) {
      int[] games = new int[n + 1];
      for (Match m : schedule.getMatchesOfWeek(w)) {
        checkTeam(m.getHome(), n);
        checkTeam(m.getAway(), n);
        games[m.getHome()]++;
        games[m.getAway()]++;
      }
      for (int t = 1; t <= n; t++) {
        if (games[t] != 1) {
          throw new InvariantViolationException(
              "Team " + t + " plays " + games[t] + " times in week " + w);
        }
      }
    }

    // Every pair meets exactly once
    int[][] meetings = new int[n + 1][n + 1];
    for (int w = 1; w <= schedule.getNumWeeks(); w++) {
      for (Match m : schedule.getMatchesOfWeek(w)) {
        int a = Math.min(m.getHome(), m.getAway());
        int b = Math.max(m.getHome(), m.getAway());
        meetings[a][b]++;
      }
    }
    for (int a = 1; a <= n; a++) {
      for (int b = a + 1; b <= n; b++) {
        if (meetings[a][b] != 1) {
          throw new InvariantViolationException(
              "Teams " + a + " and " + b + " meet " + meetings[a][b] + " times");
        }
      }
    }

    // Period usage is capped per team
    for (int t = 1; t <= n; t++) {
      for (int p = 1; p <= schedule.getNumPeriods(); p++) {
        int count = schedule.countAppearances(t, p);
        if (count > MAX_APPEARANCES_PER_PERIOD) {
          throw new InvariantViolationException(
              "Team " + t + " plays " + count + " times in period " + p);
        }
      }
    }
  }

  private static void checkTeam(int team, int numTeams) throws InvariantViolationException {
    if (team < 1 || team > numTeams) {
      throw new InvariantViolationException("Unknown team " + team);
    }
  }
}
