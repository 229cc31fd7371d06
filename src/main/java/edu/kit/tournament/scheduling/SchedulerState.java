package edu.kit.tournament.scheduling;

/**
 * Lifecycle of a {@link Scheduler}. {@code SOLVED}, {@code UNSATISFIABLE}
 * and {@code FAILED} are terminal.
 */
public enum SchedulerState {
  UNBUILT, BUILT, AWAITING_SOLVER, SOLVED, UNSATISFIABLE, FAILED;

  public boolean isTerminal() {
    return this == SOLVED || this == UNSATISFIABLE || this == FAILED;
  }
}
