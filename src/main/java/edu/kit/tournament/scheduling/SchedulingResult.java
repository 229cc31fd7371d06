package edu.kit.tournament.scheduling;

import edu.kit.tournament.TournamentException;
import edu.kit.tournament.model.Schedule;

/**
 * Terminal outcome of a scheduling attempt: a schedule, the verdict that
 * none exists, or the failure that stopped the pipeline.
 */
public final class SchedulingResult {

  private final SchedulerState state;
  private final Schedule schedule;
  private final TournamentException failure;

  private SchedulingResult(SchedulerState state, Schedule schedule, TournamentException failure) {
    this.state = state;
    this.schedule = schedule;
    this.failure = failure;
  }

  static SchedulingResult solved(Schedule schedule) {
    return new SchedulingResult(SchedulerState.SOLVED, schedule, null);
  }

  static SchedulingResult unsatisfiable() {
    return new SchedulingResult(SchedulerState.UNSATISFIABLE, null, null);
  }

  static SchedulingResult failed(TournamentException failure) {
    return new SchedulingResult(SchedulerState.FAILED, null, failure);
  }

  public SchedulerState getState() {
    return state;
  }

  public boolean isSolved() {
    return state == SchedulerState.SOLVED;
  }

  public Schedule getSchedule() {
    if (schedule == null) {
      throw new IllegalStateException("No schedule in state " + state);
    }
    return schedule;
  }

  public TournamentException getFailure() {
    if (failure == null) {
      throw new IllegalStateException("No failure in state " + state);
    }
    return failure;
  }

  @Override
  public String toString() {
    return state + (failure != null ? " (" + failure.getMessage() + ")" : "");
  }
}
