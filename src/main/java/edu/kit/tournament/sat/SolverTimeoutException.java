package edu.kit.tournament.sat;

import edu.kit.tournament.TournamentException;

/**
 * The solver did not answer within the configured time budget.
 */
public class SolverTimeoutException extends TournamentException {

  private static final long serialVersionUID = 1L;

  public SolverTimeoutException(String message) {
    super(message);
  }

  public SolverTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
