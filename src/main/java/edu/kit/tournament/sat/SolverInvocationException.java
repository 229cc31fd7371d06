package edu.kit.tournament.sat;

import edu.kit.tournament.TournamentException;

/**
 * The solver could not be run or ended abnormally.
 */
public class SolverInvocationException extends TournamentException {

  private static final long serialVersionUID = 1L;

  public SolverInvocationException(String message) {
    super(message);
  }

  public SolverInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
