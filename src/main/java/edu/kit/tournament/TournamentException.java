package edu.kit.tournament;

/**
 * Base class of all failures a caller of the scheduler can observe.
 */
public class TournamentException extends Exception {

  private static final long serialVersionUID = 1L;

  public TournamentException(String message) {
    super(message);
  }

  public TournamentException(String message, Throwable cause) {
    super(message, cause);
  }
}
