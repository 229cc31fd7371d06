package edu.kit.tournament.model;

import edu.kit.tournament.TournamentException;

/**
 * A decoded schedule breaks one of the structural tournament rules.
 */
public class InvariantViolationException extends TournamentException {

  private static final long serialVersionUID = 1L;

  public InvariantViolationException(String message) {
    super(message);
  }
}
