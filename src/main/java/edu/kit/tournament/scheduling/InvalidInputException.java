package edu.kit.tournament.scheduling;

import edu.kit.tournament.TournamentException;

/**
 * The requested tournament cannot be encoded, e.g. an odd number of teams.
 */
public class InvalidInputException extends TournamentException {

  private static final long serialVersionUID = 1L;

  public InvalidInputException(String message) {
    super(message);
  }
}
