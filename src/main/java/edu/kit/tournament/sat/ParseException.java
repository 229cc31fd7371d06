package edu.kit.tournament.sat;

import edu.kit.tournament.TournamentException;

/**
 * The solver's answer does not follow the expected format.
 */
public class ParseException extends TournamentException {

  private static final long serialVersionUID = 1L;

  public ParseException(String message) {
    super(message);
  }

  public ParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
