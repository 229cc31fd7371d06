package edu.kit.tournament.encoding;

/**
 * Internal inconsistency in variable numbering. Indicates a bug in the
 * encoder rather than a problem with the input.
 */
public class EncodingException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public EncodingException(String message) {
    super(message);
  }
}
