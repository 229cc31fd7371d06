package edu.kit.tournament.sat;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads answers in the SAT competition output format:
 *
 * <pre>
 * c any comment
 * s SATISFIABLE
 * v 1 -2 3
 * v -4 5 0
 * </pre>
 *
 * Lines that do not start with a status or value marker are ignored.
 */
public final class SolverAnswerParser {

  private static final String SATISFIABLE = "SATISFIABLE";
  private static final String UNSATISFIABLE = "UNSATISFIABLE";

  private SolverAnswerParser() {
  }

  public static Verdict parse(String answer) throws ParseException {
    String status = null;
    boolean terminated = false;
    List<Integer> literals = new ArrayList<>();

    String[] lines = answer.split("\\R");
    for (int lineNo = 1; lineNo <= lines.length; lineNo++) {
      String line = lines[lineNo - 1].trim();
      if (isMarked(line, 's')) {
        if (status != null) {
          throw new ParseException("Line " + lineNo + ": second status line");
        }
        status = line.substring(1).trim();
        if (!status.equals(SATISFIABLE) && !status.equals(UNSATISFIABLE)) {
          throw new ParseException("Line " + lineNo + ": unknown status \"" + status + "\"");
        }
      } else if (isMarked(line, 'v')) {
        if (!SATISFIABLE.equals(status)) {
          throw new ParseException("Line " + lineNo + ": value line without preceding "
              + SATISFIABLE + " status");
        }
        for (String token : line.substring(1).trim().split("\\s+")) {
          if (token.isEmpty()) {
            continue;
          }
          if (terminated) {
            throw new ParseException("Line " + lineNo + ": value after terminating 0");
          }
          int lit;
          try {
            lit = Integer.parseInt(token);
          } catch (NumberFormatException e) {
            throw new ParseException("Line " + lineNo + ": \"" + token + "\" is not a literal", e);
          }
          if (lit == Integer.MIN_VALUE) {
            throw new ParseException("Line " + lineNo + ": literal " + token + " out of range");
          }
          if (lit == 0) {
            terminated = true;
          } else {
            literals.add(lit);
          }
        }
      }
    }

    if (status == null) {
      throw new ParseException("No status line in solver output");
    }
    if (status.equals(UNSATISFIABLE)) {
      return Verdict.unsatisfiable();
    }
    if (!terminated) {
      throw new ParseException("Assignment is truncated: missing terminating 0");
    }
    try {
      return Verdict.satisfiable(literals.stream().mapToInt(x -> x).toArray());
    } catch (IllegalArgumentException e) {
      throw new ParseException("Inconsistent assignment: " + e.getMessage(), e);
    }
  }

  private static boolean isMarked(String line, char marker) {
    return !line.isEmpty() && line.charAt(0) == marker
        && (line.length() == 1 || Character.isWhitespace(line.charAt(1)));
  }
}
