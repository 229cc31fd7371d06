package edu.kit.tournament.sat;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Serializes a formula in DIMACS CNF: a {@code p cnf <vars> <clauses>}
 * header followed by one line per clause terminated by {@code 0}.
 */
public final class DimacsWriter {

  private DimacsWriter() {
  }

  public static void write(SatFormula formula, int numVariables, Writer writer) throws IOException {
    if (formula.getMaxVariable() > numVariables) {
      throw new IllegalArgumentException("Formula uses variable " + formula.getMaxVariable()
          + " but only " + numVariables + " are declared");
    }
    writer.write("p cnf " + numVariables + " " + formula.size() + "\n");
    for (int[] clause : formula.getClauses()) {
      String line = Arrays.stream(clause).mapToObj(String::valueOf).collect(Collectors.joining(" "));
      line += clause.length == 0 ? "0\n" : " 0\n";
      writer.write(line);
    }
  }

  public static String toDimacs(SatFormula formula, int numVariables) {
    StringWriter writer = new StringWriter();
    try {
      write(formula, numVariables, writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }
}
