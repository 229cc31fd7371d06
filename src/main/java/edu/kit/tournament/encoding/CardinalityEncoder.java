package edu.kit.tournament.encoding;

import edu.kit.tournament.sat.SatFormula;
import edu.kit.tournament.sat.VariableCounter;

/**
 * Sequential counter encoding of "at most k of these literals are true".
 * <p>
 * For m literals x_1..x_m the encoding introduces m * k auxiliary variables
 * s[i][j], read as "at least j of x_1..x_i are true", and the clauses
 *
 * <pre>
 * x_i -> s[i][1]
 * s[i-1][j] -> s[i][j]
 * x_i and s[i-1][j-1] -> s[i][j]      (j > 1)
 * not (x_i and s[i-1][k])
 * </pre>
 *
 * Every assignment of the x with at most k true literals extends to a model
 * (set s[i][j] to the actual running count), every other one is refuted.
 */
public class CardinalityEncoder {

  /**
   * Clauses of one encoded constraint and the number of auxiliary
   * variables drawn from the counter for it.
   */
  public static final class Encoding {
    private final SatFormula clauses;
    private final int auxiliaryVariables;

    Encoding(SatFormula clauses, int auxiliaryVariables) {
      this.clauses = clauses;
      this.auxiliaryVariables = auxiliaryVariables;
    }

    public SatFormula getClauses() {
      return clauses;
    }

    public int getAuxiliaryVariables() {
      return auxiliaryVariables;
    }
  }

  public Encoding atMost(int[] literals, int bound, VariableCounter counter) {
    if (bound < 0) {
      throw new IllegalArgumentException("Negative bound " + bound);
    }
    SatFormula formula = new SatFormula();
    int m = literals.length;
    if (m <= bound) {
      return new Encoding(formula, 0);
    }
    if (bound == 0) {
      for (int lit : literals) {
        formula.addClause(-lit);
      }
      return new Encoding(formula, 0);
    }

    int firstAux = counter.getHighest() + 1;
    int[][] s = new int[m + 1][bound + 1];
    for (int i = 1; i <= m; i++) {
      for (int j = 1; j <= bound; j++) {
        s[i][j] = counter.next();
      }
    }

    for (int i = 1; i <= m; i++) {
      int x = literals[i - 1];
      formula.addClause(-x, s[i][1]);
      if (i == 1) {
        continue;
      }
      for (int j = 1; j <= bound; j++) {
        formula.addClause(-s[i - 1][j], s[i][j]);
      }
      for (int j = 2; j <= bound; j++) {
        formula.addClause(-x, -s[i - 1][j - 1], s[i][j]);
      }
      formula.addClause(-x, -s[i - 1][bound]);
    }
    return new Encoding(formula, counter.getHighest() - firstAux + 1);
  }
}
