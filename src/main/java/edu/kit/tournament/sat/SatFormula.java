package edu.kit.tournament.sat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only conjunction of clauses. Each constraint family produces its
 * own formula; formulas are combined with {@link #addAll(SatFormula)}.
 */
public final class SatFormula {

  private final List<int[]> clauses = new ArrayList<>();

  public void addClause(int... literals) {
    for (int lit : literals) {
      if (lit == 0) {
        throw new IllegalArgumentException("0 is not a literal");
      }
    }
    clauses.add(literals.clone());
  }

  /**
   * Forbids any two of the given literals to be true at the same time.
   */
  public void addAtMostOneGroup(int[] literals) {
    for (int i = 0; i < literals.length; i++) {
      for (int j = i + 1; j < literals.length; j++) {
        addClause(-literals[i], -literals[j]);
      }
    }
  }

  public void addAll(SatFormula other) {
    for (int[] clause : other.clauses) {
      clauses.add(clause.clone());
    }
  }

  public int size() {
    return clauses.size();
  }

  public List<int[]> getClauses() {
    return Collections.unmodifiableList(clauses);
  }

  /**
   * Largest variable mentioned in any clause, 0 for an empty formula.
   */
  public int getMaxVariable() {
    int max = 0;
    for (int[] clause : clauses) {
      for (int lit : clause) {
        max = Math.max(max, Math.abs(lit));
      }
    }
    return max;
  }
}
