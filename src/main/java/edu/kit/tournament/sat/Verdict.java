package edu.kit.tournament.sat;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of a solver call: either unsatisfiable, or satisfiable together
 * with a truth assignment. Variables missing from the assignment are false.
 */
public final class Verdict {

  private static final Verdict UNSATISFIABLE = new Verdict(false, Collections.emptyMap(), 0);

  private final boolean satisfiable;
  // only variables mentioned by the assignment
  private final Map<Integer, Boolean> values;
  private final int maxVariable;

  private Verdict(boolean satisfiable, Map<Integer, Boolean> values, int maxVariable) {
    this.satisfiable = satisfiable;
    this.values = values;
    this.maxVariable = maxVariable;
  }

  public static Verdict unsatisfiable() {
    return UNSATISFIABLE;
  }

  /**
   * @param literals the true and false literals of the assignment, in any order
   */
  public static Verdict satisfiable(int[] literals) {
    Map<Integer, Boolean> values = new HashMap<>();
    int max = 0;
    for (int lit : literals) {
      if (lit == 0 || lit == Integer.MIN_VALUE) {
        throw new IllegalArgumentException(lit + " is not a literal");
      }
      int var = Math.abs(lit);
      Boolean previous = values.put(var, lit > 0);
      if (previous != null && previous != lit > 0) {
        throw new IllegalArgumentException("Variable " + var + " assigned both values");
      }
      max = Math.max(max, var);
    }
    return new Verdict(true, values, max);
  }

  public boolean isSatisfiable() {
    return satisfiable;
  }

  public boolean isTrue(int variable) {
    return Boolean.TRUE.equals(values.get(variable));
  }

  /**
   * Highest variable mentioned by the assignment.
   */
  public int getMaxVariable() {
    return maxVariable;
  }

  @Override
  public String toString() {
    return satisfiable ? "SATISFIABLE" : "UNSATISFIABLE";
  }
}
