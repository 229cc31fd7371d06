package edu.kit.tournament.sat;

import java.util.ArrayList;
import java.util.List;

/**
 * Growable list of literals, used to collect a clause or a group of
 * literals before handing it to a {@link SatFormula}.
 */
public final class Clause {

  private final List<Integer> varList;

  public Clause() {
    varList = new ArrayList<>();
  }

  public void add(int literal) {
    varList.add(literal);
  }

  public void add(Clause clause) {
    varList.addAll(clause.varList);
  }

  public int size() {
    return varList.size();
  }

  public int[] toArray() {
    return varList.stream().mapToInt(x -> x).toArray();
  }

  @Override
  public String toString() {
    return varList.toString();
  }
}
