package edu.kit.tournament.sat;

/**
 * Source of fresh variable ids. One counter belongs to exactly one
 * encoding; ids are handed out consecutively after the highest id in use.
 */
public final class VariableCounter {

  private int highest;

  public VariableCounter(int highestUsed) {
    if (highestUsed < 0) {
      throw new IllegalArgumentException("Negative variable id " + highestUsed);
    }
    this.highest = highestUsed;
  }

  public int next() {
    return ++highest;
  }

  public int getHighest() {
    return highest;
  }
}
