package edu.kit.tournament.model;

import java.util.Objects;

/**
 * The statement "team a meets team b in the given week and period", with
 * the slot telling whether a is the home side.
 * <p>
 * A fact is stored in canonical form with the lower team number first:
 * {@code of(b, a, w, p, AWAY)} and {@code of(a, b, w, p, HOME)} denote the
 * same match and are equal.
 */
public final class Fact {

  private final int first;
  private final int second;
  private final int week;
  private final int period;
  private final Slot slot;

  private Fact(int first, int second, int week, int period, Slot slot) {
    this.first = first;
    this.second = second;
    this.week = week;
    this.period = period;
    this.slot = slot;
  }

  public static Fact of(int a, int b, int week, int period, Slot slot) {
    if (a == b) {
      throw new IllegalArgumentException("Team " + a + " cannot play against itself");
    }
    Objects.requireNonNull(slot, "slot");
    if (a < b) {
      return new Fact(a, b, week, period, slot);
    }
    return new Fact(b, a, week, period, slot.flip());
  }

  public static Fact ofMatch(int week, int period, Match match) {
    return of(match.getHome(), match.getAway(), week, period, Slot.HOME);
  }

  public int getFirst() {
    return first;
  }

  public int getSecond() {
    return second;
  }

  public int getWeek() {
    return week;
  }

  public int getPeriod() {
    return period;
  }

  public Slot getSlot() {
    return slot;
  }

  public int getHome() {
    return slot == Slot.HOME ? first : second;
  }

  public int getAway() {
    return slot == Slot.HOME ? second : first;
  }

  public Match toMatch() {
    return new Match(getHome(), getAway());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Fact other = (Fact) obj;
    return first == other.first && second == other.second && week == other.week
        && period == other.period && slot == other.slot;
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second, week, period, slot);
  }

  @Override
  public String toString() {
    return "week " + week + ", period " + period + ": " + getHome() + " v " + getAway();
  }
}
