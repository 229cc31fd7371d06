package edu.kit.tournament.model;

/**
 * Orientation of a {@link Fact}: whether its first team plays at home.
 */
public enum Slot {
  HOME, AWAY;

  public Slot flip() {
    return this == HOME ? AWAY : HOME;
  }
}
