package edu.kit.tournament.encoding;

import edu.kit.tournament.Configuration.AtMostOneEncoding;
import edu.kit.tournament.model.ScheduleValidator;
import edu.kit.tournament.model.Slot;
import edu.kit.tournament.sat.Clause;
import edu.kit.tournament.sat.SatFormula;
import edu.kit.tournament.sat.VariableCounter;

/**
 * Generates the clauses of the four rule families of a round-robin
 * tournament. Each family is returned as a separate formula; families that
 * need auxiliary variables draw them from the counter passed in.
 */
public class ConstraintBuilder {

  private final VariableIndexer indexer;
  private final CardinalityEncoder cardinalityEncoder;
  private final AtMostOneEncoding atMostOneEncoding;

  public ConstraintBuilder(VariableIndexer indexer, AtMostOneEncoding atMostOneEncoding) {
    this.indexer = indexer;
    this.cardinalityEncoder = new CardinalityEncoder();
    this.atMostOneEncoding = atMostOneEncoding;
  }

  /**
   * Every team plays exactly one match per week.
   */
  public SatFormula exactlyOnePerTeamPerWeek(VariableCounter counter) {
    SatFormula formula = new SatFormula();
    for (int week = 1; week <= indexer.getNumWeeks(); week++) {
      for (int team = 1; team <= indexer.getNumTeams(); team++) {
        Clause group = new Clause();
        for (int period = 1; period <= indexer.getNumPeriods(); period++) {
          group.add(matchesOfTeam(team, week, period));
        }
        exactlyOne(formula, group, counter);
      }
    }
    return formula;
  }

  /**
   * Every pair of teams meets exactly once, in either orientation.
   */
  public SatFormula exactlyOncePerPair(VariableCounter counter) {
    SatFormula formula = new SatFormula();
    int n = indexer.getNumTeams();
    for (int a = 1; a <= n; a++) {
      for (int b = a + 1; b <= n; b++) {
        Clause group = new Clause();
        for (int week = 1; week <= indexer.getNumWeeks(); week++) {
          for (int period = 1; period <= indexer.getNumPeriods(); period++) {
            for (Slot slot : Slot.values()) {
              group.add(indexer.idFor(a, b, week, period, slot));
            }
          }
        }
        exactlyOne(formula, group, counter);
      }
    }
    return formula;
  }

  /**
   * A (week, period) cell hosts at most one match, whichever side is home.
   */
  public SatFormula slotExclusivity(VariableCounter counter) {
    SatFormula formula = new SatFormula();
    int n = indexer.getNumTeams();
    for (int week = 1; week <= indexer.getNumWeeks(); week++) {
      for (int period = 1; period <= indexer.getNumPeriods(); period++) {
        Clause group = new Clause();
        for (int a = 1; a <= n; a++) {
          for (int b = a + 1; b <= n; b++) {
            for (Slot slot : Slot.values()) {
              group.add(indexer.idFor(a, b, week, period, slot));
            }
          }
        }
        atMostOne(formula, group, counter);
      }
    }
    return formula;
  }

  /**
   * No team plays in the same period more than twice over the tournament.
   */
  public SatFormula periodCardinality(VariableCounter counter) {
    SatFormula formula = new SatFormula();
    for (int team = 1; team <= indexer.getNumTeams(); team++) {
      for (int period = 1; period <= indexer.getNumPeriods(); period++) {
        Clause group = new Clause();
        for (int week = 1; week <= indexer.getNumWeeks(); week++) {
          group.add(matchesOfTeam(team, week, period));
        }
        formula.addAll(cardinalityEncoder.atMost(group.toArray(),
            ScheduleValidator.MAX_APPEARANCES_PER_PERIOD, counter).getClauses());
      }
    }
    return formula;
  }

  // All facts placing the team in the given week and period, both orientations
  private Clause matchesOfTeam(int team, int week, int period) {
    Clause clause = new Clause();
    for (int opponent = 1; opponent <= indexer.getNumTeams(); opponent++) {
      if (opponent == team) {
        continue;
      }
      for (Slot slot : Slot.values()) {
        clause.add(indexer.idFor(team, opponent, week, period, slot));
      }
    }
    return clause;
  }

  private void exactlyOne(SatFormula formula, Clause group, VariableCounter counter) {
    formula.addClause(group.toArray());
    atMostOne(formula, group, counter);
  }

  private void atMostOne(SatFormula formula, Clause group, VariableCounter counter) {
    switch (atMostOneEncoding) {
    case pairwise:
      formula.addAtMostOneGroup(group.toArray());
      break;
    case sequential:
      formula.addAll(cardinalityEncoder.atMost(group.toArray(), 1, counter).getClauses());
      break;
    default:
      throw new IllegalArgumentException("Unknown at-most-one encoding " + atMostOneEncoding);
    }
  }
}
