package edu.kit.tournament.sat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DimacsWriterTest {

  @Test
  public void writesHeaderAndOneLinePerClause() {
    SatFormula formula = new SatFormula();
    formula.addClause(1, -2, 3);
    formula.addClause(-1);
    formula.addAtMostOneGroup(new int[] { 2, 3, 4 });
    assertEquals("p cnf 5 5\n"
        + "1 -2 3 0\n"
        + "-1 0\n"
        + "-2 -3 0\n"
        + "-2 -4 0\n"
        + "-3 -4 0\n", DimacsWriter.toDimacs(formula, 5));
  }

  @Test
  public void emptyFormula() {
    assertEquals("p cnf 3 0\n", DimacsWriter.toDimacs(new SatFormula(), 3));
  }

  @Test
  public void rejectsUndeclaredVariables() {
    SatFormula formula = new SatFormula();
    formula.addClause(1, 7);
    assertThrows(IllegalArgumentException.class, () -> DimacsWriter.toDimacs(formula, 6));
  }

  @Test
  public void formulaRejectsZeroLiteral() {
    assertThrows(IllegalArgumentException.class, () -> new SatFormula().addClause(1, 0));
  }

  @Test
  public void mergedFormulasKeepOrder() {
    SatFormula a = new SatFormula();
    a.addClause(1);
    SatFormula b = new SatFormula();
    b.addClause(-2, 3);
    a.addAll(b);
    assertEquals(2, a.size());
    assertArrayEquals(new int[] { -2, 3 }, a.getClauses().get(1));
    assertEquals(3, a.getMaxVariable());
  }
}
