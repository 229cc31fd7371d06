package edu.kit.tournament.sat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class SolverAnswerParserTest {

  @Test
  public void satisfiableWithAssignmentOverSeveralLines() throws ParseException {
    Verdict verdict = SolverAnswerParser.parse("c glucose\n"
        + "c restarts : 3\n"
        + "s SATISFIABLE\n"
        + "v 1 -2 3\n"
        + "v -4 5 0\n");
    assertTrue(verdict.isSatisfiable());
    assertTrue(verdict.isTrue(1));
    assertFalse(verdict.isTrue(2));
    assertTrue(verdict.isTrue(3));
    assertFalse(verdict.isTrue(4));
    assertTrue(verdict.isTrue(5));
    assertFalse(verdict.isTrue(6));
    assertEquals(5, verdict.getMaxVariable());
  }

  @Test
  public void unsatisfiable() throws ParseException {
    Verdict verdict = SolverAnswerParser.parse("c parsing\ns UNSATISFIABLE\n");
    assertFalse(verdict.isSatisfiable());
  }

  @Test
  public void windowsLineEndings() throws ParseException {
    Verdict verdict = SolverAnswerParser.parse("s SATISFIABLE\r\nv -1 2 0\r\n");
    assertTrue(verdict.isTrue(2));
  }

  @Test
  public void largeVariableNumbersNeedNoDenseModel() throws ParseException {
    Verdict verdict = SolverAnswerParser.parse("s SATISFIABLE\nv 2147483647 -1000000000 3 0\n");
    assertTrue(verdict.isTrue(Integer.MAX_VALUE));
    assertFalse(verdict.isTrue(1000000000));
    assertTrue(verdict.isTrue(3));
    assertFalse(verdict.isTrue(4));
    assertEquals(Integer.MAX_VALUE, verdict.getMaxVariable());
  }

  @Test
  public void verdictRejectsUnrepresentableLiteral() {
    assertThrows(IllegalArgumentException.class, () -> Verdict.satisfiable(new int[] { 1, Integer.MIN_VALUE }));
    assertThrows(IllegalArgumentException.class, () -> Verdict.satisfiable(new int[] { 0 }));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "c only comments\n",
      "v 1 2 0\n",
      "s SATISFIABLE\n",
      "s SATISFIABLE\nv 1 -2 3\n",
      "s SATISFIABLE\nv 1 -2 0\nv 3 0\n",
      "s SATISFIABLE\nv 1 x 0\n",
      "s SATISFIABLE\nv 1 -1 0\n",
      "s SATISFIABLE\nv -2147483648 0\n",
      "s SATISFIABLE\nv 2147483648 0\n",
      "s INDETERMINATE\n",
      "s UNSATISFIABLE\ns SATISFIABLE\n",
      "s UNSATISFIABLE\nv 1 0\n",
  })
  public void malformedAnswers(String answer) {
    assertThrows(ParseException.class, () -> SolverAnswerParser.parse(answer));
  }
}
