package edu.kit.tournament.encoding;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import edu.kit.tournament.TestSchedules;
import edu.kit.tournament.model.Fact;
import edu.kit.tournament.model.InvariantViolationException;
import edu.kit.tournament.model.Match;
import edu.kit.tournament.model.Schedule;
import edu.kit.tournament.model.Slot;
import edu.kit.tournament.sat.Verdict;

import static org.junit.jupiter.api.Assertions.*;

public class ResultDecoderTest {

  private final VariableIndexer indexer = new VariableIndexer(6);
  private final ResultDecoder decoder = new ResultDecoder(indexer);

  private List<Integer> trueFacts(int[][][] grid) {
    List<Integer> literals = new ArrayList<>();
    Match[][] matches = TestSchedules.toMatches(grid);
    for (int w = 1; w <= matches.length; w++) {
      for (int p = 1; p <= matches[w - 1].length; p++) {
        if (matches[w - 1][p - 1] != null) {
          literals.add(indexer.idFor(Fact.ofMatch(w, p, matches[w - 1][p - 1])));
        }
      }
    }
    return literals;
  }

  private static Verdict verdict(List<Integer> literals) {
    return Verdict.satisfiable(literals.stream().mapToInt(x -> x).toArray());
  }

  @Test
  public void decodesMatchesAndIgnoresAuxiliaryVariables() throws InvariantViolationException {
    List<Integer> literals = trueFacts(TestSchedules.SIX_TEAMS);
    literals.add(-indexer.idFor(1, 2, 1, 1, Slot.HOME));
    literals.add(indexer.getNumVariables() + 1);
    literals.add(indexer.getNumVariables() + 17);
    Schedule schedule = decoder.decode(verdict(literals));

    Schedule expected = TestSchedules.sixTeams();
    for (int w = 1; w <= 5; w++) {
      for (int p = 1; p <= 3; p++) {
        assertEquals(expected.getMatch(w, p), schedule.getMatch(w, p));
      }
    }
  }

  @Test
  public void keepsHomeAndAwayOrientation() throws InvariantViolationException {
    Schedule schedule = decoder.decode(verdict(trueFacts(TestSchedules.SIX_TEAMS)));
    assertEquals(new Match(4, 6), schedule.getMatch(4, 2));
    assertNotEquals(new Match(6, 4), schedule.getMatch(4, 2));
  }

  @Test
  public void rejectsTwoMatchesInOneCell() {
    List<Integer> literals = trueFacts(TestSchedules.SIX_TEAMS);
    literals.add(indexer.idFor(2, 3, 1, 1, Slot.HOME));
    InvariantViolationException e = assertThrows(InvariantViolationException.class,
        () -> decoder.decode(verdict(literals)));
    assertTrue(e.getMessage().startsWith("Week 1, period 1 holds both"), e.getMessage());
  }

  @Test
  public void rejectsIncompleteSchedule() {
    int[][][] grid = TestSchedules.copy(TestSchedules.SIX_TEAMS);
    grid[3][0] = null;
    assertThrows(InvariantViolationException.class, () -> decoder.decode(verdict(trueFacts(grid))));
  }

  @Test
  public void refusesUnsatisfiableVerdict() {
    assertThrows(IllegalArgumentException.class, () -> decoder.decode(Verdict.unsatisfiable()));
  }
}
