package edu.kit.tournament.encoding;

import edu.kit.tournament.model.Fact;
import edu.kit.tournament.model.InvariantViolationException;
import edu.kit.tournament.model.Match;
import edu.kit.tournament.model.Schedule;
import edu.kit.tournament.model.ScheduleValidator;
import edu.kit.tournament.sat.Verdict;

/**
 * Turns a satisfying assignment back into a schedule. Only fact variables
 * are read; auxiliary variables are ignored. The result is validated before
 * it is returned.
 */
public class ResultDecoder {

  private final VariableIndexer indexer;

  public ResultDecoder(VariableIndexer indexer) {
    this.indexer = indexer;
  }

  public Schedule decode(Verdict verdict) throws InvariantViolationException {
    if (!verdict.isSatisfiable()) {
      throw new IllegalArgumentException("Cannot decode an unsatisfiable verdict");
    }
    Match[][] matches = new Match[indexer.getNumWeeks()][indexer.getNumPeriods()];
    for (int var = 1; var <= indexer.getNumVariables(); var++) {
      if (!verdict.isTrue(var)) {
        continue;
      }
      Fact fact = indexer.factFor(var);
      if (indexer.idFor(fact) != var) {
        throw new EncodingException("Variable " + var + " decodes to " + fact
            + " which is numbered " + indexer.idFor(fact));
      }
      Match existing = matches[fact.getWeek() - 1][fact.getPeriod() - 1];
      if (existing != null) {
        throw new InvariantViolationException("Week " + fact.getWeek() + ", period " + fact.getPeriod()
            + " holds both " + existing + " and " + fact.toMatch());
      }
      matches[fact.getWeek() - 1][fact.getPeriod() - 1] = fact.toMatch();
    }
    Schedule schedule = new Schedule(indexer.getNumTeams(), matches);
    ScheduleValidator.validate(schedule);
    return schedule;
  }
}
