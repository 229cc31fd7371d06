package edu.kit.tournament.scheduling;

import edu.kit.tournament.Configuration;
import edu.kit.tournament.TournamentException;
import edu.kit.tournament.encoding.ConstraintBuilder;
import edu.kit.tournament.encoding.ResultDecoder;
import edu.kit.tournament.encoding.TournamentEncoding;
import edu.kit.tournament.encoding.VariableIndexer;
import edu.kit.tournament.model.InvariantViolationException;
import edu.kit.tournament.model.Schedule;
import edu.kit.tournament.sat.ParseException;
import edu.kit.tournament.sat.SatFormula;
import edu.kit.tournament.sat.SatSolver;
import edu.kit.tournament.sat.SolverInvocationException;
import edu.kit.tournament.sat.SolverTimeoutException;
import edu.kit.tournament.sat.VariableCounter;
import edu.kit.tournament.sat.Verdict;
import edu.kit.tournament.util.Logger;

/**
 * Computes a round-robin schedule for an even number of teams by encoding
 * the tournament rules as CNF, handing the formula to a {@link SatSolver}
 * and decoding its answer.
 * <p>
 * A scheduler performs a single attempt: {@link #build(int)} followed by
 * {@link #solveEncoding()}, or both at once via {@link #solve(int)}.
 */
public class Scheduler {

  public static final int MIN_TEAMS = 4;

  private final Configuration config;
  private final SatSolver solver;

  private SchedulerState state = SchedulerState.UNBUILT;
  private TournamentEncoding encoding;

  public Scheduler(Configuration config, SatSolver solver) {
    this.config = config;
    this.solver = solver;
  }

  public Scheduler(Configuration config) {
    this(config, SatSolver.getSolver(config));
  }

  public SchedulerState getState() {
    return state;
  }

  public SchedulingResult solve(int numTeams) throws InvalidInputException {
    build(numTeams);
    return solveEncoding();
  }

  /**
   * Encodes the tournament rules for the given number of teams.
   */
  public TournamentEncoding build(int numTeams) throws InvalidInputException {
    expectState(SchedulerState.UNBUILT);
    if (numTeams % 2 != 0) {
      throw new InvalidInputException("Number of teams must be even, got " + numTeams);
    }
    if (numTeams < MIN_TEAMS) {
      throw new InvalidInputException("Number of teams must be at least " + MIN_TEAMS + ", got " + numTeams);
    }

    long start = System.currentTimeMillis();
    VariableIndexer indexer = new VariableIndexer(numTeams);
    VariableCounter counter = new VariableCounter(indexer.getNumVariables());
    ConstraintBuilder builder = new ConstraintBuilder(indexer, config.atMostOneEncoding);

    SatFormula formula = new SatFormula();
    formula.addAll(builder.exactlyOnePerTeamPerWeek(counter));
    formula.addAll(builder.exactlyOncePerPair(counter));
    formula.addAll(builder.slotExclusivity(counter));
    formula.addAll(builder.periodCardinality(counter));
    encoding = new TournamentEncoding(indexer, formula, counter.getHighest());

    Logger.log(Logger.INFO, "Encoded " + numTeams + " teams in " + (System.currentTimeMillis() - start) + "ms: "
        + indexer.getNumVariables() + " match variables, " + encoding.getNumAuxiliaryVariables()
        + " auxiliary variables, " + formula.size() + " clauses");
    state = SchedulerState.BUILT;
    return encoding;
  }

  /**
   * Hands the built formula to the solver and decodes its answer.
   */
  public SchedulingResult solveEncoding() {
    expectState(SchedulerState.BUILT);
    String dimacs = encoding.toDimacs();
    state = SchedulerState.AWAITING_SOLVER;

    long start = System.currentTimeMillis();
    Verdict verdict;
    try {
      verdict = solver.solve(dimacs);
    } catch (SolverInvocationException | SolverTimeoutException | ParseException e) {
      return fail(e);
    }
    Logger.log(Logger.INFO, "Solver answered " + verdict + " after " + (System.currentTimeMillis() - start) + "ms");

    if (!verdict.isSatisfiable()) {
      state = SchedulerState.UNSATISFIABLE;
      return SchedulingResult.unsatisfiable();
    }
    try {
      Schedule schedule = new ResultDecoder(encoding.getIndexer()).decode(verdict);
      state = SchedulerState.SOLVED;
      return SchedulingResult.solved(schedule);
    } catch (InvariantViolationException e) {
      return fail(e);
    }
  }

  public TournamentEncoding getEncoding() {
    if (encoding == null) {
      throw new IllegalStateException("Nothing built yet");
    }
    return encoding;
  }

  private SchedulingResult fail(TournamentException e) {
    Logger.log(Logger.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
    state = SchedulerState.FAILED;
    return SchedulingResult.failed(e);
  }

  private void expectState(SchedulerState expected) {
    if (state != expected) {
      throw new IllegalStateException("Scheduler is " + state + ", expected " + expected
          + "; use a new scheduler for every attempt");
    }
  }
}
