package edu.kit.tournament.sat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.sat4j.minisat.SolverFactory;
import org.sat4j.reader.DimacsReader;
import org.sat4j.reader.ParseFormatException;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.IProblem;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import edu.kit.tournament.Configuration;
import edu.kit.tournament.util.Logger;

/**
 * Runs SAT4J in the calling thread. A fresh solver instance is created for
 * every call.
 */
public class Sat4jSatSolver implements SatSolver {

  private final int timeoutSeconds;

  public Sat4jSatSolver(Configuration config) {
    this(config.solverTimeoutSeconds);
  }

  public Sat4jSatSolver(int timeoutSeconds) {
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("Solver timeout must be positive");
    }
    this.timeoutSeconds = timeoutSeconds;
  }

  @Override
  public Verdict solve(String dimacs) throws SolverInvocationException, SolverTimeoutException {
    ISolver solver = SolverFactory.newDefault();
    solver.setTimeout(timeoutSeconds);
    DimacsReader reader = new DimacsReader(solver);
    try {
      IProblem problem = reader.parseInstance(
          new ByteArrayInputStream(dimacs.getBytes(StandardCharsets.US_ASCII)));
      if (problem.isSatisfiable()) {
        return Verdict.satisfiable(problem.model());
      }
      return Verdict.unsatisfiable();
    } catch (ContradictionException e) {
      // Detected while loading the clauses
      Logger.log(Logger.DEBUG, "Formula is trivially unsatisfiable: " + e.getMessage());
      return Verdict.unsatisfiable();
    } catch (TimeoutException e) {
      throw new SolverTimeoutException("SAT4J exceeded " + timeoutSeconds + "s", e);
    } catch (ParseFormatException | IOException e) {
      throw new SolverInvocationException("SAT4J rejected the formula: " + e.getMessage(), e);
    } finally {
      solver.reset();
    }
  }
}
