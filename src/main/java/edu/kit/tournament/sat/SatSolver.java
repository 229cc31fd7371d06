package edu.kit.tournament.sat;

import edu.kit.tournament.Configuration;

/**
 * Decides a formula given in DIMACS CNF. Implementations own every
 * resource they acquire for a call and release it before returning.
 */
public interface SatSolver {

  Verdict solve(String dimacs) throws SolverInvocationException, SolverTimeoutException, ParseException;

  public static SatSolver getSolver(Configuration config) {
    switch (config.solverType) {
    case sat4j:
      return new Sat4jSatSolver(config);
    case external:
      return new ExternalSatSolver(config);
    default:
      throw new IllegalArgumentException("Unknown solver type " + config.solverType);
    }
  }
}
