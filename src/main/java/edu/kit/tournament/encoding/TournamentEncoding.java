package edu.kit.tournament.encoding;

import edu.kit.tournament.sat.DimacsWriter;
import edu.kit.tournament.sat.SatFormula;

/**
 * The complete CNF of one tournament together with the numbering it was
 * built with. Variables 1..{@code indexer.getNumVariables()} are facts, the
 * remaining ones up to {@link #getNumVariables()} are auxiliary.
 */
public final class TournamentEncoding {

  private final VariableIndexer indexer;
  private final SatFormula formula;
  private final int numVariables;

  public TournamentEncoding(VariableIndexer indexer, SatFormula formula, int numVariables) {
    if (numVariables < indexer.getNumVariables()) {
      throw new EncodingException("Declared " + numVariables + " variables but the indexer uses "
          + indexer.getNumVariables());
    }
    int maxVariable = formula.getMaxVariable();
    if (maxVariable > numVariables) {
      throw new EncodingException("Clause mentions variable " + maxVariable + " beyond the "
          + numVariables + " declared ones");
    }
    this.indexer = indexer;
    this.formula = formula;
    this.numVariables = numVariables;
  }

  public VariableIndexer getIndexer() {
    return indexer;
  }

  public SatFormula getFormula() {
    return formula;
  }

  public int getNumVariables() {
    return numVariables;
  }

  public int getNumAuxiliaryVariables() {
    return numVariables - indexer.getNumVariables();
  }

  public String toDimacs() {
    return DimacsWriter.toDimacs(formula, numVariables);
  }
}
