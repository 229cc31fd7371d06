package edu.kit.tournament.sat;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import edu.kit.tournament.Configuration;
import edu.kit.tournament.util.Logger;

/**
 * Calls a solver executable that reads a DIMACS file given as its last
 * argument and prints its answer in SAT competition format on stdout
 * (for example {@code glucose-syrup -model}).
 * <p>
 * The formula and the solver output go through temporary files which are
 * deleted before {@link #solve(String)} returns.
 */
public class ExternalSatSolver implements SatSolver {

  private static final int EXIT_UNKNOWN = 0;
  private static final int EXIT_SATISFIABLE = 10;
  private static final int EXIT_UNSATISFIABLE = 20;
  // maps every byte to a char, so stray bytes end up in the parser instead of failing the read
  private static final Charset OUTPUT_CHARSET = StandardCharsets.ISO_8859_1;

  private final String executable;
  private final List<String> arguments;
  private final int timeoutSeconds;
  private final int launchRetries;

  public ExternalSatSolver(Configuration config) {
    this(config.solverExecutable, config.solverArguments, config.solverTimeoutSeconds, config.launchRetries);
  }

  public ExternalSatSolver(String executable, List<String> arguments, int timeoutSeconds, int launchRetries) {
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("Solver timeout must be positive");
    }
    this.executable = executable;
    this.arguments = new ArrayList<>(arguments);
    this.timeoutSeconds = timeoutSeconds;
    this.launchRetries = launchRetries;
  }

  @Override
  public Verdict solve(String dimacs) throws SolverInvocationException, SolverTimeoutException, ParseException {
    File solverFile = locateExecutable(executable);
    File cnfFile = null;
    File outFile = null;
    File errFile = null;
    try {
      cnfFile = File.createTempFile("tournament", ".cnf");
      outFile = File.createTempFile("tournament", ".out");
      errFile = File.createTempFile("tournament", ".err");
      try (FileWriter writer = new FileWriter(cnfFile, StandardCharsets.US_ASCII)) {
        writer.write(dimacs);
      }

      List<String> command = new ArrayList<>();
      command.add(solverFile.getPath());
      command.addAll(arguments);
      command.add(cnfFile.getPath());
      ProcessBuilder builder = new ProcessBuilder(command)
          .redirectOutput(outFile)
          .redirectError(errFile);

      Logger.log(Logger.INFO, "Running " + String.join(" ", command));
      long start = System.currentTimeMillis();
      Process proc = launch(builder);
      if (!proc.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        proc.destroyForcibly();
        proc.waitFor();
        throw new SolverTimeoutException(solverFile.getName() + " did not finish within " + timeoutSeconds + "s");
      }
      int exitCode = proc.exitValue();
      Logger.log(Logger.INFO, "Solver finished with exit code " + exitCode + " after "
          + (System.currentTimeMillis() - start) + "ms");
      if (exitCode != EXIT_SATISFIABLE && exitCode != EXIT_UNSATISFIABLE && exitCode != EXIT_UNKNOWN) {
        String stderr = Files.readString(errFile.toPath(), OUTPUT_CHARSET).trim();
        throw new SolverInvocationException(solverFile.getName() + " exited with code " + exitCode
            + (stderr.isEmpty() ? "" : ": " + stderr));
      }

      Verdict verdict = SolverAnswerParser.parse(Files.readString(outFile.toPath(), OUTPUT_CHARSET));
      if ((exitCode == EXIT_SATISFIABLE && !verdict.isSatisfiable())
          || (exitCode == EXIT_UNSATISFIABLE && verdict.isSatisfiable())) {
        throw new ParseException("Exit code " + exitCode + " contradicts reported status " + verdict);
      }
      return verdict;
    } catch (IOException e) {
      throw new SolverInvocationException("Error calling external solver: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SolverInvocationException("Interrupted while waiting for the solver", e);
    } finally {
      delete(cnfFile);
      delete(outFile);
      delete(errFile);
    }
  }

  private Process launch(ProcessBuilder builder) throws SolverInvocationException {
    IOException lastFailure = null;
    for (int attempt = 0; attempt <= launchRetries; attempt++) {
      try {
        return builder.start();
      } catch (IOException e) {
        lastFailure = e;
        Logger.log(Logger.WARN, "Could not start solver (attempt " + (attempt + 1) + "): " + e.getMessage());
      }
    }
    throw new SolverInvocationException("Could not start solver " + builder.command().get(0), lastFailure);
  }

  /**
   * Resolves the executable either as a path (if it contains a separator)
   * or by searching the directories on {@code PATH}.
   */
  static File locateExecutable(String executable) throws SolverInvocationException {
    if (executable == null || executable.isEmpty()) {
      throw new SolverInvocationException("No solver executable configured");
    }
    if (executable.contains(File.separator)) {
      File file = new File(executable);
      if (file.isFile() && file.canExecute()) {
        return file;
      }
      throw new SolverInvocationException("Solver executable not found: " + executable);
    }
    String path = System.getenv("PATH");
    if (path != null) {
      for (String dir : path.split(File.pathSeparator)) {
        File file = new File(dir, executable);
        if (file.isFile() && file.canExecute()) {
          return file;
        }
      }
    }
    throw new SolverInvocationException("Solver executable \"" + executable + "\" not found on PATH");
  }

  private static void delete(File file) {
    if (file != null && file.exists() && !file.delete()) {
      Logger.log(Logger.WARN, "Could not delete temporary file " + file);
    }
  }
}
