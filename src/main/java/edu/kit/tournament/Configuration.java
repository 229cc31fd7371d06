package edu.kit.tournament;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.kit.tournament.util.Logger;

/**
 * Options of a scheduling run. Fields are public and may be set directly;
 * {@link #parse(String[])} fills them from command line arguments.
 */
public class Configuration {

  public enum SolverType {
    sat4j, external;
  }

  public enum AtMostOneEncoding {
    pairwise, sequential;
  }

  public static final String USAGE = "Usage: tournament-scheduler <numTeams>"
      + " [--solver sat4j|external] [--solver-executable <path>]"
      + " [--solver-args \"<args>\"] [--timeout <seconds>] [--retries <n>]"
      + " [--amo pairwise|sequential] [--output-cnf <file>] [--verbosity <0-4>]";

  public int numTeams = -1;

  public SolverType solverType = SolverType.sat4j;
  public String solverExecutable = "glucose-syrup";
  public List<String> solverArguments = new ArrayList<>(Arrays.asList("-model"));

  /* Budget for a single solver call, must be positive */
  public int solverTimeoutSeconds = 60;

  /* Extra attempts after a failed process launch; timeouts are never retried */
  public int launchRetries = 1;

  public AtMostOneEncoding atMostOneEncoding = AtMostOneEncoding.pairwise;

  public String cnfOutputFile = null;

  public int verbosityLevel = Logger.INFO;

  public static Configuration parse(String[] args) {
    Configuration config = new Configuration();
    int i = 0;
    while (i < args.length) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        if (config.numTeams != -1) {
          throw new IllegalArgumentException("Unexpected argument \"" + arg + "\"\n" + USAGE);
        }
        config.numTeams = parseInt(arg, "number of teams");
        i++;
        continue;
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Missing value for " + arg + "\n" + USAGE);
      }
      String value = args[i + 1];
      switch (arg) {
      case "--solver":
        config.solverType = parseEnum(SolverType.class, value, arg);
        break;
      case "--solver-executable":
        config.solverExecutable = value;
        break;
      case "--solver-args":
        config.solverArguments = new ArrayList<>();
        for (String token : value.trim().split("\\s+")) {
          if (!token.isEmpty()) {
            config.solverArguments.add(token);
          }
        }
        break;
      case "--timeout":
        config.solverTimeoutSeconds = parseInt(value, arg);
        break;
      case "--retries":
        config.launchRetries = parseInt(value, arg);
        break;
      case "--amo":
        config.atMostOneEncoding = parseEnum(AtMostOneEncoding.class, value, arg);
        break;
      case "--output-cnf":
        config.cnfOutputFile = value;
        break;
      case "--verbosity":
        config.verbosityLevel = parseInt(value, arg);
        break;
      default:
        throw new IllegalArgumentException("Unknown option " + arg + "\n" + USAGE);
      }
      i += 2;
    }
    if (config.numTeams == -1) {
      throw new IllegalArgumentException("Number of teams not specified\n" + USAGE);
    }
    if (config.solverTimeoutSeconds <= 0) {
      throw new IllegalArgumentException("Solver timeout must be positive");
    }
    if (config.launchRetries < 0) {
      throw new IllegalArgumentException("Number of retries must not be negative");
    }
    return config;
  }

  private static int parseInt(String value, String what) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + what + ": \"" + value + "\"\n" + USAGE, e);
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String option) {
    try {
      return Enum.valueOf(type, value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value for " + option + ": \"" + value + "\"\n" + USAGE, e);
    }
  }

  @Override
  public String toString() {
    return "numTeams=" + numTeams + ", solver=" + solverType
        + (solverType == SolverType.external ? " (" + solverExecutable + " " + solverArguments + ")" : "")
        + ", timeout=" + solverTimeoutSeconds + "s, amo=" + atMostOneEncoding;
  }
}
