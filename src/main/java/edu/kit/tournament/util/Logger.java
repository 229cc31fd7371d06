package edu.kit.tournament.util;

/**
 * Minimal static logger. Messages are printed with the seconds elapsed
 * since {@link #init(int)} if their level does not exceed the configured
 * verbosity.
 */
public class Logger {

  public static final int ESSENTIAL = 0;
  public static final int ERROR = 1;
  public static final int WARN = 2;
  public static final int INFO = 3;
  public static final int DEBUG = 4;

  private static volatile int verbosityLevel = WARN;
  private static volatile long startTimeMillis = System.currentTimeMillis();

  private Logger() {
  }

  public static void init(int verbosityLevel) {
    Logger.verbosityLevel = verbosityLevel;
    startTimeMillis = System.currentTimeMillis();
  }

  public static void log(int level, String message) {
    if (level > verbosityLevel) {
      return;
    }
    double elapsed = (System.currentTimeMillis() - startTimeMillis) * 0.001;
    String line = String.format("[%.3f] %s%s", elapsed, prefix(level), message);
    if (level <= ERROR) {
      System.err.println(line);
    } else {
      System.out.println(line);
    }
  }

  private static String prefix(int level) {
    switch (level) {
    case ERROR:
      return "ERROR: ";
    case WARN:
      return "WARN: ";
    case DEBUG:
      return "DEBUG: ";
    default:
      return "";
    }
  }
}
