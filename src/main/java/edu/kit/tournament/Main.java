package edu.kit.tournament;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import edu.kit.tournament.encoding.TournamentEncoding;
import edu.kit.tournament.sat.DimacsWriter;
import edu.kit.tournament.scheduling.InvalidInputException;
import edu.kit.tournament.scheduling.Scheduler;
import edu.kit.tournament.scheduling.SchedulingResult;
import edu.kit.tournament.util.Logger;

public class Main {

  private static final int EXIT_SOLVED = 0;
  private static final int EXIT_UNSATISFIABLE = 1;
  private static final int EXIT_ERROR = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    Configuration config;
    try {
      config = Configuration.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      return EXIT_ERROR;
    }
    Logger.init(config.verbosityLevel);
    Logger.log(Logger.INFO, "Configuration: " + config);

    Scheduler scheduler = new Scheduler(config);
    SchedulingResult result;
    try {
      TournamentEncoding encoding = scheduler.build(config.numTeams);
      if (config.cnfOutputFile != null) {
        try (FileWriter writer = new FileWriter(config.cnfOutputFile, StandardCharsets.US_ASCII)) {
          DimacsWriter.write(encoding.getFormula(), encoding.getNumVariables(), writer);
        }
        Logger.log(Logger.INFO, "Wrote formula to " + config.cnfOutputFile);
      }
      result = scheduler.solveEncoding();
    } catch (InvalidInputException e) {
      Logger.log(Logger.ERROR, e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      Logger.log(Logger.ERROR, "Could not write formula to " + config.cnfOutputFile + ": " + e.getMessage());
      return EXIT_ERROR;
    }

    switch (result.getState()) {
    case SOLVED:
      System.out.println("Schedule for " + config.numTeams + " teams:");
      System.out.print(result.getSchedule());
      return EXIT_SOLVED;
    case UNSATISFIABLE:
      System.out.println("No solution found!");
      return EXIT_UNSATISFIABLE;
    default:
      Logger.log(Logger.ESSENTIAL, "Scheduling failed: " + result.getFailure().getMessage());
      return EXIT_ERROR;
    }
  }
}
