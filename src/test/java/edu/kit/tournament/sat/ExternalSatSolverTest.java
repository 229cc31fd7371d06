package edu.kit.tournament.sat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class ExternalSatSolverTest {

  private static final String FORMULA = "p cnf 2 1\n1 -2 0\n";

  @TempDir
  Path dir;

  private Path seen;

  @BeforeEach
  public void requireShell() {
    assumeTrue(new File("/bin/sh").canExecute(), "needs /bin/sh");
    seen = dir.resolve("seen");
  }

  /**
   * Creates an executable script; {@code $cnf} holds the formula path and
   * the path is also recorded in the file {@link #seen}.
   */
  private String script(String body) throws IOException {
    Path file = Files.createTempFile(dir, "solver", ".sh");
    String text = "#!/bin/sh\n"
        + "for cnf; do :; done\n"
        + "echo \"$cnf\" > '" + seen + "'\n"
        + body + "\n";
    Files.writeString(file, text, StandardCharsets.US_ASCII);
    assertTrue(file.toFile().setExecutable(true));
    return file.toString();
  }

  private ExternalSatSolver solver(String executable, int timeoutSeconds) {
    return new ExternalSatSolver(executable, List.of("-model"), timeoutSeconds, 1);
  }

  private void assertFormulaFileDeleted() throws IOException {
    String cnfPath = Files.readString(seen, StandardCharsets.US_ASCII).trim();
    assertFalse(cnfPath.isEmpty());
    assertFalse(new File(cnfPath).exists(), "temporary formula file was not deleted");
  }

  @Test
  public void readsSatisfiableAnswer() throws Exception {
    String exe = script("[ \"$1\" = \"-model\" ] || exit 5\n"
        + "grep -q '^p cnf 2 1$' \"$cnf\" || exit 6\n"
        + "echo 'c fake solver'\n"
        + "echo 's SATISFIABLE'\n"
        + "echo 'v 1 -2 0'\n"
        + "exit 10");
    Verdict verdict = solver(exe, 10).solve(FORMULA);
    assertTrue(verdict.isSatisfiable());
    assertTrue(verdict.isTrue(1));
    assertFalse(verdict.isTrue(2));
    assertFormulaFileDeleted();
  }

  @Test
  public void readsUnsatisfiableAnswer() throws Exception {
    String exe = script("echo 's UNSATISFIABLE'\nexit 20");
    assertFalse(solver(exe, 10).solve(FORMULA).isSatisfiable());
    assertFormulaFileDeleted();
  }

  @Test
  public void killsSolverAfterTimeout() throws Exception {
    String exe = script("sleep 30");
    long start = System.currentTimeMillis();
    assertThrows(SolverTimeoutException.class, () -> solver(exe, 1).solve(FORMULA));
    assertTrue(System.currentTimeMillis() - start < 20000);
    assertFormulaFileDeleted();
  }

  @Test
  public void unexpectedExitCodeIsInvocationError() throws Exception {
    String exe = script("echo boom >&2\nexit 3");
    SolverInvocationException e = assertThrows(SolverInvocationException.class,
        () -> solver(exe, 10).solve(FORMULA));
    assertTrue(e.getMessage().contains("boom"), e.getMessage());
    assertFormulaFileDeleted();
  }

  @Test
  public void unparsableOutputIsParseError() throws Exception {
    String exe = script("echo 's SATISFIABLE'\necho 'v 1 -2'\nexit 10");
    assertThrows(ParseException.class, () -> solver(exe, 10).solve(FORMULA));
    assertFormulaFileDeleted();
  }

  @Test
  public void exitCodeMustMatchStatus() throws Exception {
    String exe = script("echo 's UNSATISFIABLE'\nexit 10");
    assertThrows(ParseException.class, () -> solver(exe, 10).solve(FORMULA));
  }

  @Test
  public void undecodableBytesInCommentsAreTolerated() throws Exception {
    String exe = script("printf 'c \\377\\376 banner\\ns SATISFIABLE\\nv 1 -2 0\\n'\nexit 10");
    Verdict verdict = solver(exe, 10).solve(FORMULA);
    assertTrue(verdict.isTrue(1));
    assertFalse(verdict.isTrue(2));
    assertFormulaFileDeleted();
  }

  @Test
  public void undecodableBytesInValuesAreParseError() throws Exception {
    String exe = script("printf 's SATISFIABLE\\nv 1 \\377 0\\n'\nexit 10");
    assertThrows(ParseException.class, () -> solver(exe, 10).solve(FORMULA));
    assertFormulaFileDeleted();
  }

  @Test
  public void launchFailureIsRetriedThenReported() throws Exception {
    // executable file whose interpreter does not exist: found on disk, but the process cannot start
    Path file = dir.resolve("broken-solver");
    Files.writeString(file, "#!" + dir.resolve("no-such-interpreter") + "\n", StandardCharsets.US_ASCII);
    assertTrue(file.toFile().setExecutable(true));
    assertEquals(file.toFile(), ExternalSatSolver.locateExecutable(file.toString()));

    Set<String> before = leftoverTempFiles();
    SolverInvocationException e = assertThrows(SolverInvocationException.class,
        () -> new ExternalSatSolver(file.toString(), List.of("-model"), 10, 2).solve(FORMULA));
    assertTrue(e.getMessage().startsWith("Could not start solver"), e.getMessage());
    assertInstanceOf(IOException.class, e.getCause());

    Set<String> after = leftoverTempFiles();
    after.removeAll(before);
    assertEquals(Collections.emptySet(), after);
  }

  private static Set<String> leftoverTempFiles() {
    Set<String> names = new HashSet<>();
    String[] files = new File(System.getProperty("java.io.tmpdir")).list();
    if (files != null) {
      for (String name : files) {
        if (name.startsWith("tournament")) {
          names.add(name);
        }
      }
    }
    return names;
  }

  @Test
  public void missingExecutable() {
    assertThrows(SolverInvocationException.class,
        () -> solver(dir.resolve("no-such-solver").toString(), 10).solve(FORMULA));
    assertThrows(SolverInvocationException.class,
        () -> new ExternalSatSolver("no-such-solver-on-path-4711", Collections.emptyList(), 10, 0)
            .solve(FORMULA));
  }

  @Test
  public void findsExecutableOnPath() throws Exception {
    assertEquals(new File("/bin/sh").getName(), ExternalSatSolver.locateExecutable("sh").getName());
  }
}
