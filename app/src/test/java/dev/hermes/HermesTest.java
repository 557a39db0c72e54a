package dev.hermes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HermesTest {
  // stands in for the Python interpreter
  static class RecordingRunner extends PythonRunner {
    String python;
    int exitCode = 0;

    RecordingRunner() { super("python-for-tests"); }

    @Override
    public int run(String python) {
      this.python = python;
      return exitCode;
    }
  }

  @TempDir Path directory;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private RecordingRunner runner;
  private Hermes hermes;

  @BeforeEach
  void setUp() {
    runner = new RecordingRunner();
    hermes = new Hermes(
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8), runner
    );
  }

  private String out() { return out.toString(StandardCharsets.UTF_8); }

  private String err() { return err.toString(StandardCharsets.UTF_8); }

  private Path write(String name, String source) throws IOException {
    return Files.writeString(directory.resolve(name), source);
  }

  @Test
  void checkReportsValidFile() throws IOException {
    Path file = write("ok.herm", "x = 1\n");

    int status = hermes.execute("check", file.toString());

    assertThat(status, is(0));
    assertThat(out(), is("OK: " + file + System.lineSeparator()));
  }

  @Test
  void checkReportsErrorsWithPosition() throws IOException {
    Path file = write("bad.herm", "scheme f(:\n    x\n");

    int status = hermes.execute("check", file.toString());

    assertThat(status, is(Hermes.EX_DATAERR));
    assertThat(
        err(), startsWith("Syntax Error: [line 1, column 10] Expected IDENTIFIER, got COLON.")
    );
    assertThat(out(), is(emptyString()));
  }

  @Test
  void compilePrintsPython() throws IOException {
    Path file = write("hello.herm", "announce(\"hi\")\n");

    int status = hermes.execute("compile", file.toString());

    assertThat(status, is(0));
    assertThat(out(), is("print(\"hi\")" + System.lineSeparator()));
  }

  @Test
  void compileWritesOutputFile() throws IOException {
    Path file = write("hello.herm", "announce(\"hi\")\n");
    Path target = directory.resolve("hello.py");

    int status = hermes.execute("compile", file.toString(), "-o", target.toString());

    assertThat(status, is(0));
    assertThat(Files.readString(target), is("print(\"hi\")\n"));
    assertThat(out(), containsString("Compiled to: " + target));
  }

  @Test
  void compileCanPrintTheTree() throws IOException {
    Path file = write("sum.herm", "x = 1 + 2\n");

    int status = hermes.execute("compile", "--ast", file.toString());

    assertThat(status, is(0));
    assertThat(out(), containsString("(= x (+ 1 2))"));
  }

  @Test
  void runHandsTranslationToPython() throws IOException {
    Path file = write("hello.herm", "announce(\"hi\")\n");
    runner.exitCode = 3;

    int status = hermes.execute("run", file.toString());

    assertThat(status, is(3));
    assertThat(runner.python, is("print(\"hi\")"));
    assertThat(out(), is(emptyString()));
  }

  @Test
  void runInDebugModeShowsTranslation() throws IOException {
    Path file = write("hello.herm", "announce(\"hi\")\n");

    hermes.execute("run", "--debug", file.toString());

    assertThat(out(), containsString("=== Translated Python ==="));
    assertThat(out(), containsString("print(\"hi\")"));
  }

  @Test
  void runDoesNotStartPythonOnError() throws IOException {
    Path file = write("bad.herm", "announce(\"hi\n");

    int status = hermes.execute("run", file.toString());

    assertThat(status, is(Hermes.EX_DATAERR));
    assertThat(runner.python, is(nullValue()));
    assertThat(err(), startsWith("Lexical Error: [line 1, column 10] Unterminated string."));
  }

  @Test
  void lenientIndentFlagIsPassedOn() throws IOException {
    Path file = write("indent.herm", "aahaan x:\n        a = 1\n    b = 2\n");

    assertThat(hermes.execute("check", file.toString()), is(Hermes.EX_DATAERR));
    assertThat(
        hermes.execute("check", "--lenient-indent", file.toString()), is(0)
    );
  }

  @Test
  void missingFileIsReported() {
    Path file = directory.resolve("absent.herm");

    int status = hermes.execute("compile", file.toString());

    assertThat(status, is(Hermes.EX_NOINPUT));
    assertThat(err(), containsString("Error: File not found: " + file));
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertThat(hermes.execute(), is(0));
    assertThat(out(), containsString("Usage: hermes"));
  }

  @Test
  void badInvocationsAreUsageErrors() {
    assertThat(hermes.execute("transmogrify"), is(Hermes.EX_USAGE));
    assertThat(hermes.execute("check"), is(Hermes.EX_USAGE));
    assertThat(hermes.execute("check", "a", "b"), is(Hermes.EX_USAGE));
    assertThat(hermes.execute("compile", "a.herm", "-o"), is(Hermes.EX_USAGE));
    assertThat(hermes.execute("check", "--frobnicate", "a.herm"), is(Hermes.EX_USAGE));
    assertThat(err(), containsString("Unknown command transmogrify."));
  }
}
