package dev.hermes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Executes translated code with an external Python interpreter, sharing
// this process's stdin, stdout and stderr.
public class PythonRunner {
  private static final Logger logger =
      LoggerFactory.getLogger(PythonRunner.class);

  static final String PROPERTY = "hermes.python";
  static final String ENVIRONMENT = "HERMES_PYTHON";
  static final String DEFAULT_INTERPRETER = "python3";

  private final String interpreter;

  public PythonRunner() { this(defaultInterpreter()); }

  public PythonRunner(String interpreter) { this.interpreter = interpreter; }

  public String interpreter() { return interpreter; }

  static String defaultInterpreter() {
    String configured = System.getProperty(PROPERTY);
    if (configured != null && !configured.isBlank())
      return configured;

    configured = System.getenv(ENVIRONMENT);
    if (configured != null && !configured.isBlank())
      return configured;

    return DEFAULT_INTERPRETER;
  }

  // post-condition: returns the interpreter's exit code; the temporary
  // script is deleted whatever happens
  public int run(String python) throws IOException, InterruptedException {
    Path script = Files.createTempFile("hermes-", ".py");
    try {
      Files.writeString(script, python, StandardCharsets.UTF_8);
      logger.debug("running {} {}", interpreter, script);

      Process process = new ProcessBuilder(interpreter, script.toString())
                            .inheritIO()
                            .start();
      return process.waitFor();
    } finally {
      Files.deleteIfExists(script);
    }
  }
}
