package dev.hermes;

import java.io.PrintStream;

public class Errors {
  private Errors() {}

  public static String format(HermesError error) {
    if (error.column > 0) {
      return String.format(
          "%s: [line %d, column %d] %s", error.kind(), error.line,
          error.column, error.getMessage()
      );
    }
    return String.format(
        "%s: [line %d] %s", error.kind(), error.line, error.getMessage()
    );
  }

  public static void report(HermesError error) { report(error, System.err); }

  public static void report(HermesError error, PrintStream err) {
    err.println(format(error));
    err.flush();
  }

  public static void fail(String message, PrintStream err) {
    err.println("Error: " + message);
    err.flush();
  }
}
