package dev.hermes.codegen;

import java.util.ArrayList;
import java.util.List;

// Collects output lines, each prefixed with the current indentation.
class IndentingWriter {
  private static final int INDENT_SIZE = 4;

  private final List<String> lines = new ArrayList<>();
  private int indentation = 0;

  void indent() { this.indentation += INDENT_SIZE; }

  void dedent() { this.indentation -= INDENT_SIZE; }

  void println(String s) { lines.add(" ".repeat(this.indentation) + s); }

  void println(String format, Object... args) {
    println(String.format(format, args));
  }

  // lines joined with '\n', without a trailing newline
  @Override
  public String toString() {
    return String.join("\n", lines);
  }
}
