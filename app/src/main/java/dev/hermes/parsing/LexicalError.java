package dev.hermes.parsing;

import dev.hermes.HermesError;

public class LexicalError extends HermesError {
  public LexicalError(String message, int line, int column) {
    super(message, line, column);
  }

  @Override
  public String kind() {
    return "Lexical Error";
  }
}
