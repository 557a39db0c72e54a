package dev.hermes.parsing;

import dev.hermes.HermesError;

public class SyntaxError extends HermesError {
  public final Token token;

  public SyntaxError(Token token, String message) {
    super(message, token.line, token.column);
    this.token = token;
  }

  @Override
  public String kind() {
    return "Syntax Error";
  }
}
