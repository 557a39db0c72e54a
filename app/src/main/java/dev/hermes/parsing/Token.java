package dev.hermes.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  // for string literals this is the unescaped content, without quotes;
  // INDENT, DEDENT and EOF carry an empty lexeme
  public final String lexeme;
  public final int line;
  public final int column;

  public Token(TokenType type, String lexeme, int line, int column) {
    this.type = type;
    this.lexeme = lexeme;
    this.line = line;
    this.column = column;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*line:*/ 1, /*column:*/ 1);
  }

  @Override
  public String toString() {
    return String.format("%s '%s' %d:%d", type, lexeme, line, column);
  }
}
