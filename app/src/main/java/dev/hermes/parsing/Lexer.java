package dev.hermes.parsing;

import static dev.hermes.parsing.TokenType.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
  public static final Map<String, TokenType> keywords;
  static {
    Map<String, TokenType> table = new HashMap<>();
    table.put("scheme", SCHEME);
    table.put("abandon", ABANDON);
    table.put("fortify", FORTIFY);
    table.put("myself", MYSELF);
    table.put("initialize", INITIALIZE);
    table.put("aahaan", AAHAAN);
    table.put("cascade", CASCADE);
    table.put("thats_it", THATS_IT);
    table.put("iterate", ITERATE);
    table.put("within", WITHIN);
    table.put("repeat", REPEAT);
    table.put("collapse", COLLAPSE);
    table.put("skip", SKIP);
    table.put("attempt", ATTEMPT);
    table.put("grieve", GRIEVE);
    table.put("validate", VALIDATE);
    table.put("escalate", ESCALATE);
    table.put("truth", TRUTH);
    table.put("falsehood", FALSEHOOD);
    table.put("nothing", NOTHING);
    table.put("same_as", SAME_AS);
    table.put("differs_from", DIFFERS_FROM);
    table.put("greater_than", GREATER_THAN);
    table.put("lesser_than", LESSER_THAN);
    table.put("at_least", AT_LEAST);
    table.put("at_most", AT_MOST);
    table.put("kinship", KINSHIP);
    table.put("alternate", ALTERNATE);
    table.put("negate", NEGATE);
    table.put("announce", ANNOUNCE);
    table.put("listen", LISTEN);
    table.put("congregation", CONGREGATION);
    table.put("from", FROM);
    table.put("as", AS);
    table.put("desire", DESIRE);
    table.put("produce", PRODUCE);
    table.put("recognize", RECOGNIZE);
    table.put("context", CONTEXT);
    keywords = Collections.unmodifiableMap(table);
  }

  private static final int TAB_WIDTH = 4;

  public static class Options {
    boolean lenientIndentation = false;

    // When set, a dedent that lands between two open indentation levels is
    // accepted instead of being reported.
    public Options lenientIndentation(boolean lenient) {
      this.lenientIndentation = lenient;
      return this;
    }
  }

  private final String sourceCode;
  private final Options options;
  private final List<Token> tokens = new ArrayList<>();
  // open indentation levels; the bottom entry is always 0
  private final Deque<Integer> indents = new ArrayDeque<>();
  // `start` & `current` index `sourceCode` and bound the token currently
  // under examination.
  private int start = 0;
  private int current = 0;
  // both start at 1 (and not 0) to be user friendly
  private int line = 1;
  private int column = 1;
  // position of the first character of the token under examination
  private int startLine = 1;
  private int startColumn = 1;
  // while positive, newlines and indentation are insignificant
  private int bracketDepth = 0;
  private boolean atLineStart = true;

  public Lexer(String sourceCode) { this(sourceCode, new Options()); }

  public Lexer(String sourceCode, Options options) {
    this.sourceCode = sourceCode;
    this.options = options;
  }

  // Meant to be called once per instance.
  public List<Token> tokenize() {
    indents.push(0);
    while (!isAtEnd()) {
      if (atLineStart && bracketDepth == 0) {
        indentation();
        continue;
      }
      start = current;
      startLine = line;
      startColumn = column;
      scanToken();
    }

    startLine = line;
    startColumn = column;
    while (indents.peek() > 0) {
      indents.pop();
      addStructural(DEDENT);
    }
    addStructural(EOF);
    return tokens;
  }

  // Measure the indentation of a logical line and turn changes into
  // INDENT/DEDENT tokens. Blank and comment-only lines are consumed without
  // producing anything.
  //
  // pre-condition: we are at the start of a line and outside any brackets
  private void indentation() {
    int indent = 0;
    while (!isAtEnd() && isIndentation(peek())) {
      char c = advance();
      if (c == '\t') {
        indent += TAB_WIDTH;
      } else if (c == ' ') {
        indent++;
      }
    }
    if (isAtEnd())
      return;

    if (peek() == '\n') {
      advance();
      return;
    }
    if (peek() == '#') {
      // the newline is left for the next round, which sees an empty line
      while (peek() != '\n' && !isAtEnd())
        advance();
      return;
    }

    startLine = line;
    startColumn = column;
    if (indent > indents.peek()) {
      indents.push(indent);
      addStructural(INDENT);
    } else {
      while (indent < indents.peek()) {
        indents.pop();
        addStructural(DEDENT);
      }
      if (indent != indents.peek() && !options.lenientIndentation) {
        throw new LexicalError(
            "Unindent does not match any outer indentation level.", line,
            column
        );
      }
    }
    atLineStart = false;
  }

  private void scanToken() {
    char c = advance();
    switch (c) {
    case ' ':
    case '\t':
    case '\r':
    case '\f':
      // ignore whitespace
      break;

    case '\n':
      if (bracketDepth == 0) {
        addToken(NEWLINE, "\n");
        atLineStart = true;
      }
      break;

    case '#':
      comment();
      break;

    case '"':
    case '\'':
      string(c);
      break;

    case '(':
      openBracket(LPAREN);
      break;
    case '[':
      openBracket(LBRACKET);
      break;
    case '{':
      openBracket(LBRACE);
      break;
    case ')':
      closeBracket(RPAREN);
      break;
    case ']':
      closeBracket(RBRACKET);
      break;
    case '}':
      closeBracket(RBRACE);
      break;

    case ',':
      addToken(COMMA);
      break;
    case ':':
      addToken(COLON);
      break;
    case '.':
      addToken(DOT);
      break;
    case '@':
      addToken(AT);
      break;
    case '%':
      addToken(PERCENT);
      break;

    case '+':
      addToken(match('=') ? PLUS_ASSIGN : PLUS);
      break;
    case '-':
      if (match('=')) {
        addToken(MINUS_ASSIGN);
      } else {
        addToken(match('>') ? ARROW : MINUS);
      }
      break;
    case '*':
      if (match('*')) {
        addToken(DOUBLE_STAR);
      } else {
        addToken(match('=') ? STAR_ASSIGN : STAR);
      }
      break;
    case '/':
      if (match('/')) {
        addToken(DOUBLE_SLASH);
      } else {
        addToken(match('=') ? SLASH_ASSIGN : SLASH);
      }
      break;
    case '=':
      addToken(match('=') ? EQ : ASSIGN);
      break;
    case '<':
      addToken(match('=') ? LE : LT);
      break;
    case '>':
      addToken(match('=') ? GE : GT);
      break;
    case '!':
      if (match('=')) {
        addToken(NE);
        break;
      }
      throw unexpected(c);

    default:
      if (isDigit(c)) {
        number(c);
      } else if (isAlpha(c)) {
        identifier();
      } else {
        throw unexpected(c);
      }
    }
  }

  // pre-condition: the opening '#' has just been consumed
  // post-condition: all characters up to a newline (or EOF) have been consumed
  private void comment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
    addToken(COMMENT);
  }

  private void openBracket(TokenType type) {
    bracketDepth++;
    addToken(type);
  }

  private void closeBracket(TokenType type) {
    // an unmatched closer is left for the parser to report
    if (bracketDepth > 0)
      bracketDepth--;
    addToken(type);
  }

  // Scan a single- or triple-quoted string literal and unescape its contents.
  //
  // pre-condition: the opening quote has just been consumed
  // post-condition: the closing quote(s) have been consumed
  private void string(char quote) {
    int literalLine = startLine;
    int literalColumn = startColumn;

    // an `f` glued to the opening quote makes this an f-string
    boolean formatted = false;
    if (!tokens.isEmpty()) {
      Token previous = tokens.get(tokens.size() - 1);
      if (previous.type == IDENTIFIER && previous.lexeme.equals("f") &&
          previous.line == startLine && previous.column + 1 == startColumn) {
        tokens.remove(tokens.size() - 1);
        formatted = true;
        literalColumn = previous.column;
      }
    }

    boolean triple = peek() == quote && peekAhead(1) == quote;
    if (triple)
      advance(2);

    StringBuilder value = new StringBuilder();
    while (true) {
      if (isAtEnd())
        throw unterminatedString(literalLine, literalColumn);

      char c = peek();
      if (triple) {
        if (c == quote && peekAhead(1) == quote && peekAhead(2) == quote) {
          advance(3);
          break;
        }
      } else {
        if (c == quote) {
          advance();
          break;
        }
        if (c == '\n')
          throw unterminatedString(literalLine, literalColumn);
      }

      if (c == '\\') {
        advance();
        if (isAtEnd())
          throw unterminatedString(literalLine, literalColumn);
        value.append(unescape(advance(), quote));
      } else {
        value.append(advance());
      }
    }

    tokens.add(new Token(
        formatted ? FSTRING : STRING, value.toString(), literalLine,
        literalColumn
    ));
  }

  private static String unescape(char escaped, char quote) {
    switch (escaped) {
    case 'n':
      return "\n";
    case 't':
      return "\t";
    case 'r':
      return "\r";
    case '\\':
      return "\\";
    default:
      if (escaped == quote)
        return String.valueOf(quote);
      // unknown escapes are kept verbatim, backslash included
      return "\\" + escaped;
    }
  }

  // Scan an integer (decimal, 0x, 0b or 0o) or a float. Underscore digit
  // separators are dropped from the lexeme.
  //
  // pre-condition: the first digit has just been consumed
  private void number(char first) {
    StringBuilder digits = new StringBuilder().append(first);

    if (first == '0' && peek() != '\0' && "xXbBoO".indexOf(peek()) >= 0) {
      char prefix = advance();
      digits.append(prefix);
      int radix = radixOf(prefix);
      int count = 0;
      while (isRadixDigit(peek(), radix) || peek() == '_') {
        char c = advance();
        if (c != '_') {
          digits.append(c);
          count++;
        }
      }
      if (count == 0) {
        throw new LexicalError(
            String.format("Invalid base-%d literal.", radix), startLine,
            startColumn
        );
      }
      addToken(INTEGER, digits.toString());
      return;
    }

    decimalDigits(digits);
    boolean isFloat = false;

    // a dot only starts a fraction when a digit follows, so `1.real`
    // remains an attribute access
    if (peek() == '.' && isDigit(peekAhead(1))) {
      isFloat = true;
      digits.append(advance());
      decimalDigits(digits);
    }

    if ((peek() == 'e' || peek() == 'E') && startsExponent()) {
      isFloat = true;
      digits.append(advance());
      if (peek() == '+' || peek() == '-')
        digits.append(advance());
      while (isDigit(peek()))
        digits.append(advance());
    }

    addToken(isFloat ? FLOAT : INTEGER, digits.toString());
  }

  private void decimalDigits(StringBuilder digits) {
    while (isDigit(peek()) || peek() == '_') {
      char c = advance();
      if (c != '_')
        digits.append(c);
    }
  }

  // pre-condition: peek() is 'e' or 'E'
  private boolean startsExponent() {
    char next = peekAhead(1);
    if (next == '+' || next == '-')
      return isDigit(peekAhead(2));
    return isDigit(next);
  }

  private static int radixOf(char prefix) {
    switch (Character.toLowerCase(prefix)) {
    case 'x':
      return 16;
    case 'o':
      return 8;
    default:
      return 2;
    }
  }

  private void identifier() {
    while (isAlphaNumeric(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    TokenType type = keywords.get(text);
    if (type == null)
      type = IDENTIFIER;

    addToken(type, text);
  }

  private LexicalError unexpected(char c) {
    return new LexicalError(
        String.format("Unexpected character '%c'.", c), startLine, startColumn
    );
  }

  private static LexicalError unterminatedString(int line, int column) {
    return new LexicalError("Unterminated string.", line, column);
  }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    advance();
    return true;
  }

  // returns the next character to be consumed
  private char peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private char peekAhead(int distance) {
    if (current + distance >= sourceCode.length())
      return '\0';
    return sourceCode.charAt(current + distance);
  }

  private static boolean isIndentation(char c) {
    return c == ' ' || c == '\t' || c == '\r' || c == '\f';
  }

  private static boolean isAlpha(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isAlphaNumeric(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  // ASCII only: Character.digit also accepts other scripts' digits
  private static boolean isRadixDigit(char c, int radix) {
    return c < 128 && Character.digit(c, radix) >= 0;
  }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward,
  // keeping `line` and `column` in step
  private char advance() {
    char c = sourceCode.charAt(current++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  // pre-condition: current + count <= sourceCode.length()
  private void advance(int count) {
    for (int i = 0; i < count; i++)
      advance();
  }

  private void addStructural(TokenType type) {
    tokens.add(new Token(type, "", startLine, startColumn));
  }

  private void addToken(TokenType type) {
    addToken(type, sourceCode.substring(start, current));
  }

  private void addToken(TokenType type, String lexeme) {
    tokens.add(new Token(type, lexeme, startLine, startColumn));
  }
}
