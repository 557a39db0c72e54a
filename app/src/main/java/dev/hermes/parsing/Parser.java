package dev.hermes.parsing;

import static dev.hermes.parsing.TokenType.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class Parser {
  private static final Map<TokenType, String> comparisons =
      new EnumMap<>(TokenType.class);
  static {
    comparisons.put(SAME_AS, "==");
    comparisons.put(DIFFERS_FROM, "!=");
    comparisons.put(GREATER_THAN, ">");
    comparisons.put(LESSER_THAN, "<");
    comparisons.put(AT_LEAST, ">=");
    comparisons.put(AT_MOST, "<=");
    comparisons.put(EQ, "==");
    comparisons.put(NE, "!=");
    comparisons.put(LT, "<");
    comparisons.put(GT, ">");
    comparisons.put(LE, "<=");
    comparisons.put(GE, ">=");
    comparisons.put(WITHIN, "in");
  }

  private static final Map<TokenType, String> augmentedAssignments =
      new EnumMap<>(TokenType.class);
  static {
    augmentedAssignments.put(PLUS_ASSIGN, "+");
    augmentedAssignments.put(MINUS_ASSIGN, "-");
    augmentedAssignments.put(STAR_ASSIGN, "*");
    augmentedAssignments.put(SLASH_ASSIGN, "/");
  }

  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  // Comments carry no meaning for the grammar, so they are dropped up front
  // (this also covers comments inside bracketed, multi-line expressions).
  public Parser(List<Token> tokens) {
    this.tokens = tokens.stream()
                      .filter(token -> token.type != COMMENT)
                      .collect(Collectors.toList());
  }

  // program -> NEWLINE* ( statement NEWLINE* )* EOF
  public Program parse() {
    List<Stmt> statements = new ArrayList<>();
    skipNewlines();
    while (!isAtEnd()) {
      statements.add(statement());
      skipNewlines();
    }
    return new Program(statements);
  }

  // statement -> functionDefinition | classDefinition | decorated
  //            | ifStatement | forStatement | whileStatement
  //            | tryStatement | withStatement
  //            | simpleStatement
  private Stmt statement() {
    if (match(SCHEME))
      return functionDefinition(previous(), Collections.emptyList());
    if (match(FORTIFY))
      return classDefinition(previous(), Collections.emptyList());
    if (match(AT))
      return decorated();
    if (match(AAHAAN))
      return ifStatement();
    if (match(ITERATE))
      return forStatement();
    if (match(REPEAT))
      return whileStatement();
    if (match(ATTEMPT))
      return tryStatement();
    if (match(CONTEXT))
      return withStatement();

    Stmt statement = simpleStatement();
    endOfStatement();
    return statement;
  }

  // simpleStatement -> returnStatement | yieldStatement | raiseStatement
  //                  | "collapse" | "skip" | globalStatement
  //                  | importStatement | importFromStatement
  //                  | expressionStatement
  private Stmt simpleStatement() {
    if (match(ABANDON))
      return new Stmt.Return(previous(), optionalExpression());
    if (match(PRODUCE))
      return new Stmt.Yield(previous(), optionalExpression());
    if (match(ESCALATE))
      return new Stmt.Raise(previous(), optionalExpression());
    if (match(COLLAPSE))
      return new Stmt.Break(previous());
    if (match(SKIP))
      return new Stmt.Continue(previous());
    if (match(RECOGNIZE))
      return globalStatement();
    if (match(CONGREGATION))
      return importStatement();
    if (match(FROM))
      return importFromStatement();
    return expressionStatement();
  }

  // functionDefinition -> "scheme" ( IDENTIFIER | "initialize" )
  //                       "(" parameters? ")" block
  private Stmt.Function functionDefinition(
      Token keyword, List<Expr> decorators
  ) {
    String name = match(INITIALIZE) ? previous().lexeme
                                    : consume(IDENTIFIER).lexeme;
    consume(LPAREN);
    List<String> params = commaSeparated(RPAREN, this::parameterName);
    consume(RPAREN);
    List<Stmt> body = block();
    return new Stmt.Function(keyword, name, params, body, decorators);
  }

  // classDefinition -> "fortify" IDENTIFIER ( "(" arguments? ")" )? block
  private Stmt.Class classDefinition(Token keyword, List<Expr> decorators) {
    String name = consume(IDENTIFIER).lexeme;
    List<Expr> bases = Collections.emptyList();
    if (match(LPAREN)) {
      bases = commaSeparated(RPAREN, this::expression);
      consume(RPAREN);
    }
    List<Stmt> body = block();
    return new Stmt.Class(keyword, name, bases, body, decorators);
  }

  // decorated -> ( "@" expression NEWLINE )+
  //              ( functionDefinition | classDefinition )
  //
  // pre-condition: the first "@" has just been consumed
  private Stmt decorated() {
    List<Expr> decorators = new ArrayList<>();
    do {
      decorators.add(expression());
      endOfStatement();
      skipNewlines();
    } while (match(AT));

    if (match(SCHEME))
      return functionDefinition(previous(), decorators);
    if (match(FORTIFY))
      return classDefinition(previous(), decorators);
    throw error(
        peek(), String.format(
                    "Expected function or class after decorator, got %s.",
                    peek().type
                )
    );
  }

  // ifStatement -> "aahaan" expression block
  //                ( "cascade" expression block )*
  //                ( "thats_it" block )?
  private Stmt ifStatement() {
    Token keyword = previous();
    Expr condition = expression();
    List<Stmt> body = block();

    List<Stmt.ElseIf> elseIfs = new ArrayList<>();
    while (match(CASCADE)) {
      Expr elseIfCondition = expression();
      elseIfs.add(new Stmt.ElseIf(elseIfCondition, block()));
    }

    List<Stmt> elseBody = Collections.emptyList();
    if (match(THATS_IT))
      elseBody = block();

    return new Stmt.If(keyword, condition, body, elseIfs, elseBody);
  }

  // forStatement -> "iterate" IDENTIFIER ( "," IDENTIFIER )*
  //                 "within" expression block
  private Stmt forStatement() {
    Token keyword = previous();
    List<String> targets = new ArrayList<>();
    do {
      targets.add(consume(IDENTIFIER).lexeme);
    } while (match(COMMA));
    consume(WITHIN);
    Expr iterable = expression();
    List<Stmt> body = block();
    return new Stmt.For(keyword, targets, iterable, body);
  }

  // whileStatement -> "repeat" expression block
  private Stmt whileStatement() {
    Token keyword = previous();
    Expr condition = expression();
    List<Stmt> body = block();
    return new Stmt.While(keyword, condition, body);
  }

  // tryStatement -> "attempt" block
  //                 ( "grieve" ( dottedName ( "as" IDENTIFIER )? )? block )*
  //                 ( "validate" block )?
  private Stmt tryStatement() {
    Token keyword = previous();
    List<Stmt> body = block();

    List<Stmt.Handler> handlers = new ArrayList<>();
    while (match(GRIEVE)) {
      Token grieve = previous();
      if (!handlers.isEmpty() && handlers.get(handlers.size() - 1).type == null)
        throw error(grieve, "A bare 'grieve' clause must be the last handler.");

      String type = null;
      String name = null;
      if (!check(COLON)) {
        type = dottedName();
        if (match(AS))
          name = consume(IDENTIFIER).lexeme;
      }
      handlers.add(new Stmt.Handler(type, name, block()));
    }

    List<Stmt> finallyBody = Collections.emptyList();
    boolean hasFinally = match(VALIDATE);
    if (hasFinally)
      finallyBody = block();

    if (handlers.isEmpty() && !hasFinally) {
      throw error(
          peek(), String.format(
                      "Expected GRIEVE or VALIDATE after attempt block, got %s.",
                      peek().type
                  )
      );
    }
    return new Stmt.Try(keyword, body, handlers, finallyBody);
  }

  // withStatement -> "context" withItem ( "," withItem )* block
  // withItem -> expression ( "as" IDENTIFIER )?
  private Stmt withStatement() {
    Token keyword = previous();
    List<Stmt.WithItem> items = new ArrayList<>();
    do {
      Expr context = expression();
      String target = null;
      if (match(AS))
        target = consume(IDENTIFIER).lexeme;
      items.add(new Stmt.WithItem(context, target));
    } while (match(COMMA));
    List<Stmt> body = block();
    return new Stmt.With(keyword, items, body);
  }

  // globalStatement -> "recognize" IDENTIFIER ( "," IDENTIFIER )*
  private Stmt globalStatement() {
    Token keyword = previous();
    List<String> names = new ArrayList<>();
    do {
      names.add(consume(IDENTIFIER).lexeme);
    } while (match(COMMA));
    return new Stmt.Global(keyword, names);
  }

  // importStatement -> "congregation" dottedName ( "as" IDENTIFIER )?
  private Stmt importStatement() {
    Token keyword = previous();
    String module = dottedName();
    String alias = null;
    if (match(AS))
      alias = consume(IDENTIFIER).lexeme;
    return new Stmt.Import(keyword, module, alias);
  }

  // importFromStatement -> "from" dottedName "congregation"
  //                        IDENTIFIER ( "as" IDENTIFIER )?
  //                        ( "," IDENTIFIER ( "as" IDENTIFIER )? )*
  private Stmt importFromStatement() {
    Token keyword = previous();
    String module = dottedName();
    consume(CONGREGATION);
    List<Stmt.Alias> names = new ArrayList<>();
    do {
      String name = consume(IDENTIFIER).lexeme;
      String asName = null;
      if (match(AS))
        asName = consume(IDENTIFIER).lexeme;
      names.add(new Stmt.Alias(name, asName));
    } while (match(COMMA));
    return new Stmt.ImportFrom(keyword, module, names);
  }

  // expressionStatement -> ( target "=" )+ expression
  //                      | target ( "+=" | "-=" | "*=" | "/=" ) expression
  //                      | expression
  private Stmt expressionStatement() {
    Expr expr = expression();

    if (check(ASSIGN)) {
      List<Expr> targets = new ArrayList<>();
      Expr value = expr;
      while (match(ASSIGN)) {
        targets.add(assignmentTarget(value, previous()));
        value = expression();
      }
      return new Stmt.Assign(targets, value);
    }

    if (augmentedAssignments.containsKey(peek().type)) {
      Token operator = advance();
      Expr target = assignmentTarget(expr, operator);
      Expr value = expression();
      return new Stmt.AugAssign(
          target, augmentedAssignments.get(operator.type), value
      );
    }

    return new Stmt.Expression(expr);
  }

  private Expr assignmentTarget(Expr expr, Token operator) {
    if (expr instanceof Expr.Name || expr instanceof Expr.Attribute ||
        expr instanceof Expr.Subscript) {
      return expr;
    }
    throw error(operator, "Invalid assignment target.");
  }

  // block -> ":" NEWLINE* INDENT ( statement NEWLINE* )* ( DEDENT | EOF )
  private List<Stmt> block() {
    consume(COLON);
    skipNewlines();
    consume(INDENT);

    List<Stmt> statements = new ArrayList<>();
    while (!check(DEDENT) && !isAtEnd()) {
      statements.add(statement());
      skipNewlines();
    }
    // a missing DEDENT at EOF is tolerated
    match(DEDENT);
    return statements;
  }

  // expression -> disjunction ( "aahaan" disjunction "thats_it" expression )?
  private Expr expression() {
    Expr expr = disjunction();
    if (match(AAHAAN)) {
      Expr test = disjunction();
      consume(THATS_IT);
      Expr orElse = expression();
      return new Expr.Conditional(expr, test, orElse);
    }
    return expr;
  }

  // disjunction -> conjunction ( "alternate" conjunction )*
  private Expr disjunction() {
    return boolOp("or", ALTERNATE, this::conjunction);
  }

  // conjunction -> inversion ( "kinship" inversion )*
  private Expr conjunction() { return boolOp("and", KINSHIP, this::inversion); }

  // inversion -> "negate" inversion
  //            | comparison
  private Expr inversion() {
    if (match(NEGATE)) {
      Token operator = previous();
      return new Expr.Unary(
          operator.line, operator.column, "not", inversion()
      );
    }
    return comparison();
  }

  // comparison -> sum ( comparisonOperator sum )*
  //
  // `a < b <= c` becomes a single chained node, as in Python
  private Expr comparison() {
    Expr left = sum();
    List<String> operators = new ArrayList<>();
    List<Expr> comparators = new ArrayList<>();

    String operator;
    while ((operator = comparisonOperator()) != null) {
      operators.add(operator);
      comparators.add(sum());
    }

    if (operators.isEmpty())
      return left;
    return new Expr.Compare(left, operators, comparators);
  }

  // consumes a comparison operator (including "negate within") and returns its
  // Python spelling, or returns null without consuming anything
  private String comparisonOperator() {
    if (check(NEGATE) && peekNext().type == WITHIN) {
      advance(2);
      return "not in";
    }
    String operator = comparisons.get(peek().type);
    if (operator != null)
      advance();
    return operator;
  }

  // sum -> term ( ( "+" | "-" ) term )*
  private Expr sum() { return binary(this::term, PLUS, MINUS); }

  // term -> unary ( ( "*" | "/" | "//" | "%" ) unary )*
  private Expr term() {
    return binary(this::unary, STAR, SLASH, DOUBLE_SLASH, PERCENT);
  }

  // unary -> "-" unary
  //        | power
  private Expr unary() {
    if (match(MINUS)) {
      Token operator = previous();
      return new Expr.Unary(operator.line, operator.column, "-", unary());
    }
    return power();
  }

  // power -> postfix ( "**" unary )?
  //
  // right-associative through `unary`, so `2 ** -1` and `2 ** 3 ** 2` work,
  // while `-2 ** 2` is `-(2 ** 2)`
  private Expr power() {
    Expr base = postfix();
    if (match(DOUBLE_STAR))
      return new Expr.Binary(base, "**", unary());
    return base;
  }

  // postfix -> primary ( "(" arguments? ")" | "." attributeName
  //                    | "[" expression "]" )*
  private Expr postfix() {
    Expr expr = primary();

    // this loop is necessary because we might have an expression like this:
    //    callee(a, b).attribute[index](c)
    while (true) {
      if (match(LPAREN)) {
        expr = finishCall(expr);

      } else if (match(DOT)) {
        expr = new Expr.Attribute(expr, attributeName());

      } else if (match(LBRACKET)) {
        Expr index = expression();
        consume(RBRACKET);
        expr = new Expr.Subscript(expr, index);

      } else {
        break;
      }
    }
    return expr;
  }

  // the remappable keywords are valid attribute names: `super().initialize()`
  private String attributeName() {
    if (match(MYSELF, INITIALIZE))
      return previous().lexeme;
    return consume(IDENTIFIER).lexeme;
  }

  // arguments -> argument ( "," argument )* ","?
  // argument -> IDENTIFIER "=" expression
  //           | expression
  //
  // pre-condition: a LPAREN has just been consumed
  // post-condition: a RPAREN is the last consumed token
  private Expr finishCall(Expr callee) {
    List<Expr> arguments = new ArrayList<>();
    List<Expr.Keyword> keywords = new ArrayList<>();
    while (!check(RPAREN)) {
      if (check(IDENTIFIER) && peekNext().type == ASSIGN) {
        String name = advance().lexeme;
        advance();
        keywords.add(new Expr.Keyword(name, expression()));
      } else {
        arguments.add(expression());
      }
      if (!match(COMMA))
        break;
    }
    consume(RPAREN);
    return new Expr.Call(callee, arguments, keywords);
  }

  // primary -> INTEGER | FLOAT | STRING | FSTRING
  //          | "truth" | "falsehood" | "nothing"
  //          | IDENTIFIER | "myself" | "initialize"
  //          | "(" expression ")"
  //          | listDisplay | dictDisplay | lambda
  //          | ( "announce" | "listen" ) "(" arguments? ")"
  private Expr primary() {
    Token token = peek();

    if (match(INTEGER))
      return Expr.Literal.ofInt(token.line, token.column, integerValue(token));
    if (match(FLOAT)) {
      return new Expr.Literal(
          token.line, token.column, Expr.Literal.Kind.FLOAT,
          Double.parseDouble(token.lexeme)
      );
    }
    if (match(STRING))
      return Expr.Literal.ofString(token.line, token.column, token.lexeme);
    if (match(FSTRING)) {
      return new Expr.Literal(
          token.line, token.column, Expr.Literal.Kind.FSTRING, token.lexeme
      );
    }
    if (match(TRUTH, FALSEHOOD)) {
      return new Expr.Literal(
          token.line, token.column, Expr.Literal.Kind.BOOL,
          token.type == TRUTH
      );
    }
    if (match(NOTHING)) {
      return new Expr.Literal(
          token.line, token.column, Expr.Literal.Kind.NONE, null
      );
    }
    if (match(IDENTIFIER, MYSELF, INITIALIZE))
      return new Expr.Name(token);

    if (match(LPAREN)) {
      Expr expr = expression();
      consume(RPAREN);
      return expr;
    }
    if (match(LBRACKET)) {
      List<Expr> elements = commaSeparated(RBRACKET, this::expression);
      consume(RBRACKET);
      return new Expr.ListDisplay(token.line, token.column, elements);
    }
    if (match(LBRACE))
      return dictDisplay(token);
    if (match(DESIRE))
      return lambda(token);
    if (match(ANNOUNCE))
      return builtinCall(token, "print");
    if (match(LISTEN))
      return builtinCall(token, "input");

    throw error(
        token, String.format("Unexpected token %s in expression.", token.type)
    );
  }

  // dictDisplay -> "{" ( expression ":" expression
  //                      ( "," expression ":" expression )* ","? )? "}"
  private Expr dictDisplay(Token brace) {
    List<Expr> keys = new ArrayList<>();
    List<Expr> values = new ArrayList<>();
    while (!check(RBRACE)) {
      keys.add(expression());
      consume(COLON);
      values.add(expression());
      if (!match(COMMA))
        break;
    }
    consume(RBRACE);
    return new Expr.DictDisplay(brace.line, brace.column, keys, values);
  }

  // lambda -> "desire" parameters? ":" expression
  private Expr lambda(Token keyword) {
    List<String> params = commaSeparated(COLON, this::parameterName);
    consume(COLON);
    Expr body = expression();
    return new Expr.Lambda(keyword.line, keyword.column, params, body);
  }

  // `announce(...)` and `listen(...)` are ordinary calls to fixed names
  private Expr builtinCall(Token keyword, String name) {
    consume(LPAREN);
    return finishCall(new Expr.Name(keyword.line, keyword.column, name));
  }

  private String parameterName() {
    if (match(MYSELF))
      return previous().lexeme;
    return consume(IDENTIFIER).lexeme;
  }

  // dottedName -> IDENTIFIER ( "." IDENTIFIER )*
  private String dottedName() {
    StringBuilder name = new StringBuilder(consume(IDENTIFIER).lexeme);
    while (match(DOT))
      name.append('.').append(consume(IDENTIFIER).lexeme);
    return name.toString();
  }

  private static BigInteger integerValue(Token token) {
    String text = token.lexeme;
    if (text.length() > 2 && text.charAt(0) == '0') {
      switch (Character.toLowerCase(text.charAt(1))) {
      case 'x':
        return new BigInteger(text.substring(2), 16);
      case 'o':
        return new BigInteger(text.substring(2), 8);
      case 'b':
        return new BigInteger(text.substring(2), 2);
      default:
        break;
      }
    }
    return new BigInteger(text);
  }

  // Collect `element`s separated by commas up to (but not including)
  // `closer`; a trailing comma is allowed.
  private <T> List<T> commaSeparated(TokenType closer, Supplier<T> element) {
    List<T> items = new ArrayList<>();
    while (!check(closer)) {
      items.add(element.get());
      if (!match(COMMA))
        break;
    }
    return items;
  }

  // boolOp -> operand ( KEYWORD operand )*
  //
  // `a alternate b alternate c` is one node with three values
  private Expr boolOp(
      String operator, TokenType keyword, Supplier<Expr> operandParser
  ) {
    Expr first = operandParser.get();
    if (!check(keyword))
      return first;

    List<Expr> values = new ArrayList<>();
    values.add(first);
    while (match(keyword))
      values.add(operandParser.get());
    return new Expr.BoolOp(operator, values);
  }

  // binary -> binary ONE_OF<tokenTypes> subunit
  //         | subunit
  private Expr binary(Supplier<Expr> subunitParser, TokenType... tokenTypes) {
    Expr expr = subunitParser.get();
    while (match(tokenTypes)) {
      String operator = previous().lexeme;
      Expr right = subunitParser.get();
      expr = new Expr.Binary(expr, operator, right);
    }
    return expr;
  }

  private Expr optionalExpression() {
    if (check(NEWLINE) || check(DEDENT) || isAtEnd())
      return null;
    return expression();
  }

  // a simple statement ends at a NEWLINE, or right before a DEDENT or EOF
  private void endOfStatement() {
    if (match(NEWLINE) || check(DEDENT) || isAtEnd())
      return;
    throw error(
        peek(), String.format("Expected NEWLINE, got %s.", peek().type)
    );
  }

  private void skipNewlines() {
    while (check(NEWLINE))
      advance();
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type) {
    if (check(type))
      return advance();
    throw error(
        peek(), String.format("Expected %s, got %s.", type, peek().type)
    );
  }

  private boolean check(TokenType expectedType) {
    return peek().type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private void advance(int count) {
    for (int i = 0; i < count; i++)
      advance();
  }

  private boolean isAtEnd() { return peek().type == EOF; }

  private Token peek() { return tokens.get(current); }

  // one token past `peek()`, used to tell `name=value` arguments apart
  private Token peekNext() {
    return tokens.get(Math.min(current + 1, tokens.size() - 1));
  }

  private Token previous() { return tokens.get(current - 1); }

  private SyntaxError error(Token token, String message) {
    return new SyntaxError(token, message);
  }
}
