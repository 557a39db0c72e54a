package dev.hermes.parsing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ParserTest {
  static Program parse(String source) {
    List<Token> tokens = new Lexer(source).tokenize();
    return new Parser(tokens).parse();
  }

  static String ast(String source) {
    return new AstPrinter().print(parse(source));
  }

  static SyntaxError syntaxError(String source) {
    return assertThrows(SyntaxError.class, () -> parse(source));
  }

  @Test
  void canParseEmptyProgram() {
    assertThat(parse("").statements, is(empty()));
    assertThat(parse("\n\n# only a comment\n").statements, is(empty()));
  }

  @Test
  void canParseWithCorrectOperatorPrecedence() {
    assertThat(ast("1 + 2 * 3 - 4 // 2\n"), is("(- (+ 1 (* 2 3)) (// 4 2))"));
    assertThat(ast("(1 + 2) * 3\n"), is("(* (+ 1 2) 3)"));
  }

  @Test
  void powerBindsTighterThanUnaryMinusAndIsRightAssociative() {
    assertThat(ast("-2 ** 2\n"), is("(- (** 2 2))"));
    assertThat(ast("2 ** 3 ** 2\n"), is("(** 2 (** 3 2))"));
    assertThat(ast("2 ** -1\n"), is("(** 2 (- 1))"));
  }

  @Test
  void chainedComparisonIsOneNode() {
    Program program = parse("a lesser_than b at_most c\n");

    Expr expr = ((Stmt.Expression)program.statements.get(0)).expression;
    assertThat(expr, instanceOf(Expr.Compare.class));
    Expr.Compare compare = (Expr.Compare)expr;
    assertThat(compare.operators, contains("<", "<="));
    assertThat(compare.comparators, hasSize(2));
    assertThat(ast("a lesser_than b at_most c\n"), is("(compare a < b <= c)"));
  }

  @Test
  void canParseSymbolicAndMembershipComparisons() {
    assertThat(ast("a == b != c\n"), is("(compare a == b != c)"));
    assertThat(ast("x within xs\n"), is("(compare x in xs)"));
    assertThat(ast("x negate within xs\n"), is("(compare x not in xs)"));
  }

  @Test
  void booleanOperatorsAreFlattened() {
    assertThat(
        ast("a alternate b alternate c kinship negate d\n"),
        is("(or a b (and c (not d)))")
    );
  }

  @Test
  void canParseConditionalExpressions() {
    assertThat(ast("y = a aahaan c thats_it b\n"), is("(= y (if c a b))"));
    assertThat(
        ast("a aahaan p thats_it b aahaan q thats_it c\n"),
        is("(if p a (if q b c))")
    );
  }

  @Test
  void canParseBuiltinCallsWithKeywordArguments() {
    assertThat(
        ast("announce(\"a\", x, end=\"\")\n"),
        is("(call print \"a\" x (= end \"\"))")
    );
    assertThat(ast("name = listen()\n"), is("(= name (call input))"));
  }

  @Test
  void wrappedCallParsesLikeSingleLineCall() {
    assertThat(
        ast("announce(a,\n         b,\n  sep=c)\n"),
        is(ast("announce(a, b, sep=c)\n"))
    );
  }

  @Test
  void canParsePostfixChains() {
    assertThat(
        ast("a.b(c)[0].d\n"), is("(get (index (call (get a b) c) 0) d)")
    );
  }

  @Test
  void canParseAssignments() {
    assertThat(ast("a = b = 3\n"), is("(= a b 3)"));
    assertThat(ast("x += 1\n"), is("(+= x 1)"));
    assertThat(ast("myself.items[0] *= 2\n"), is("(*= (index (get myself items) 0) 2)"));
  }

  @Test
  void canParseLiterals() {
    assertThat(
        ast("[0xff, 2.5, truth, falsehood, nothing, f\"{x}\"]\n"),
        is("(list 255 2.5 True False None f\"{x}\")")
    );
    assertThat(
        ast("d = {\"a\": [1, 2,], }\n"), is("(= d (dict (\"a\" (list 1 2))))")
    );
  }

  @Test
  void canParseLambdas() {
    assertThat(ast("f = desire x, y: x + y\n"), is("(= f (lambda (x y) (+ x y)))"));
    assertThat(ast("g = desire: 1\n"), is("(= g (lambda () 1))"));
  }

  @Test
  void canParseIfChain() {
    assertThat(
        ast("aahaan x:\n    a\ncascade y:\n    b\nthats_it:\n    c\n"),
        is("(if x (a) (elif y (b)) (else (c)))")
    );
  }

  @Test
  void canParseLoops() {
    assertThat(
        ast("iterate k, v within pairs.items():\n    collapse\n"),
        is("(for (k v) (call (get pairs items)) ((break)))")
    );
    assertThat(
        ast("repeat n greater_than 0:\n    n -= 1\n    skip\n"),
        is("(while (compare n > 0) ((-= n 1) (continue)))")
    );
  }

  @Test
  void canParseTryStatement() {
    String source = ""
        + "attempt:\n"
        + "    risky()\n"
        + "grieve ValueError as e:\n"
        + "    announce(e)\n"
        + "grieve:\n"
        + "    escalate\n"
        + "validate:\n"
        + "    done()\n";

    assertThat(
        ast(source),
        is("(try ((call risky)) (except ValueError e ((call print e))) "
           + "(except ((raise))) (finally ((call done))))")
    );
  }

  @Test
  void canParseTryWithOnlyFinally() {
    assertThat(
        ast("attempt:\n    a\nvalidate:\n    b\n"), is("(try (a) (finally (b)))")
    );
  }

  @Test
  void canParseWithStatement() {
    assertThat(
        ast("context open(f) as h, lock:\n    h.read()\n"),
        is("(with (as (call open f) h) lock ((call (get h read))))")
    );
  }

  @Test
  void canParseClassWithConstructor() {
    String source = ""
        + "fortify Dog(Animal):\n"
        + "    scheme initialize(myself, n):\n"
        + "        super().initialize(n)\n";

    assertThat(
        ast(source),
        is("(class Dog (Animal) ((def initialize (myself n) "
           + "((call (get (call super) initialize) n)))))")
    );
  }

  @Test
  void canParseDecorators() {
    assertThat(
        ast("@cache\n@route(\"/\")\nscheme index():\n    abandon 1\n"),
        is("(def index () (decorators cache (call route \"/\")) ((return 1)))")
    );
    assertThat(
        ast("@dataclass\nfortify Point:\n    x = 0\n"),
        is("(class Point () (decorators dataclass) ((= x 0)))")
    );
  }

  @Test
  void canParseImportsAndGlobals() {
    assertThat(
        ast("congregation os.path as p\nfrom a.b congregation c, d as e\n"),
        is("(import os.path p)\n(from a.b c (as d e))")
    );
    assertThat(ast("recognize a, b\n"), is("(global a b)"));
  }

  @Test
  void canParseBareSimpleStatements() {
    assertThat(
        ast("scheme gen():\n    produce\n    abandon\n"),
        is("(def gen () ((yield) (return)))")
    );
  }

  @Test
  void shouldIgnoreCommentsInsideBrackets() {
    assertThat(ast("x = [1,  # one\n     2]  # done\n"), is("(= x (list 1 2))"));
  }

  @Test
  void commentOnlyBodyIsNotABlock() {
    SyntaxError error = syntaxError("scheme f():\n    # nothing yet\nx = 1\n");

    assertThat(error.getMessage(), is("Expected INDENT, got IDENTIFIER."));
    assertThat(error.line, is(3));
  }

  @Test
  void statementsKeepTheirKeywordPosition() {
    Program program = parse("repeat truth:\n    collapse\n");

    Stmt.While loop = (Stmt.While)program.statements.get(0);
    Stmt brk = loop.body.get(0);
    assertThat(brk, instanceOf(Stmt.Break.class));
    assertThat(brk.line, is(2));
    assertThat(brk.column, is(5));
  }

  @Test
  void shouldReportUnexpectedToken() {
    SyntaxError error = syntaxError("x = = 1\n");

    assertThat(error.getMessage(), is("Unexpected token ASSIGN in expression."));
    assertThat(error.line, is(1));
    assertThat(error.column, is(5));
  }

  @Test
  void shouldRejectInvalidAssignmentTarget() {
    assertThat(
        syntaxError("1 = x\n").getMessage(), is("Invalid assignment target.")
    );
    assertThat(
        syntaxError("f() += 1\n").getMessage(), is("Invalid assignment target.")
    );
  }

  @Test
  void shouldRequireStatementsToEndAtNewline() {
    assertThat(
        syntaxError("a b\n").getMessage(), is("Expected NEWLINE, got IDENTIFIER.")
    );
  }

  @Test
  void shouldRequireIndentedBlock() {
    SyntaxError error = syntaxError("aahaan x:\ny\n");

    assertThat(error.getMessage(), is("Expected INDENT, got IDENTIFIER."));
    assertThat(error.line, is(2));
  }

  @Test
  void shouldRequireDefinitionAfterDecorator() {
    assertThat(
        syntaxError("@d\nx = 1\n").getMessage(),
        is("Expected function or class after decorator, got IDENTIFIER.")
    );
  }

  @Test
  void shouldRequireHandlerOrFinally() {
    assertThat(
        syntaxError("attempt:\n    x\ny\n").getMessage(),
        is("Expected GRIEVE or VALIDATE after attempt block, got IDENTIFIER.")
    );
  }

  @Test
  void shouldRequireBareHandlerToBeLast() {
    String source = "attempt:\n    x\ngrieve:\n    y\ngrieve E:\n    z\n";

    assertThat(
        syntaxError(source).getMessage(),
        is("A bare 'grieve' clause must be the last handler.")
    );
  }

  @Test
  void shouldRequireParenthesesAfterBuiltin() {
    assertThat(
        syntaxError("announce \"hi\"\n").getMessage(),
        is("Expected LPAREN, got STRING.")
    );
  }
}
