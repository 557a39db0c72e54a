package dev.hermes.codegen;

import dev.hermes.parsing.Expr;
import dev.hermes.parsing.Program;
import dev.hermes.parsing.Stmt;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

// Emits Python source for a parsed program.
//
// Statements are written line by line into an IndentingWriter (four spaces
// per level) and expressions are returned as strings. Every operator
// expression is wrapped in parentheses so the output never depends on
// Python's precedence rules. Names, parameters and attributes go through
// IdentifierMap; import names and literal text do not.
public class Transpiler implements Expr.Visitor<String>, Stmt.Visitor<Void> {
  private static final Set<String> binaryOperators =
      Set.of("+", "-", "*", "/", "//", "%", "**");
  private static final Set<String> unaryOperators = Set.of("-", "not");
  private static final Set<String> comparisonOperators =
      Set.of("==", "!=", "<", ">", "<=", ">=", "in", "not in");
  private static final Set<String> booleanOperators = Set.of("and", "or");

  private IndentingWriter writer;
  // position of the statement being emitted, for fault reports
  private int line = 0;
  private int column = 0;

  public String emit(Program program) {
    writer = new IndentingWriter();
    for (Stmt statement : program.statements) {
      emit(statement);
    }
    return writer.toString();
  }

  private void emit(Stmt stmt) {
    line = stmt.line;
    column = stmt.column;
    stmt.accept(this);
  }

  private String emit(Expr expr) {
    if (expr == null)
      throw fault("Missing expression in the tree.");
    return expr.accept(this);
  }

  // The body of a compound statement, one level deeper. Python forbids empty
  // blocks, hence the `pass`.
  private void block(List<Stmt> body) {
    writer.indent();
    if (body.isEmpty()) {
      writer.println("pass");
    } else {
      for (Stmt statement : body) {
        emit(statement);
      }
    }
    writer.dedent();
  }

  private void decorators(List<Expr> decorators) {
    for (Expr decorator : decorators) {
      writer.println("@%s", emit(decorator));
    }
  }

  @Override
  public Void visitFunctionStmt(Stmt.Function stmt) {
    decorators(stmt.decorators);
    String params = stmt.params.stream()
                        .map(IdentifierMap::map)
                        .collect(Collectors.joining(", "));
    writer.println("def %s(%s):", IdentifierMap.map(stmt.name), params);
    block(stmt.body);
    return null;
  }

  @Override
  public Void visitClassStmt(Stmt.Class stmt) {
    decorators(stmt.decorators);
    if (stmt.bases.isEmpty()) {
      writer.println("class %s:", stmt.name);
    } else {
      writer.println("class %s(%s):", stmt.name, emitAll(stmt.bases));
    }
    block(stmt.body);
    return null;
  }

  @Override
  public Void visitIfStmt(Stmt.If stmt) {
    writer.println("if %s:", emit(stmt.condition));
    block(stmt.body);
    for (Stmt.ElseIf elseIf : stmt.elseIfs) {
      writer.println("elif %s:", emit(elseIf.condition));
      block(elseIf.body);
    }
    if (!stmt.elseBody.isEmpty()) {
      writer.println("else:");
      block(stmt.elseBody);
    }
    return null;
  }

  @Override
  public Void visitForStmt(Stmt.For stmt) {
    writer.println(
        "for %s in %s:", String.join(", ", stmt.targets), emit(stmt.iterable)
    );
    block(stmt.body);
    return null;
  }

  @Override
  public Void visitWhileStmt(Stmt.While stmt) {
    writer.println("while %s:", emit(stmt.condition));
    block(stmt.body);
    return null;
  }

  @Override
  public Void visitTryStmt(Stmt.Try stmt) {
    writer.println("try:");
    block(stmt.body);
    for (Stmt.Handler handler : stmt.handlers) {
      if (handler.type == null) {
        writer.println("except:");
      } else if (handler.name == null) {
        writer.println("except %s:", handler.type);
      } else {
        writer.println("except %s as %s:", handler.type, handler.name);
      }
      block(handler.body);
    }
    if (!stmt.finallyBody.isEmpty()) {
      writer.println("finally:");
      block(stmt.finallyBody);
    }
    return null;
  }

  @Override
  public Void visitWithStmt(Stmt.With stmt) {
    List<String> items = new ArrayList<>();
    for (Stmt.WithItem item : stmt.items) {
      String context = emit(item.context);
      items.add(item.target == null ? context : context + " as " + item.target);
    }
    writer.println("with %s:", String.join(", ", items));
    block(stmt.body);
    return null;
  }

  @Override
  public Void visitReturnStmt(Stmt.Return stmt) {
    writer.println(withOptionalValue("return", stmt.value));
    return null;
  }

  @Override
  public Void visitYieldStmt(Stmt.Yield stmt) {
    writer.println(withOptionalValue("yield", stmt.value));
    return null;
  }

  @Override
  public Void visitRaiseStmt(Stmt.Raise stmt) {
    writer.println(withOptionalValue("raise", stmt.exception));
    return null;
  }

  @Override
  public Void visitBreakStmt(Stmt.Break stmt) {
    writer.println("break");
    return null;
  }

  @Override
  public Void visitContinueStmt(Stmt.Continue stmt) {
    writer.println("continue");
    return null;
  }

  @Override
  public Void visitGlobalStmt(Stmt.Global stmt) {
    writer.println("global %s", String.join(", ", stmt.names));
    return null;
  }

  @Override
  public Void visitImportStmt(Stmt.Import stmt) {
    if (stmt.alias == null) {
      writer.println("import %s", stmt.module);
    } else {
      writer.println("import %s as %s", stmt.module, stmt.alias);
    }
    return null;
  }

  @Override
  public Void visitImportFromStmt(Stmt.ImportFrom stmt) {
    List<String> names = new ArrayList<>();
    for (Stmt.Alias alias : stmt.names) {
      names.add(
          alias.asName == null ? alias.name : alias.name + " as " + alias.asName
      );
    }
    writer.println(
        "from %s import %s", stmt.module, String.join(", ", names)
    );
    return null;
  }

  @Override
  public Void visitExpressionStmt(Stmt.Expression stmt) {
    writer.println(emit(stmt.expression));
    return null;
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign stmt) {
    List<String> parts = new ArrayList<>();
    for (Expr target : stmt.targets) {
      parts.add(emit(target));
    }
    parts.add(emit(stmt.value));
    writer.println(String.join(" = ", parts));
    return null;
  }

  @Override
  public Void visitAugAssignStmt(Stmt.AugAssign stmt) {
    requireOperator(binaryOperators, stmt.operator, "augmented assignment");
    writer.println(
        "%s %s= %s", emit(stmt.target), stmt.operator, emit(stmt.value)
    );
    return null;
  }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    requireOperator(binaryOperators, expr.operator, "binary");
    return String.format(
        "(%s %s %s)", emit(expr.left), expr.operator, emit(expr.right)
    );
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    requireOperator(unaryOperators, expr.operator, "unary");
    if (expr.operator.equals("not"))
      return String.format("(not %s)", emit(expr.operand));
    return String.format("(%s%s)", expr.operator, emit(expr.operand));
  }

  @Override
  public String visitCompareExpr(Expr.Compare expr) {
    if (expr.operators.size() != expr.comparators.size())
      throw fault("Comparison with mismatched operators and operands.");

    StringBuilder builder = new StringBuilder("(").append(emit(expr.left));
    for (int i = 0; i < expr.operators.size(); i++) {
      String operator = expr.operators.get(i);
      requireOperator(comparisonOperators, operator, "comparison");
      builder.append(' ').append(operator).append(' ');
      builder.append(emit(expr.comparators.get(i)));
    }
    return builder.append(')').toString();
  }

  @Override
  public String visitBoolOpExpr(Expr.BoolOp expr) {
    requireOperator(booleanOperators, expr.operator, "boolean");
    return "(" +
        expr.values.stream()
            .map(this::emit)
            .collect(Collectors.joining(" " + expr.operator + " ")) +
        ")";
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    List<String> arguments = new ArrayList<>();
    for (Expr argument : expr.arguments) {
      arguments.add(emit(argument));
    }
    for (Expr.Keyword keyword : expr.keywords) {
      arguments.add(keyword.name + "=" + emit(keyword.value));
    }
    return String.format(
        "%s(%s)", emit(expr.callee), String.join(", ", arguments)
    );
  }

  @Override
  public String visitAttributeExpr(Expr.Attribute expr) {
    String object = emit(expr.object);
    // `1.real` would lex as a float in Python
    if (expr.object instanceof Expr.Literal &&
        ((Expr.Literal)expr.object).kind == Expr.Literal.Kind.INT) {
      object = "(" + object + ")";
    }
    return object + "." + IdentifierMap.map(expr.name);
  }

  @Override
  public String visitSubscriptExpr(Expr.Subscript expr) {
    return String.format("%s[%s]", emit(expr.object), emit(expr.index));
  }

  @Override
  public String visitNameExpr(Expr.Name expr) {
    return IdentifierMap.map(expr.id);
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    switch (expr.kind) {
    case INT:
      if (expr.value instanceof BigInteger)
        return PythonLiterals.integer((BigInteger)expr.value);
      break;
    case FLOAT:
      if (expr.value instanceof Double)
        return PythonLiterals.floating((Double)expr.value);
      break;
    case STRING:
      if (expr.value instanceof String)
        return PythonLiterals.string((String)expr.value);
      break;
    case FSTRING:
      if (expr.value instanceof String) {
        return PythonLiterals.formattedString(
            IdentifierMap.mapFormatFields((String)expr.value)
        );
      }
      break;
    case BOOL:
      if (expr.value instanceof Boolean)
        return (Boolean)expr.value ? "True" : "False";
      break;
    case NONE:
      return "None";
    }
    throw fault(String.format(
        "No emission rule for a %s literal holding %s.", expr.kind,
        expr.value == null ? "null" : expr.value.getClass().getSimpleName()
    ));
  }

  @Override
  public String visitListDisplayExpr(Expr.ListDisplay expr) {
    return "[" + emitAll(expr.elements) + "]";
  }

  @Override
  public String visitDictDisplayExpr(Expr.DictDisplay expr) {
    if (expr.keys.size() != expr.values.size())
      throw fault("Dictionary display with mismatched keys and values.");

    List<String> entries = new ArrayList<>();
    for (int i = 0; i < expr.keys.size(); i++) {
      entries.add(emit(expr.keys.get(i)) + ": " + emit(expr.values.get(i)));
    }
    return "{" + String.join(", ", entries) + "}";
  }

  @Override
  public String visitLambdaExpr(Expr.Lambda expr) {
    if (expr.params.isEmpty())
      return String.format("(lambda: %s)", emit(expr.body));

    String params = expr.params.stream()
                        .map(IdentifierMap::map)
                        .collect(Collectors.joining(", "));
    return String.format("(lambda %s: %s)", params, emit(expr.body));
  }

  @Override
  public String visitConditionalExpr(Expr.Conditional expr) {
    return String.format(
        "(%s if %s else %s)", emit(expr.body), emit(expr.test),
        emit(expr.orElse)
    );
  }

  private String withOptionalValue(String keyword, Expr value) {
    if (value == null)
      return keyword;
    return keyword + " " + emit(value);
  }

  private String emitAll(List<Expr> exprs) {
    return exprs.stream().map(this::emit).collect(Collectors.joining(", "));
  }

  private void requireOperator(Set<String> known, String operator, String kind) {
    if (!known.contains(operator)) {
      throw fault(String.format(
          "No emission rule for %s operator '%s'.", kind, operator
      ));
    }
  }

  private EmissionFault fault(String message) {
    return new EmissionFault(message, line, column);
  }
}
