package dev.hermes.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

// Prints a tree as S-expressions, one top-level statement per line, e.g.
// `(def greet (name) (return (+ "Hi " name)))`.
public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
  public String print(Program program) {
    return program.statements.stream()
        .map(this::print)
        .collect(Collectors.joining("\n"));
  }

  public String print(Stmt stmt) { return stmt.accept(this); }

  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitFunctionStmt(Stmt.Function stmt) {
    List<String> parts = new ArrayList<>();
    parts.add(stmt.name);
    parts.add(group(stmt.params));
    if (!stmt.decorators.isEmpty())
      parts.add(parenthesize("decorators", stmt.decorators));
    parts.add(body(stmt.body));
    return group("def", parts);
  }

  @Override
  public String visitClassStmt(Stmt.Class stmt) {
    List<String> parts = new ArrayList<>();
    parts.add(stmt.name);
    parts.add(group(printAll(stmt.bases)));
    if (!stmt.decorators.isEmpty())
      parts.add(parenthesize("decorators", stmt.decorators));
    parts.add(body(stmt.body));
    return group("class", parts);
  }

  @Override
  public String visitIfStmt(Stmt.If stmt) {
    List<String> parts = new ArrayList<>();
    parts.add(print(stmt.condition));
    parts.add(body(stmt.body));
    for (Stmt.ElseIf elseIf : stmt.elseIfs) {
      parts.add(group("elif", List.of(print(elseIf.condition), body(elseIf.body))));
    }
    if (!stmt.elseBody.isEmpty())
      parts.add(group("else", List.of(body(stmt.elseBody))));
    return group("if", parts);
  }

  @Override
  public String visitForStmt(Stmt.For stmt) {
    return group(
        "for",
        List.of(group(stmt.targets), print(stmt.iterable), body(stmt.body))
    );
  }

  @Override
  public String visitWhileStmt(Stmt.While stmt) {
    return group("while", List.of(print(stmt.condition), body(stmt.body)));
  }

  @Override
  public String visitTryStmt(Stmt.Try stmt) {
    List<String> parts = new ArrayList<>();
    parts.add(body(stmt.body));
    for (Stmt.Handler handler : stmt.handlers) {
      List<String> clause = new ArrayList<>();
      if (handler.type != null)
        clause.add(handler.type);
      if (handler.name != null)
        clause.add(handler.name);
      clause.add(body(handler.body));
      parts.add(group("except", clause));
    }
    if (!stmt.finallyBody.isEmpty())
      parts.add(group("finally", List.of(body(stmt.finallyBody))));
    return group("try", parts);
  }

  @Override
  public String visitWithStmt(Stmt.With stmt) {
    List<String> parts = new ArrayList<>();
    for (Stmt.WithItem item : stmt.items) {
      String context = print(item.context);
      parts.add(item.target == null ? context
                                    : group("as", List.of(context, item.target)));
    }
    parts.add(body(stmt.body));
    return group("with", parts);
  }

  @Override
  public String visitReturnStmt(Stmt.Return stmt) {
    return optional("return", stmt.value);
  }

  @Override
  public String visitYieldStmt(Stmt.Yield stmt) {
    return optional("yield", stmt.value);
  }

  @Override
  public String visitRaiseStmt(Stmt.Raise stmt) {
    return optional("raise", stmt.exception);
  }

  @Override
  public String visitBreakStmt(Stmt.Break stmt) {
    return "(break)";
  }

  @Override
  public String visitContinueStmt(Stmt.Continue stmt) {
    return "(continue)";
  }

  @Override
  public String visitGlobalStmt(Stmt.Global stmt) {
    return group("global", stmt.names);
  }

  @Override
  public String visitImportStmt(Stmt.Import stmt) {
    if (stmt.alias == null)
      return group("import", List.of(stmt.module));
    return group("import", List.of(stmt.module, stmt.alias));
  }

  @Override
  public String visitImportFromStmt(Stmt.ImportFrom stmt) {
    List<String> parts = new ArrayList<>();
    parts.add(stmt.module);
    for (Stmt.Alias alias : stmt.names) {
      parts.add(alias.asName == null ? alias.name
                                     : group("as", List.of(alias.name, alias.asName)));
    }
    return group("from", parts);
  }

  @Override
  public String visitExpressionStmt(Stmt.Expression stmt) {
    return print(stmt.expression);
  }

  @Override
  public String visitAssignStmt(Stmt.Assign stmt) {
    List<String> parts = printAll(stmt.targets);
    parts.add(print(stmt.value));
    return group("=", parts);
  }

  @Override
  public String visitAugAssignStmt(Stmt.AugAssign stmt) {
    return parenthesize(stmt.operator + "=", stmt.target, stmt.value);
  }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return parenthesize(expr.operator, expr.left, expr.right);
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return parenthesize(expr.operator, expr.operand);
  }

  @Override
  public String visitCompareExpr(Expr.Compare expr) {
    List<String> parts = new ArrayList<>();
    parts.add(print(expr.left));
    for (int i = 0; i < expr.operators.size(); i++) {
      parts.add(expr.operators.get(i));
      parts.add(print(expr.comparators.get(i)));
    }
    return group("compare", parts);
  }

  @Override
  public String visitBoolOpExpr(Expr.BoolOp expr) {
    return parenthesize(expr.operator, expr.values);
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    List<String> parts = new ArrayList<>();
    parts.add(print(expr.callee));
    parts.addAll(printAll(expr.arguments));
    for (Expr.Keyword keyword : expr.keywords) {
      parts.add(group("=", List.of(keyword.name, print(keyword.value))));
    }
    return group("call", parts);
  }

  @Override
  public String visitAttributeExpr(Expr.Attribute expr) {
    return group("get", List.of(print(expr.object), expr.name));
  }

  @Override
  public String visitSubscriptExpr(Expr.Subscript expr) {
    return parenthesize("index", expr.object, expr.index);
  }

  @Override
  public String visitNameExpr(Expr.Name expr) {
    return expr.id;
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    switch (expr.kind) {
    case STRING:
      return "\"" + expr.value + "\"";
    case FSTRING:
      return "f\"" + expr.value + "\"";
    case BOOL:
      return (Boolean)expr.value ? "True" : "False";
    case NONE:
      return "None";
    default:
      return String.valueOf(expr.value);
    }
  }

  @Override
  public String visitListDisplayExpr(Expr.ListDisplay expr) {
    return parenthesize("list", expr.elements);
  }

  @Override
  public String visitDictDisplayExpr(Expr.DictDisplay expr) {
    List<String> entries = new ArrayList<>();
    for (int i = 0; i < expr.keys.size(); i++) {
      entries.add(group(List.of(print(expr.keys.get(i)), print(expr.values.get(i)))));
    }
    return group("dict", entries);
  }

  @Override
  public String visitLambdaExpr(Expr.Lambda expr) {
    return group("lambda", List.of(group(expr.params), print(expr.body)));
  }

  @Override
  public String visitConditionalExpr(Expr.Conditional expr) {
    return parenthesize("if", expr.test, expr.body, expr.orElse);
  }

  private String body(List<Stmt> statements) {
    return group(
        statements.stream().map(this::print).collect(Collectors.toList())
    );
  }

  private String optional(String name, Expr value) {
    if (value == null)
      return "(" + name + ")";
    return parenthesize(name, value);
  }

  private List<String> printAll(List<Expr> exprs) {
    return exprs.stream().map(this::print).collect(Collectors.toList());
  }

  private String parenthesize(String name, Expr... exprs) {
    return parenthesize(name, List.of(exprs));
  }

  private String parenthesize(String name, List<Expr> exprs) {
    return group(name, printAll(exprs));
  }

  private static String group(String name, List<String> parts) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (String part : parts) {
      builder.append(" ");
      builder.append(part);
    }
    builder.append(")");

    return builder.toString();
  }

  private static String group(List<String> parts) {
    return "(" + String.join(" ", parts) + ")";
  }
}
