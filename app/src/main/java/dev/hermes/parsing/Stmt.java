package dev.hermes.parsing;

import java.util.List;

// Compound statements own their bodies; an empty body is legal here and it is
// up to the emitter to produce valid output for it.
public abstract class Stmt {
  public interface Visitor<R> {
    R visitFunctionStmt(Function stmt);
    R visitClassStmt(Class stmt);
    R visitIfStmt(If stmt);
    R visitForStmt(For stmt);
    R visitWhileStmt(While stmt);
    R visitTryStmt(Try stmt);
    R visitWithStmt(With stmt);
    R visitReturnStmt(Return stmt);
    R visitYieldStmt(Yield stmt);
    R visitRaiseStmt(Raise stmt);
    R visitBreakStmt(Break stmt);
    R visitContinueStmt(Continue stmt);
    R visitGlobalStmt(Global stmt);
    R visitImportStmt(Import stmt);
    R visitImportFromStmt(ImportFrom stmt);
    R visitExpressionStmt(Expression stmt);
    R visitAssignStmt(Assign stmt);
    R visitAugAssignStmt(AugAssign stmt);
  }

  public final int line;
  public final int column;

  Stmt(int line, int column) {
    this.line = line;
    this.column = column;
  }

  Stmt(Token token) { this(token.line, token.column); }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Function extends Stmt {
    public Function(
        Token keyword, String name, List<String> params, List<Stmt> body,
        List<Expr> decorators
    ) {
      super(keyword);
      this.name = name;
      this.params = List.copyOf(params);
      this.body = List.copyOf(body);
      this.decorators = List.copyOf(decorators);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunctionStmt(this);
    }

    public final String name;
    public final List<String> params;
    public final List<Stmt> body;
    public final List<Expr> decorators;
  }

  public static class Class extends Stmt {
    public Class(
        Token keyword, String name, List<Expr> bases, List<Stmt> body,
        List<Expr> decorators
    ) {
      super(keyword);
      this.name = name;
      this.bases = List.copyOf(bases);
      this.body = List.copyOf(body);
      this.decorators = List.copyOf(decorators);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitClassStmt(this);
    }

    public final String name;
    public final List<Expr> bases;
    public final List<Stmt> body;
    public final List<Expr> decorators;
  }

  public static class If extends Stmt {
    public If(
        Token keyword, Expr condition, List<Stmt> body, List<ElseIf> elseIfs,
        List<Stmt> elseBody
    ) {
      super(keyword);
      this.condition = condition;
      this.body = List.copyOf(body);
      this.elseIfs = List.copyOf(elseIfs);
      this.elseBody = List.copyOf(elseBody);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIfStmt(this);
    }

    public final Expr condition;
    public final List<Stmt> body;
    public final List<ElseIf> elseIfs;
    // empty when there is no else clause
    public final List<Stmt> elseBody;
  }

  // a `cascade` clause of an if-chain
  public static class ElseIf {
    public ElseIf(Expr condition, List<Stmt> body) {
      this.condition = condition;
      this.body = List.copyOf(body);
    }

    public final Expr condition;
    public final List<Stmt> body;
  }

  public static class For extends Stmt {
    public For(
        Token keyword, List<String> targets, Expr iterable, List<Stmt> body
    ) {
      super(keyword);
      this.targets = List.copyOf(targets);
      this.iterable = iterable;
      this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitForStmt(this);
    }

    // `iterate k, v within pairs` has targets [k, v]
    public final List<String> targets;
    public final Expr iterable;
    public final List<Stmt> body;
  }

  public static class While extends Stmt {
    public While(Token keyword, Expr condition, List<Stmt> body) {
      super(keyword);
      this.condition = condition;
      this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhileStmt(this);
    }

    public final Expr condition;
    public final List<Stmt> body;
  }

  public static class Try extends Stmt {
    public Try(
        Token keyword, List<Stmt> body, List<Handler> handlers,
        List<Stmt> finallyBody
    ) {
      super(keyword);
      this.body = List.copyOf(body);
      this.handlers = List.copyOf(handlers);
      this.finallyBody = List.copyOf(finallyBody);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTryStmt(this);
    }

    public final List<Stmt> body;
    public final List<Handler> handlers;
    // empty when there is no finally clause
    public final List<Stmt> finallyBody;
  }

  // a `grieve [Type [as name]]:` clause
  public static class Handler {
    public Handler(String type, String name, List<Stmt> body) {
      this.type = type;
      this.name = name;
      this.body = List.copyOf(body);
    }

    // null for a bare handler
    public final String type;
    // null unless bound with `as`
    public final String name;
    public final List<Stmt> body;
  }

  public static class With extends Stmt {
    public With(Token keyword, List<WithItem> items, List<Stmt> body) {
      super(keyword);
      this.items = List.copyOf(items);
      this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWithStmt(this);
    }

    public final List<WithItem> items;
    public final List<Stmt> body;
  }

  public static class WithItem {
    public WithItem(Expr context, String target) {
      this.context = context;
      this.target = target;
    }

    public final Expr context;
    // null unless bound with `as`
    public final String target;
  }

  public static class Return extends Stmt {
    public Return(Token keyword, Expr value) {
      super(keyword);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturnStmt(this);
    }

    // null for a bare `abandon`
    public final Expr value;
  }

  public static class Yield extends Stmt {
    public Yield(Token keyword, Expr value) {
      super(keyword);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitYieldStmt(this);
    }

    public final Expr value;
  }

  public static class Raise extends Stmt {
    public Raise(Token keyword, Expr exception) {
      super(keyword);
      this.exception = exception;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRaiseStmt(this);
    }

    // null re-raises the active exception
    public final Expr exception;
  }

  public static class Break extends Stmt {
    public Break(Token keyword) { super(keyword); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBreakStmt(this);
    }
  }

  public static class Continue extends Stmt {
    public Continue(Token keyword) { super(keyword); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitContinueStmt(this);
    }
  }

  public static class Global extends Stmt {
    public Global(Token keyword, List<String> names) {
      super(keyword);
      this.names = List.copyOf(names);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGlobalStmt(this);
    }

    public final List<String> names;
  }

  public static class Import extends Stmt {
    public Import(Token keyword, String module, String alias) {
      super(keyword);
      this.module = module;
      this.alias = alias;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImportStmt(this);
    }

    public final String module;
    public final String alias;
  }

  public static class ImportFrom extends Stmt {
    public ImportFrom(Token keyword, String module, List<Alias> names) {
      super(keyword);
      this.module = module;
      this.names = List.copyOf(names);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImportFromStmt(this);
    }

    public final String module;
    public final List<Alias> names;
  }

  // `name [as asName]` inside an import-from
  public static class Alias {
    public Alias(String name, String asName) {
      this.name = name;
      this.asName = asName;
    }

    public final String name;
    public final String asName;
  }

  public static class Expression extends Stmt {
    public Expression(Expr expression) {
      super(expression.line, expression.column);
      this.expression = expression;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExpressionStmt(this);
    }

    public final Expr expression;
  }

  // `a = b = value` has targets [a, b]
  public static class Assign extends Stmt {
    public Assign(List<Expr> targets, Expr value) {
      super(targets.get(0).line, targets.get(0).column);
      this.targets = List.copyOf(targets);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignStmt(this);
    }

    public final List<Expr> targets;
    public final Expr value;
  }

  public static class AugAssign extends Stmt {
    public AugAssign(Expr target, String operator, Expr value) {
      super(target.line, target.column);
      this.target = target;
      this.operator = operator;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAugAssignStmt(this);
    }

    public final Expr target;
    // the binary operator, e.g. "+" for `+=`
    public final String operator;
    public final Expr value;
  }
}
