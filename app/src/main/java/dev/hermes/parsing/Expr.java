package dev.hermes.parsing;

import java.math.BigInteger;
import java.util.List;

// All AST classes are simple data structures with no real behavior so it's
// okay for them (and their fields) to be public. Operators are stored with
// their Python spelling ("==", "not", "//") since several keywords share one.
public abstract class Expr {
  public interface Visitor<R> {
    R visitBinaryExpr(Binary expr);
    R visitUnaryExpr(Unary expr);
    R visitCompareExpr(Compare expr);
    R visitBoolOpExpr(BoolOp expr);
    R visitCallExpr(Call expr);
    R visitAttributeExpr(Attribute expr);
    R visitSubscriptExpr(Subscript expr);
    R visitNameExpr(Name expr);
    R visitLiteralExpr(Literal expr);
    R visitListDisplayExpr(ListDisplay expr);
    R visitDictDisplayExpr(DictDisplay expr);
    R visitLambdaExpr(Lambda expr);
    R visitConditionalExpr(Conditional expr);
  }

  public final int line;
  public final int column;

  Expr(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Binary extends Expr {
    public Binary(Expr left, String operator, Expr right) {
      super(left.line, left.column);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryExpr(this);
    }

    public final Expr left;
    public final String operator;
    public final Expr right;
  }

  public static class Unary extends Expr {
    public Unary(int line, int column, String operator, Expr operand) {
      super(line, column);
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryExpr(this);
    }

    public final String operator;
    public final Expr operand;
  }

  // `a < b <= c` is a single node: operators [<, <=], comparators [b, c]
  public static class Compare extends Expr {
    public Compare(Expr left, List<String> operators, List<Expr> comparators) {
      super(left.line, left.column);
      this.left = left;
      this.operators = List.copyOf(operators);
      this.comparators = List.copyOf(comparators);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompareExpr(this);
    }

    public final Expr left;
    public final List<String> operators;
    public final List<Expr> comparators;
  }

  public static class BoolOp extends Expr {
    public BoolOp(String operator, List<Expr> values) {
      super(values.get(0).line, values.get(0).column);
      this.operator = operator;
      this.values = List.copyOf(values);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoolOpExpr(this);
    }

    public final String operator;
    public final List<Expr> values;
  }

  public static class Call extends Expr {
    public Call(Expr callee, List<Expr> arguments, List<Keyword> keywords) {
      super(callee.line, callee.column);
      this.callee = callee;
      this.arguments = List.copyOf(arguments);
      this.keywords = List.copyOf(keywords);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallExpr(this);
    }

    public final Expr callee;
    public final List<Expr> arguments;
    public final List<Keyword> keywords;
  }

  // a `name=value` call argument
  public static class Keyword {
    public Keyword(String name, Expr value) {
      this.name = name;
      this.value = value;
    }

    public final String name;
    public final Expr value;
  }

  public static class Attribute extends Expr {
    public Attribute(Expr object, String name) {
      super(object.line, object.column);
      this.object = object;
      this.name = name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAttributeExpr(this);
    }

    public final Expr object;
    public final String name;
  }

  public static class Subscript extends Expr {
    public Subscript(Expr object, Expr index) {
      super(object.line, object.column);
      this.object = object;
      this.index = index;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSubscriptExpr(this);
    }

    public final Expr object;
    public final Expr index;
  }

  public static class Name extends Expr {
    public Name(int line, int column, String id) {
      super(line, column);
      this.id = id;
    }

    public Name(Token token) { this(token.line, token.column, token.lexeme); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNameExpr(this);
    }

    public final String id;
  }

  public static class Literal extends Expr {
    public enum Kind { INT, FLOAT, STRING, FSTRING, BOOL, NONE }

    // `value` is a BigInteger, Double, String, Boolean or null, per `kind`
    public Literal(int line, int column, Kind kind, Object value) {
      super(line, column);
      this.kind = kind;
      this.value = value;
    }

    public static Literal ofInt(int line, int column, BigInteger value) {
      return new Literal(line, column, Kind.INT, value);
    }

    public static Literal ofString(int line, int column, String value) {
      return new Literal(line, column, Kind.STRING, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteralExpr(this);
    }

    public final Kind kind;
    public final Object value;
  }

  public static class ListDisplay extends Expr {
    public ListDisplay(int line, int column, List<Expr> elements) {
      super(line, column);
      this.elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitListDisplayExpr(this);
    }

    public final List<Expr> elements;
  }

  // keys.get(i) maps to values.get(i)
  public static class DictDisplay extends Expr {
    public DictDisplay(
        int line, int column, List<Expr> keys, List<Expr> values
    ) {
      super(line, column);
      this.keys = List.copyOf(keys);
      this.values = List.copyOf(values);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDictDisplayExpr(this);
    }

    public final List<Expr> keys;
    public final List<Expr> values;
  }

  public static class Lambda extends Expr {
    public Lambda(int line, int column, List<String> params, Expr body) {
      super(line, column);
      this.params = List.copyOf(params);
      this.body = body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLambdaExpr(this);
    }

    public final List<String> params;
    public final Expr body;
  }

  // `body aahaan test thats_it orElse`
  public static class Conditional extends Expr {
    public Conditional(Expr body, Expr test, Expr orElse) {
      super(body.line, body.column);
      this.body = body;
      this.test = test;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConditionalExpr(this);
    }

    public final Expr body;
    public final Expr test;
    public final Expr orElse;
  }
}
