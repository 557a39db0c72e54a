package dev.hermes.parsing;

import java.util.List;

// Root of the tree: the top-level statements of one source file, in order.
public class Program {
  public final List<Stmt> statements;

  public Program(List<Stmt> statements) {
    this.statements = List.copyOf(statements);
  }
}
