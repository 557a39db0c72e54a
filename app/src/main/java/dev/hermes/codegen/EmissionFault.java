package dev.hermes.codegen;

import dev.hermes.HermesError;

// Raised when the transpiler meets a tree it has no rule for. A tree built by
// the parser never triggers it; seeing one means a bug in this program.
public class EmissionFault extends HermesError {
  public EmissionFault(String message, int line, int column) {
    super(message, line, column);
  }

  @Override
  public String kind() {
    return "Emission Fault";
  }
}
