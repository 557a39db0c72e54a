package dev.hermes;

// Common base of the errors that abort a translation run. Every error knows
// where in the source it was detected so the command line can point at it.
public abstract class HermesError extends RuntimeException {
  public final int line;
  // 0 when the column is not known
  public final int column;

  protected HermesError(String message, int line, int column) {
    super(message);
    this.line = line;
    this.column = column;
  }

  // human readable label, e.g. "Syntax Error"
  public abstract String kind();
}
