package dev.hermes.codegen;

import java.math.BigDecimal;
import java.math.BigInteger;

// Canonical Python source spellings for literal values.
final class PythonLiterals {
  // Python switches `repr(float)` to scientific notation outside this range
  // of decimal exponents
  private static final int MIN_FIXED_EXPONENT = -4;
  private static final int MAX_FIXED_EXPONENT = 16;

  private PythonLiterals() {}

  static String string(String value) {
    StringBuilder builder = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"')
        builder.append('\\');
      appendEscaped(builder, c);
    }
    return builder.append('"').toString();
  }

  // Expressions inside f-string fields may not contain backslashes before
  // Python 3.12, so quotes inside a field are never escaped. A body holding
  // both quote kinds gets a triple-quoted literal.
  static String formattedString(String value) {
    String delimiter;
    if (value.indexOf('"') < 0)
      delimiter = "\"";
    else if (value.indexOf('\'') < 0)
      delimiter = "'";
    else if (!value.contains("\"\"\""))
      delimiter = "\"\"\"";
    else
      delimiter = "'''";
    char quote = delimiter.charAt(0);
    boolean triple = delimiter.length() == 3;

    StringBuilder builder = new StringBuilder(value.length() + 8);
    builder.append('f').append(delimiter);
    int depth = 0;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '{' || c == '}') {
        // doubled braces outside a field are literal text
        if (depth == 0 && i + 1 < value.length() && value.charAt(i + 1) == c) {
          builder.append(c).append(c);
          i++;
          continue;
        }
        depth = c == '{' ? depth + 1 : Math.max(0, depth - 1);
      } else if (c == quote && depth == 0 && closes(value, i, quote, triple)) {
        builder.append('\\');
      }
      appendEscaped(builder, c);
    }
    return builder.append(delimiter).toString();
  }

  // whether an unescaped quote at `index` would end the literal early
  private static boolean closes(String value, int index, char quote, boolean triple) {
    if (!triple || index == value.length() - 1)
      return true;
    return index + 2 < value.length() && value.charAt(index + 1) == quote &&
        value.charAt(index + 2) == quote;
  }

  private static void appendEscaped(StringBuilder builder, char c) {
    switch (c) {
    case '\\':
      builder.append("\\\\");
      break;
    case '\n':
      builder.append("\\n");
      break;
    case '\t':
      builder.append("\\t");
      break;
    case '\r':
      builder.append("\\r");
      break;
    default:
      // Python rejects raw NUL in source; other controls are unreadable
      if (c < 0x20 || c == 0x7f)
        builder.append(String.format("\\x%02x", (int)c));
      else
        builder.append(c);
    }
  }

  static String integer(BigInteger value) { return value.toString(); }

  // Mirrors Python's `repr(float)`: shortest round-tripping digits, fixed
  // notation for exponents in [-4, 16), scientific otherwise.
  static String floating(double value) {
    if (Double.isNaN(value))
      return "float('nan')";
    if (Double.isInfinite(value))
      return value > 0 ? "float('inf')" : "float('-inf')";
    if (value == 0.0)
      return 1.0 / value < 0 ? "-0.0" : "0.0";

    BigDecimal decimal =
        new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
    String digits = decimal.unscaledValue().toString();
    int exponent = digits.length() - 1 - decimal.scale();
    String sign = value < 0 ? "-" : "";

    if (exponent >= MIN_FIXED_EXPONENT && exponent < MAX_FIXED_EXPONENT)
      return sign + fixed(digits, exponent);

    String mantissa = digits.length() == 1
                          ? digits
                          : digits.charAt(0) + "." + digits.substring(1);
    return sign + mantissa + String.format("e%+03d", exponent);
  }

  private static String fixed(String digits, int exponent) {
    if (exponent < 0)
      return "0." + "0".repeat(-exponent - 1) + digits;

    if (digits.length() <= exponent + 1)
      return digits + "0".repeat(exponent + 1 - digits.length()) + ".0";
    return digits.substring(0, exponent + 1) + "." +
        digits.substring(exponent + 1);
  }
}
