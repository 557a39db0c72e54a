package dev.hermes.codegen;

import java.util.Map;

// The identifiers of the Hermes vocabulary that are spelled differently in
// Python. Lexer and parser keep the Hermes spelling; only the transpiler
// consults this table.
public final class IdentifierMap {
  private static final Map<String, String> remaps = Map.of(
      "myself", "self",
      "initialize", "__init__",
      "truth", "True",
      "falsehood", "False",
      "nothing", "None"
  );

  private IdentifierMap() {}

  public static String map(String identifier) {
    return remaps.getOrDefault(identifier, identifier);
  }

  public static Map<String, String> entries() { return remaps; }

  // Applies the table to whole-word identifiers inside the {...} replacement
  // fields of an f-string body. Literal text, doubled braces and quoted
  // strings inside a field are left alone.
  public static String mapFormatFields(String body) {
    StringBuilder result = new StringBuilder(body.length());
    int depth = 0;
    char quote = 0;
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);

      if (depth == 0) {
        if ((c == '{' || c == '}') && i + 1 < body.length() &&
            body.charAt(i + 1) == c) {
          result.append(c).append(c);
          i += 2;
          continue;
        }
        if (c == '{')
          depth++;
        result.append(c);
        i++;
        continue;
      }

      if (quote != 0) {
        if (c == quote)
          quote = 0;
        result.append(c);
        i++;
        continue;
      }

      if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      } else if (Character.isLetter(c) || c == '_') {
        int end = i;
        while (end < body.length() &&
               (Character.isLetterOrDigit(body.charAt(end)) ||
                body.charAt(end) == '_')) {
          end++;
        }
        result.append(map(body.substring(i, end)));
        i = end;
        continue;
      } else if (Character.isDigit(c)) {
        // keep `1e5` or `0x1f` from being read as identifiers
        int end = i;
        while (end < body.length() &&
               (Character.isLetterOrDigit(body.charAt(end)) ||
                body.charAt(end) == '_')) {
          end++;
        }
        result.append(body, i, end);
        i = end;
        continue;
      }
      result.append(c);
      i++;
    }
    return result.toString();
  }
}
