package ca.gc.cra.stepfrag.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits {@code key=value} tokens such as {@code in=model.ifc} into a map.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  private CliArgsParser() {}

  /**
   * Parses the given tokens. Only the first {@code '='} separates name from value, so {@code extra=a=b} keeps
   * {@code a=b}. An empty value ({@code out=}) is kept and clears a YAML setting. The last duplicate wins.
   *
   * @param args tokens without flags; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException for a bare token, a malformed name or control characters in a value
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    if (args == null) {
      return parsed;
    }
    for (String raw : args) {
      if (raw != null && !raw.isBlank()) {
        put(parsed, raw.trim());
      }
    }
    return parsed;
  }

  private static void put(Map<String, String> parsed, String token) {
    int split = token.indexOf('=');
    if (split <= 0) {
      throw new IllegalArgumentException("argument must be key=value (was '" + token + "')");
    }
    String name = token.substring(0, split).trim();
    if (!NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + name);
    }
    String value = token.substring(split + 1).trim();
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException("argument " + name + " must not contain control characters");
    }
    parsed.put(name, value);
  }
}
