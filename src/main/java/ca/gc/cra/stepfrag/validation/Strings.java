package ca.gc.cra.stepfrag.validation;

import java.util.regex.Pattern;

/**
 * String checks for CLI and YAML values that end up in file names or telemetry attributes.
 *
 * <p>All failures are {@link IllegalArgumentException}s whose message starts with the parameter name.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  // one or more dot-separated segments, e.g. ".frag" or ".frag.gz"
  private static final Pattern EXTENSION = Pattern.compile("(\\.[A-Za-z0-9_-]+)+");

  private Strings() {}

  /**
   * Returns the trimmed value after rejecting {@code null}, blank text and ISO control characters.
   *
   * @param name parameter name used in error messages
   * @param value raw text
   * @return trimmed text
   */
  public static String requireNonBlank(String name, String value) {
    if (value == null) {
      throw new NullPointerException(label(name));
    }
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw invalid(name, "must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw invalid(name, "must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates an artifact extension such as {@code .frag}.
   *
   * @param name parameter name used in error messages
   * @param value raw extension
   * @return trimmed extension
   */
  public static String requireExtension(String name, String value) {
    String extension = requireNonBlank(name, value);
    if (!EXTENSION.matcher(extension).matches()) {
      throw invalid(name, "must start with '.' and contain only letters, digits, underscore, hyphen or dot");
    }
    return extension;
  }

  /**
   * Validates text limited to printable ASCII ({@code 0x20-0x7E}) and at most {@code maxLength} characters.
   *
   * @param name parameter name used in error messages
   * @param value raw text
   * @param maxLength maximum length after trimming
   * @return trimmed text
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String text = requireNonBlank(name, value);
    if (text.length() > maxLength) {
      throw invalid(name, "length must be <= " + maxLength);
    }
    if (text.chars().anyMatch(c -> c < 0x20 || c > 0x7E)) {
      throw invalid(name, "must contain printable ASCII characters");
    }
    return text;
  }

  private static IllegalArgumentException invalid(String name, String problem) {
    return new IllegalArgumentException(label(name) + " " + problem);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
