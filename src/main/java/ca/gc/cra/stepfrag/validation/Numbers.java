package ca.gc.cra.stepfrag.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by STEPFRAG CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards chunk sizes and compression levels before the parser allocates buffers.
 * <p><strong>Role:</strong> Support utilities invoked by configuration records and parser settings.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside the range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
