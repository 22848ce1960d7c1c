package ca.gc.cra.stepfrag.config;

import ca.gc.cra.stepfrag.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Validated settings for one {@code profile} run.
 *
 * @param input exchange file to inspect
 * @since 0.1.0
 */
public record ProfileConfig(Path input) {
  public ProfileConfig {
    Objects.requireNonNull(input, "input");
  }

  /**
   * Builds a configuration from a flat option map.
   *
   * @param options merged options; {@code in} (or {@code input}) is required
   * @return validated configuration
   * @throws IllegalArgumentException when {@code in} is missing or not a valid path
   */
  public static ProfileConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String raw = options.get("in");
    if (raw == null || raw.isBlank()) {
      raw = options.get("input");
    }
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    return new ProfileConfig(Paths.parse("in", raw));
  }
}
