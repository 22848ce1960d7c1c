package ca.gc.cra.stepfrag.config;

import ca.gc.cra.stepfrag.infrastructure.parser.ParserSettings;
import ca.gc.cra.stepfrag.validation.Numbers;
import ca.gc.cra.stepfrag.validation.Paths;
import ca.gc.cra.stepfrag.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one {@code convert} run.
 * <p><strong>Why:</strong> Resolves the artifact path and parser tuning once, before any file is opened.</p>
 * <p><strong>Role:</strong> Configuration record built from the merged CLI/YAML/default map.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param input exchange file to convert
 * @param output explicit artifact path; empty to derive it from {@code input}
 * @param fragmentExtension extension used when deriving the artifact path
 * @param chunkBytes bytes requested per parser read
 * @param compressionLevel DEFLATE level for the built-in parser
 * @param preflight whether to profile the input before converting
 * @since 0.1.0
 */
public record ConvertConfig(
    Path input,
    Optional<Path> output,
    String fragmentExtension,
    int chunkBytes,
    int compressionLevel,
    boolean preflight) {
  /** Extension of derived artifact paths. */
  public static final String DEFAULT_EXTENSION = ".frag";

  public ConvertConfig {
    Objects.requireNonNull(input, "input");
    output = output == null ? Optional.empty() : output;
    output.ifPresent(Paths::validateOutputFile);
    fragmentExtension = Strings.requireExtension("fragmentExtension", fragmentExtension);
    Numbers.requireRange("chunkBytes", chunkBytes, 1, ParserSettings.MAX_CHUNK_BYTES);
    Numbers.requireRange("compressionLevel", compressionLevel, 0, 9);
  }

  /**
   * Builds a configuration from a flat option map.
   *
   * @param options merged options; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static ConvertConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String inRaw = firstNonBlank(options, "in", "input");
    if (inRaw == null) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = Paths.parse("in", inRaw);
    String outRaw = firstNonBlank(options, "out", "output");
    Optional<Path> output = outRaw == null ? Optional.empty() : Optional.of(Paths.parse("out", outRaw));

    String extension = Optional.ofNullable(firstNonBlank(options, "fragmentExtension"))
        .orElse(DEFAULT_EXTENSION);
    int chunkBytes = parseInt(options, "chunkBytes", ParserSettings.DEFAULT_CHUNK_BYTES,
        1, ParserSettings.MAX_CHUNK_BYTES);
    int level = parseInt(options, "compressionLevel", ParserSettings.DEFAULT_COMPRESSION_LEVEL, 0, 9);
    boolean preflight = Boolean.parseBoolean(Optional.ofNullable(options.get("preflight")).orElse("false").trim());
    return new ConvertConfig(input, output, extension, chunkBytes, level, preflight);
  }

  /**
   * Artifact destination: the explicit output, or the input's sibling with {@link #fragmentExtension()}.
   *
   * @return output path
   */
  public Path resolveOutput() {
    return output.orElseGet(() -> Paths.withExtension(input, fragmentExtension));
  }

  public ParserSettings parserSettings() {
    return new ParserSettings(chunkBytes, compressionLevel);
  }

  private static int parseInt(
      Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }
}
