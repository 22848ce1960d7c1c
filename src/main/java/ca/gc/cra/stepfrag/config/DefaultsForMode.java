package ca.gc.cra.stepfrag.config;

import ca.gc.cra.stepfrag.infrastructure.parser.ParserSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each STEPFRAG command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys. {@code in} has no default and must come
 * from the CLI or YAML.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code convert} or {@code profile})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "convert" -> buildConvertDefaults();
      case "profile" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildConvertDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", "");
    map.put("fragmentExtension", ConvertConfig.DEFAULT_EXTENSION);
    map.put("chunkBytes", Integer.toString(ParserSettings.DEFAULT_CHUNK_BYTES));
    map.put("compressionLevel", Integer.toString(ParserSettings.DEFAULT_COMPRESSION_LEVEL));
    map.put("preflight", "false");
    return map;
  }
}
