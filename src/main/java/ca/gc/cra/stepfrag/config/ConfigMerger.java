package ca.gc.cra.stepfrag.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and required keys.
 */
public final class ConfigMerger {
  private static final Map<String, String> ALIASES = Map.of(
      "input", "in",
      "output", "out",
      "parser.chunkBytes", "chunkBytes",
      "parser.compressionLevel", "compressionLevel");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * <p>Long-form keys ({@code input}, {@code output}, {@code parser.chunkBytes}, {@code parser.compressionLevel})
   * are folded onto their short forms before merging.</p>
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a required key is missing
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = canonical(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = canonical(cli == null ? Map.of() : cli);

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static Map<String, String> canonical(Map<String, String> source) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        continue;
      }
      String key = ALIASES.getOrDefault(entry.getKey(), entry.getKey());
      // the short form wins when both spellings are present
      if (!key.equals(entry.getKey()) && source.containsKey(key)) {
        continue;
      }
      result.put(key, entry.getValue());
    }
    return result;
  }

  private static void validate(String mode, Map<String, String> effective) {
    String in = effective.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in is required for " + mode);
    }
  }
}
