package ca.gc.cra.stepfrag.api;

import ca.gc.cra.stepfrag.config.ConfigMerger;
import ca.gc.cra.stepfrag.config.DefaultsForMode;
import ca.gc.cra.stepfrag.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Resolves the effective configuration for {@code mode} from CLI pairs, an optional YAML file and defaults.
   *
   * @param mode command name
   * @param kv CLI key/value pairs; the {@code config} entry is consumed
   * @param log logger receiving override warnings
   * @return merged configuration
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or a required key is absent
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Logger log) throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
