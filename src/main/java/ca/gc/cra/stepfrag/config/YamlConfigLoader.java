package ca.gc.cra.stepfrag.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the STEPFRAG YAML file into a flat map for one command.
 *
 * <pre>
 * common:
 *   metricsExporter: none
 * convert:
 *   fragmentExtension: .frag
 *   parser:
 *     chunkBytes: 131072
 * </pre>
 *
 * <p>{@code common} is applied first and the command's own section second. Nested mappings become dotted keys
 * such as {@code parser.chunkBytes}; section names match case-insensitively.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * @param path YAML file
   * @param mode {@code convert} or {@code profile}
   * @return merged settings, or empty when {@code path} does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document = parse(path);
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String section : List.of(COMMON, mode.trim().toLowerCase(Locale.ROOT))) {
      Object node = section(root, section);
      if (node != null) {
        flatten(mapping(node, section), "", settings);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object parse(Path path) throws IOException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return yaml.load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Object section(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " section must be a mapping");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " section contains a blank or non-string key");
      }
      typed.put(name.trim(), value);
    });
    return typed;
  }

  private static void flatten(Map<String, Object> node, String prefix, Map<String, String> out) {
    node.forEach((name, value) -> {
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, key), key, out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        out.put(key, value == null ? "" : value.toString());
      }
    });
  }
}
