package ca.gc.cra.stepfrag.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics export settings resolved for one process.
 *
 * <p>Each value is read from an {@code otel.*} system property first and the matching {@code OTEL_*}
 * environment variable second. The CLI writes the properties after merging its own configuration.</p>
 *
 * @param exporter selected exporter; {@link Exporter#NONE} disables export
 * @param endpoint OTLP endpoint used when exporting
 * @param resourceAttributes extra resource attributes attached to every metric
 */
record TelemetrySettings(Exporter exporter, String endpoint, Attributes resourceAttributes) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  enum Exporter {
    OTLP,
    NONE;

    static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("otlp")) {
        return OTLP;
      }
      if (!normalized.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; metrics export disabled", raw);
      }
      return NONE;
    }
  }

  static TelemetrySettings fromSystem() {
    return resolve(System.getProperties(), System::getenv);
  }

  static TelemetrySettings resolve(Properties properties, UnaryOperator<String> environment) {
    Exporter exporter = Exporter.parse(lookup(
        properties, environment, "otel.metrics.exporter", "OTEL_METRICS_EXPORTER"));
    String endpoint = lookup(properties, environment, "otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT");
    String attributes = lookup(properties, environment, "otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES");
    return new TelemetrySettings(
        exporter,
        endpoint == null ? DEFAULT_ENDPOINT : endpoint,
        parseResourceAttributes(attributes));
  }

  /**
   * Parses {@code key=value} pairs separated by commas. Malformed entries are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      String key = eq > 0 ? trimmed.substring(0, eq).trim() : "";
      String value = eq > 0 ? trimmed.substring(eq + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String lookup(
      Properties properties, UnaryOperator<String> environment, String property, String variable) {
    String value = properties.getProperty(property);
    if (value == null || value.isBlank()) {
      value = environment.apply(variable);
    }
    return value == null || value.isBlank() ? null : value.trim();
  }
}
