package ca.gc.cra.stepfrag.api;

import ca.gc.cra.stepfrag.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry settings from the effective configuration to the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Validates and applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param effective merged configuration
   * @return the exporter in effect
   * @throws IllegalArgumentException if a value is invalid
   */
  static String configureMetrics(Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = trim(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String resourceAttributes = trim(effective.get("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty(EXPORTER_PROPERTY, exporter);
    if (!endpoint.isEmpty()) {
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }
    if (!resourceAttributes.isEmpty()) {
      System.setProperty(RESOURCE_PROPERTY, resourceAttributes);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
