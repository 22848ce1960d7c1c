package ca.gc.cra.stepfrag.infrastructure.metrics;

import ca.gc.cra.stepfrag.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards STEPFRAG counters and observations to OpenTelemetry.
 *
 * <p>Keys ending in {@code .millis} are recorded with unit {@code ms}, keys ending in {@code .bytes} with unit
 * {@code By}; everything else is dimensionless.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("stepfrag.metric.key");
  private static final String FALLBACK_METRIC_NAME = "stepfrag.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by the {@code otel.*} system properties.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
    if (handle.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongCounter> instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.delegate().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.delegate().record(value, instrument.attributes());
  }

  /** Pushes pending observations to the exporter. */
  public void forceFlush() {
    handle.flush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    handle.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("STEPFRAG counter for " + key)
        .build();
    logSanitized(key, name);
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription("STEPFRAG observation for " + key)
        .build();
    logSanitized(key, name);
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private static void logSanitized(String key, String name) {
    if (!name.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
  }

  static String unitFor(String key) {
    if (key.endsWith(".millis")) {
      return "ms";
    }
    if (key.endsWith(".bytes")) {
      return "By";
    }
    return "1";
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T delegate, Attributes attributes) {}
}
