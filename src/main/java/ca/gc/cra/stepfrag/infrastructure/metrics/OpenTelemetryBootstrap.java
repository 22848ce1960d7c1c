package ca.gc.cra.stepfrag.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter for a STEPFRAG CLI run.
 *
 * <p>Export is off unless {@link TelemetrySettings} selects OTLP. A conversion run is short and usually has no
 * collector, so the no-op meter is the common case.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.stepfrag";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static MeterHandle initialize() {
    return initialize(TelemetrySettings.fromSystem());
  }

  static MeterHandle initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == TelemetrySettings.Exporter.NONE) {
      log.debug("Metrics export disabled");
      return MeterHandle.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = open(reader, settings.resourceAttributes());
      log.info("Exporting metrics via OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OTLP metrics export to {}; metrics disabled", settings.endpoint(), ex);
      return MeterHandle.noop();
    }
  }

  /** Wires a meter to the given reader, typically an in-memory reader. */
  static MeterHandle forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle open(MetricReader reader, Attributes extraAttributes) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(
            AttributeKey.stringKey("service.name"), "stepfrag",
            AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
            AttributeKey.stringKey("service.version"), version)))
        .merge(Resource.create(extraAttributes));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, provider);
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  /** Meter plus the provider that owns it; the provider is absent in no-op mode. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      if (!result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics {} did not complete within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
