package ca.gc.cra.stepfrag.config;

import ca.gc.cra.stepfrag.application.convert.ConversionOrchestrator;
import ca.gc.cra.stepfrag.application.port.ArtifactParser;
import ca.gc.cra.stepfrag.application.port.ChannelOpener;
import ca.gc.cra.stepfrag.application.port.ClockPort;
import ca.gc.cra.stepfrag.application.port.MetricsPort;
import ca.gc.cra.stepfrag.application.profile.FileProfiler;
import ca.gc.cra.stepfrag.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.stepfrag.infrastructure.parser.DeflateFragmentParser;
import ca.gc.cra.stepfrag.infrastructure.parser.ParserSettings;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires STEPFRAG use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the CLI free of construction details and gives tests one seam to swap the parser or
 * metrics backend.</p>
 * <p><strong>Role:</strong> Adapter composition root for the profile and convert commands.</p>
 * <p><strong>Thread-safety:</strong> Factory methods create new use case instances and are not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and closes it, flushing pending exports.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final AutoCloseable metricsLifecycle;
  private final Function<ParserSettings, ArtifactParser> parserFactory;

  /**
   * Creates a root backed by OpenTelemetry metrics and the built-in parser.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  private CompositionRoot(OpenTelemetryMetricsAdapter adapter) {
    this(adapter, adapter, DeflateFragmentParser::new);
  }

  /**
   * Creates a root with explicit collaborators.
   *
   * @param metrics metrics port shared by all use cases
   * @param metricsLifecycle closed by {@link #close()}; may be {@code null}
   * @param parserFactory builds the artifact parser for the configured settings
   */
  public CompositionRoot(
      MetricsPort metrics,
      AutoCloseable metricsLifecycle,
      Function<ParserSettings, ArtifactParser> parserFactory) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsLifecycle = metricsLifecycle;
    this.parserFactory = Objects.requireNonNull(parserFactory, "parserFactory");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public FileProfiler fileProfiler() {
    return new FileProfiler(metrics);
  }

  /**
   * Builds an orchestrator using a parser configured with {@code settings}.
   *
   * @param settings parser tuning
   * @return orchestrator reading through {@link ChannelOpener#FILE_CHANNEL}
   */
  public ConversionOrchestrator conversionOrchestrator(ParserSettings settings) {
    ArtifactParser parser = parserFactory.apply(Objects.requireNonNull(settings, "settings"));
    return new ConversionOrchestrator(parser, ChannelOpener.FILE_CHANNEL, metrics, ClockPort.SYSTEM);
  }

  @Override
  public void close() throws Exception {
    if (metricsLifecycle != null) {
      metricsLifecycle.close();
    }
  }
}
