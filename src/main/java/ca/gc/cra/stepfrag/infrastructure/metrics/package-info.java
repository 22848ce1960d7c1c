/**
 * <strong>Purpose:</strong> OpenTelemetry-backed implementation of the metrics port.
 * <p><strong>Pipeline role:</strong> Records {@code profile.*} and {@code convert.*} instruments.</p>
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Export is disabled unless {@code metricsExporter=otlp} is configured.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.infrastructure.metrics;
