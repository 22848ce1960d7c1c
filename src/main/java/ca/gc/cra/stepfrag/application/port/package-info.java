/**
 * <strong>Purpose:</strong> Core ports defining the profile and convert workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate parsers,
 * file handles, clocks and metrics backends.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.stepfrag.application.port.ChunkSource} is single-threaded;
 * the remaining ports must be thread-safe.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.application.port;
