/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound file-content previews before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for profile and convert diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.logging;
