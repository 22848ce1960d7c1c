/**
 * <strong>Purpose:</strong> Command-line entry points for STEPFRAG.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} arguments and flags, merges configuration, runs the
 * profile or convert use case and maps the outcome to an {@link ca.gc.cra.stepfrag.api.ExitCode}.</p>
 * <p><strong>Concurrency:</strong> Entry points run on the main thread.</p>
 * <p><strong>Observability:</strong> Logs go to stderr; stdout carries only CLI output and the result line.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.api;
