/**
 * <strong>Purpose:</strong> Configuration loading, merging and wiring for the STEPFRAG CLI.
 * <p><strong>Pipeline role:</strong> Turns defaults, YAML and CLI arguments into validated records and builds the
 * use cases that consume them.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.</p>
 * <p><strong>Observability:</strong> Validation failures surface as {@link IllegalArgumentException}s that the CLI
 * logs and maps to exit status 1.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.config;
