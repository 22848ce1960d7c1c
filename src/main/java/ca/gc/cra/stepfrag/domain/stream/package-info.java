/**
 * Read-session model shared by chunk sources and parsers.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.stepfrag.domain.stream.StreamState} is thread-confined;
 * {@link ca.gc.cra.stepfrag.domain.stream.ReadRequest} is immutable.</p>
 */
package ca.gc.cra.stepfrag.domain.stream;
