/**
 * Conversion outcome model.
 * <p><strong>Role:</strong> Results and statistics returned to callers and serialized on the result line.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 */
package ca.gc.cra.stepfrag.domain.convert;
