/**
 * Core domain model for STEPFRAG profiling and conversion.
 * <p><strong>Role:</strong> Domain layer types describing file diagnostics, read sessions and conversion outcomes
 * without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@code StreamState} is thread-confined.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed the {@code profile.*} and {@code convert.*} metrics.</p>
 */
package ca.gc.cra.stepfrag.domain;
