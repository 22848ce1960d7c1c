/**
 * Preflight diagnostics model for exchange files.
 * <p><strong>Role:</strong> Size tiers, memory advisories and header inspection helpers consumed by the profiler.</p>
 * <p><strong>Concurrency:</strong> All types are immutable or stateless.</p>
 */
package ca.gc.cra.stepfrag.domain.profile;
