/**
 * Preflight profiling of exchange files.
 * <p><strong>Pipeline role:</strong> Advisory step that runs before, and independently of, conversion.</p>
 * <p><strong>Metrics:</strong> {@code profile.files}.</p>
 */
package ca.gc.cra.stepfrag.application.profile;
