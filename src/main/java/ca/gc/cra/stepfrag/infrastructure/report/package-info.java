/**
 * Text renderings of profiles and conversion results for stdout.
 * <p><strong>Role:</strong> The result line is a machine protocol; the profile report is for operators.</p>
 */
package ca.gc.cra.stepfrag.infrastructure.report;
