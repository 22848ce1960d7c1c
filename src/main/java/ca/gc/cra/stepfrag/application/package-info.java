/**
 * Application layer for STEPFRAG: ports plus the profile and convert use cases.
 * <p><strong>Concurrency:</strong> Use cases are single-threaded per file.</p>
 */
package ca.gc.cra.stepfrag.application;
