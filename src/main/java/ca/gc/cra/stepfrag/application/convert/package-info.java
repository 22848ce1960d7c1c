/**
 * <strong>Purpose:</strong> Conversion use case and the pull-based chunk reader it hands to parsers.
 * <p><strong>Pipeline role:</strong> input file -> {@code ChunkedReaderAdapter} -> parser -> artifact -> write.</p>
 * <p><strong>Concurrency:</strong> One adapter per conversion, confined to the converting thread.</p>
 * <p><strong>Metrics:</strong> {@code convert.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.stepfrag.application.convert;
