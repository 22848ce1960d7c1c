/**
 * Built-in artifact parser used when no external exchange-format library is configured.
 */
package ca.gc.cra.stepfrag.infrastructure.parser;
