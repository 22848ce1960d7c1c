/**
 * Infrastructure adapters: the built-in parser, metrics backend and output formatters.
 * <p><strong>Role:</strong> Implements application ports; wired by {@code CompositionRoot}.</p>
 */
package ca.gc.cra.stepfrag.infrastructure;
