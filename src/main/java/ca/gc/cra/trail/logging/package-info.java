/**
 * Logging helpers: CLI verbosity and bounded log text.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Works against SLF4J with Logback as the bundled backend.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.logging;
