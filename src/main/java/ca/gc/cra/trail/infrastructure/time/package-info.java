/**
 * Time sources implementing {@link ca.gc.cra.trail.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.trail.infrastructure.time;
