/**
 * <strong>Purpose:</strong> Ports between the activity trail core and its adapters: event sinks, metrics, and time.
 * <p><strong>Concurrency:</strong> Sinks are single-writer; metrics and clock ports must be thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.port;
