/**
 * Event delivery pipeline: the durable writer and the session lifecycle that owns it.
 * <p>Producers hand stamped events to {@link ca.gc.cra.trail.application.pipeline.DurableEventWriter}, which queues
 * them for a single {@code trail-writer-*} thread; that thread is the only code touching the sink.
 * {@link ca.gc.cra.trail.application.pipeline.TrailLifecycle} creates the writer on first use and drains it on
 * shutdown.</p>
 * <p>Drops, sink errors, and queue depth surface via {@link ca.gc.cra.trail.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.pipeline;
