/**
 * Sink adapters that deliver activity events to durable storage.
 * <p><strong>Role:</strong> Implementations of {@link ca.gc.cra.trail.application.port.EventSinkPort} plus the file
 * naming, listing, and retention helpers for session logs.</p>
 * <p><strong>Format:</strong> Newline-delimited JSON, one flat object per event, optionally gzip-compressed.</p>
 * <p><strong>Concurrency:</strong> Sinks are owned by the writer thread and are not thread-safe;
 * {@link ca.gc.cra.trail.infrastructure.persistence.EventJsonCodec} is.</p>
 */
package ca.gc.cra.trail.infrastructure.persistence;
