package ca.gc.cra.trail.application.port;

import ca.gc.cra.trail.domain.events.ActivityEvent;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Output port that appends activity events to durable storage.
 * <p><strong>Why:</strong> Lets the durable writer persist events without knowing the file layout or compression.</p>
 * <p><strong>Role:</strong> Sink side of the hexagon; implemented by {@code NdjsonEventSinkAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append each event as one complete record, in call order.</li>
 *   <li>Flush buffered bytes on request.</li>
 *   <li>Release file handles on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Owned by a single writer thread; implementations need not be thread-safe.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link ca.gc.cra.trail.application.errors.SinkWriteException}.</p>
 *
 * @since 0.1.0
 */
public interface EventSinkPort extends AutoCloseable {
  /**
   * Appends one event.
   *
   * @param event validated event; never {@code null}
   * @throws ca.gc.cra.trail.application.errors.SinkWriteException when the write fails
   */
  void persist(ActivityEvent event);

  /**
   * Flushes buffered records to the underlying storage.
   *
   * @throws ca.gc.cra.trail.application.errors.SinkWriteException when flushing fails
   */
  default void flush() {}

  /**
   * Flushes and releases the sink. Further calls to {@link #persist(ActivityEvent)} are invalid.
   *
   * @throws ca.gc.cra.trail.application.errors.SinkWriteException when closing fails
   */
  @Override
  default void close() {}

  /**
   * Returns the file currently being written, when the sink is file-backed.
   *
   * @return active file path, or empty for non-file sinks
   */
  default Optional<Path> location() {
    return Optional.empty();
  }
}
