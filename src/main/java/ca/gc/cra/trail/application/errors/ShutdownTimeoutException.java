package ca.gc.cra.trail.application.errors;

import java.time.Duration;

/**
 * Raised by shutdown when the writer could not drain its queue within the allotted time.
 *
 * @since 0.1.0
 */
public final class ShutdownTimeoutException extends TrailException {
  private static final long serialVersionUID = 1L;

  private final long unflushedEvents;

  public ShutdownTimeoutException(Duration timeout, long unflushedEvents) {
    super("Writer did not drain within " + timeout.toMillis() + " ms; " + unflushedEvents
        + " event(s) were not flushed");
    this.unflushedEvents = unflushedEvents;
  }

  /**
   * Returns how many accepted events never reached the sink.
   *
   * @return lost event count
   */
  public long unflushedEvents() {
    return unflushedEvents;
  }
}
