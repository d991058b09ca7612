package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.domain.events.ActivityEvent;

/**
 * Sink that discards every event. Wired when logging is disabled so the rest of the pipeline keeps its shape.
 * <p>Thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpEventSinkAdapter implements EventSinkPort {
  /**
   * Discards the event.
   *
   * @param event ignored
   */
  @Override
  public void persist(ActivityEvent event) {
    // Disabled logging: nothing is written.
  }
}
