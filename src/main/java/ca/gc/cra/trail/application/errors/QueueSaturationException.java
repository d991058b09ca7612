package ca.gc.cra.trail.application.errors;

/**
 * Raised to the producer under the {@code REJECT} saturation policy when the writer queue stays full for
 * longer than the enqueue timeout.
 *
 * @since 0.1.0
 */
public final class QueueSaturationException extends TrailException {
  private static final long serialVersionUID = 1L;

  private final int capacity;

  public QueueSaturationException(String eventId, int capacity) {
    super("Writer queue saturated (capacity=" + capacity + "); event " + eventId + " rejected");
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }
}
