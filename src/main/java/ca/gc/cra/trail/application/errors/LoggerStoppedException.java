package ca.gc.cra.trail.application.errors;

/**
 * Raised when an event is submitted after shutdown has begun. Events are never discarded silently once the
 * writer is draining or stopped.
 *
 * @since 0.1.0
 */
public final class LoggerStoppedException extends TrailException {
  private static final long serialVersionUID = 1L;

  public LoggerStoppedException(String message) {
    super(message);
  }
}
