package ca.gc.cra.trail.application.errors;

/**
 * Raised when an event is submitted to a writer that has not been started.
 *
 * @since 0.1.0
 */
public final class NotInitializedException extends TrailException {
  private static final long serialVersionUID = 1L;

  public NotInitializedException(String message) {
    super(message);
  }
}
