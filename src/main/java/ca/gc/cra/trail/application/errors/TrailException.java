package ca.gc.cra.trail.application.errors;

/**
 * Base type of every failure raised by the activity trail.
 *
 * <p>Unchecked so that producers can log from any call site without widening their own signatures.</p>
 *
 * @since 0.1.0
 */
public class TrailException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public TrailException(String message) {
    super(message);
  }

  public TrailException(String message, Throwable cause) {
    super(message, cause);
  }
}
