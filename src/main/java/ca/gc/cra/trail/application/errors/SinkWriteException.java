package ca.gc.cra.trail.application.errors;

/**
 * I/O failure while appending to, flushing, or closing a sink. Raised by sink adapters and handled by the
 * writer thread, which logs it and moves on to the next event.
 *
 * @since 0.1.0
 */
public final class SinkWriteException extends TrailException {
  private static final long serialVersionUID = 1L;

  public SinkWriteException(String message) {
    super(message);
  }

  public SinkWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
