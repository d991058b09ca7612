package ca.gc.cra.trail.api;

/**
 * Process exit codes of the {@code trail} command.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Verification found problems in a session log. */
  VERIFY_FAILED(1),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read, written, or deleted. */
  IO_ERROR(3),
  /** Unexpected runtime failure, including an incomplete drain on shutdown. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
