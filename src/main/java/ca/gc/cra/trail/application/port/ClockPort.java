package ca.gc.cra.trail.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time for event timestamps and session ids.
 * <p><strong>Why:</strong> Lets tests pin time so session ids and timestamps are deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads from producer threads.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.trail.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant at millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}
