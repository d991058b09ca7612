package ca.gc.cra.trail.application.session;

import ca.gc.cra.trail.application.port.ClockPort;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Derives session ids from the wall clock using a {@link DateTimeFormatter} pattern evaluated in UTC.
 *
 * <p>The default pattern produces ids such as {@code session_20251102_153000}.</p>
 *
 * @since 0.1.0
 */
public final class SessionIdGenerator {
  /** Default session id pattern. */
  public static final String DEFAULT_PATTERN = "'session_'yyyyMMdd_HHmmss";

  private final DateTimeFormatter formatter;
  private final ClockPort clock;

  /**
   * Creates a generator.
   *
   * @param pattern {@link DateTimeFormatter} pattern; literal text must be quoted
   * @param clock time source
   * @throws IllegalArgumentException when the pattern is invalid or yields a blank id
   */
  public SessionIdGenerator(String pattern, ClockPort clock) {
    Objects.requireNonNull(pattern, "pattern");
    this.clock = Objects.requireNonNull(clock, "clock");
    try {
      this.formatter = DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("invalid sessionIdFormat pattern: " + pattern, ex);
    }
    if (newSessionId().isBlank()) {
      throw new IllegalArgumentException("sessionIdFormat produces blank ids: " + pattern);
    }
  }

  /**
   * Returns a session id derived from the current time.
   *
   * @return formatted session id
   */
  public String newSessionId() {
    return formatter.format(clock.now());
  }
}
