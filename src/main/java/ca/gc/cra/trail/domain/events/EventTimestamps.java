package ca.gc.cra.trail.domain.events;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * ISO-8601 timestamp handling for persisted events ({@code 2025-11-02T15:30:00.123Z}).
 *
 * @since 0.1.0
 */
public final class EventTimestamps {
  private static final DateTimeFormatter WIRE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private EventTimestamps() {
    // Utility
  }

  /**
   * Truncates an instant to millisecond precision.
   *
   * @param instant source instant
   * @return instant with sub-millisecond digits removed
   */
  public static Instant truncate(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Formats an instant in UTC with exactly three fractional digits.
   *
   * @param instant instant to format
   * @return wire representation
   */
  public static String format(Instant instant) {
    return WIRE_FORMAT.format(instant);
  }

  /**
   * Parses an ISO-8601 date-time that carries a time component and an offset or {@code Z}.
   *
   * @param raw persisted value
   * @return parsed instant, or empty when the value is not a complete date-time
   */
  public static Optional<Instant> parse(String raw) {
    if (raw == null || raw.indexOf('T') < 0) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(raw.trim()).toInstant());
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
