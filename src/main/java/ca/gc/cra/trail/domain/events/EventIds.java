package ca.gc.cra.trail.domain.events;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formatting and parsing of {@code evt_NNN} event identifiers.
 *
 * <p>Ids are zero-padded to a configurable width. From sequence 1000 onwards the width grows to at
 * least six digits, so text order breaks at that boundary ({@code evt_001000} sorts before
 * {@code evt_999}). Order ids by {@link #sequenceOf(String)}, never as strings.</p>
 *
 * @since 0.1.0
 */
public final class EventIds {
  /** Prefix shared by all event ids. */
  public static final String PREFIX = "evt_";
  /** Default zero-padding width. */
  public static final int DEFAULT_WIDTH = 3;

  private static final int WIDE_THRESHOLD = 1_000;
  private static final int WIDE_MIN_WIDTH = 6;
  private static final Pattern ID_PATTERN = Pattern.compile("^evt_(\\d{1,18})$");

  private EventIds() {
    // Utility
  }

  /**
   * Formats a sequence number as an event id.
   *
   * @param sequence one-based sequence number; must be positive
   * @param width configured zero-padding width; must be between 1 and 18
   * @return formatted id such as {@code evt_007}
   * @throws IllegalArgumentException when {@code sequence} or {@code width} is out of range
   */
  public static String format(long sequence, int width) {
    if (sequence <= 0) {
      throw new IllegalArgumentException("sequence must be positive (was " + sequence + ")");
    }
    if (width < 1 || width > 18) {
      throw new IllegalArgumentException("width must be between 1 and 18 (was " + width + ")");
    }
    String digits = Long.toString(sequence);
    int effectiveWidth = sequence < WIDE_THRESHOLD
        ? width
        : Math.max(width, Math.max(WIDE_MIN_WIDTH, digits.length()));
    StringBuilder sb = new StringBuilder(PREFIX.length() + effectiveWidth);
    sb.append(PREFIX);
    for (int i = digits.length(); i < effectiveWidth; i++) {
      sb.append('0');
    }
    return sb.append(digits).toString();
  }

  /**
   * Parses the numeric sequence of an event id.
   *
   * @param eventId id such as {@code evt_042}
   * @return parsed sequence
   * @throws IllegalArgumentException when the id is malformed
   */
  public static long sequenceOf(String eventId) {
    if (eventId == null) {
      throw new IllegalArgumentException("event id must not be null");
    }
    Matcher matcher = ID_PATTERN.matcher(eventId);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("malformed event id: " + eventId);
    }
    return Long.parseLong(matcher.group(1));
  }

  /**
   * Checks whether a value looks like an event id.
   *
   * @param eventId candidate text; may be {@code null}
   * @return {@code true} when the value matches {@code evt_<digits>}
   */
  public static boolean isWellFormed(String eventId) {
    return eventId != null && ID_PATTERN.matcher(eventId).matches();
  }
}
