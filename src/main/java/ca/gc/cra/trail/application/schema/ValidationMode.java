package ca.gc.cra.trail.application.schema;

import java.util.Locale;

/**
 * How the logger reacts to events that fail schema validation.
 *
 * @since 0.1.0
 */
public enum ValidationMode {
  /** Reject the event and throw to the caller; nothing is written. */
  STRICT,
  /** Write the event annotated with {@code validation_warnings}. */
  LENIENT,
  /** Skip validation entirely and trust the caller. */
  DISABLED;

  /**
   * Parses a configured mode name.
   *
   * @param raw configured value, case-insensitive
   * @return matching mode
   * @throws IllegalArgumentException when the value is unknown
   */
  public static ValidationMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("validationMode must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "validationMode must be STRICT, LENIENT, or DISABLED (was " + raw + ")", ex);
    }
  }
}
