package ca.gc.cra.trail.domain.events;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity attached to error events.
 *
 * @since 0.1.0
 */
public enum ErrorSeverity {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  CRITICAL("critical");

  private final String wireName;

  ErrorSeverity(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<ErrorSeverity> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ErrorSeverity severity : values()) {
      if (severity.wireName.equals(normalized)) {
        return Optional.of(severity);
      }
    }
    return Optional.empty();
  }
}
