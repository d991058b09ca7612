package ca.gc.cra.trail.domain.events;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status carried by agent invocation events.
 *
 * @since 0.1.0
 */
public enum AgentStatus {
  STARTED("started"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  AgentStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<AgentStatus> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (AgentStatus status : values()) {
      if (status.wireName.equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
