package ca.gc.cra.trail.domain.events;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> The seven fixed kinds of activity event recorded by TRAIL.
 * <p><strong>Why:</strong> Gives the schema registry, producers, and sinks a closed vocabulary for {@code event_type}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum EventType {
  /** An agent was invoked by a user or another agent. */
  AGENT_INVOCATION("agent_invocation"),
  /** An agent used a tool. */
  TOOL_USAGE("tool_usage"),
  /** An agent touched a file. */
  FILE_OPERATION("file_operation"),
  /** An agent chose between options. */
  DECISION("decision"),
  /** An agent hit an error. */
  ERROR("error"),
  /** Periodic checkpoint of token and context usage. */
  CONTEXT_SNAPSHOT("context_snapshot"),
  /** An agent validated a task or artifact. */
  VALIDATION("validation");

  private final String wireName;

  EventType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value written to the {@code event_type} field.
   *
   * @return lowercase wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name back to its kind.
   *
   * @param raw value read from {@code event_type}; may be {@code null}
   * @return matching kind, or empty when unknown
   */
  public static Optional<EventType> fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (EventType type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
