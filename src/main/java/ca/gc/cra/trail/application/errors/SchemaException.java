package ca.gc.cra.trail.application.errors;

import java.util.List;

/**
 * Raised in strict validation mode when an event does not satisfy its kind's schema. The event is not written.
 *
 * @since 0.1.0
 */
public final class SchemaException extends TrailException {
  private static final long serialVersionUID = 1L;

  private final String eventType;
  private final List<String> violations;

  public SchemaException(String eventType, List<String> violations) {
    super("Event " + eventType + " failed schema validation: " + String.join("; ", violations));
    this.eventType = eventType;
    this.violations = List.copyOf(violations);
  }

  public String eventType() {
    return eventType;
  }

  /**
   * Returns the individual problems found, one message per field.
   *
   * @return immutable list of violation messages
   */
  public List<String> violations() {
    return violations;
  }
}
