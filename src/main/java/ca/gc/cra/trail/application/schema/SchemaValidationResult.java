package ca.gc.cra.trail.application.schema;

import java.util.List;

/**
 * Outcome of validating one event.
 *
 * @param eventType wire name of the validated kind, or {@code null} when it could not be determined
 * @param violations problems found; empty when the event is valid
 * @since 0.1.0
 */
public record SchemaValidationResult(String eventType, List<SchemaViolation> violations) {
  public SchemaValidationResult {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public boolean valid() {
    return violations.isEmpty();
  }

  /**
   * Renders violations as {@code field: message} strings, the form stored in {@code validation_warnings}.
   *
   * @return messages in discovery order
   */
  public List<String> messages() {
    return violations.stream().map(SchemaViolation::toString).toList();
  }
}
