package ca.gc.cra.trail.application.schema;

/**
 * One problem found while validating an event.
 *
 * @param field offending wire field name
 * @param message human-readable description
 * @since 0.1.0
 */
public record SchemaViolation(String field, String message) {
  @Override
  public String toString() {
    return field + ": " + message;
  }
}
