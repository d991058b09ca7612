package ca.gc.cra.trail.application.schema;

import java.util.Objects;
import java.util.Set;

/**
 * Constraint on a single payload field.
 *
 * @param name wire field name
 * @param shape expected JSON shape
 * @param required whether the field must be present and, for strings, non-blank
 * @param allowedValues permitted string values; empty when unrestricted. For {@link FieldShape#OBJECT} fields
 *     the constraint applies to every value of the object.
 * @param min inclusive numeric lower bound, or {@code null}
 * @param max inclusive numeric upper bound, or {@code null}
 * @since 0.1.0
 */
public record FieldRule(
    String name, FieldShape shape, boolean required, Set<String> allowedValues, Double min, Double max) {

  public FieldRule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(shape, "shape");
    allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
  }
}
