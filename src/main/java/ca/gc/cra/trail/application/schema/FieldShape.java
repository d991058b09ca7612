package ca.gc.cra.trail.application.schema;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Expected JSON shape of an event field.
 *
 * @since 0.1.0
 */
public enum FieldShape {
  /** JSON string. */
  STRING,
  /** JSON integer. */
  INTEGER,
  /** Any JSON number. */
  NUMBER,
  /** JSON boolean. */
  BOOLEAN,
  /** JSON array of strings. */
  STRING_LIST,
  /** JSON object. */
  OBJECT;

  /**
   * Tests whether a value decoded from JSON (or produced by a payload record) has this shape.
   *
   * @param value candidate value; never {@code null}
   * @return {@code true} when the value matches
   */
  boolean accepts(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case INTEGER -> value instanceof Integer
          || value instanceof Long
          || value instanceof Short
          || value instanceof Byte
          || value instanceof BigInteger;
      case NUMBER -> value instanceof Number;
      case BOOLEAN -> value instanceof Boolean;
      case STRING_LIST -> value instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
      case OBJECT -> value instanceof Map<?, ?>;
    };
  }
}
