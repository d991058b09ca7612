package ca.gc.cra.trail.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by TRAIL configuration parsing and the identifier allocator.
 * <p><strong>Why:</strong> Rejects queue capacities, timeouts, and widths that would leave the writer unusable before
 * any thread or file is allocated.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when validation
 * fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and validates its range.
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a number or is out of range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + raw + ")", ex);
    }
    return requireRange(name, value, min, max);
  }
}
