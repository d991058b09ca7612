package ca.gc.cra.trail.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by TRAIL configuration, CLI, and file naming.
 * <p><strong>Why:</strong> Session ids become file names, so they must be free of separators and control characters
 * before the sink opens anything.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern FILE_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a value used as a file name stem (for example a session id).
   *
   * @param name parameter name for diagnostics
   * @param value candidate stem
   * @return trimmed stem composed of {@code [A-Za-z0-9._-]}
   * @throws IllegalArgumentException when the value contains other characters or starts with a dot
   */
  public static String requireFileNameSafe(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!FILE_NAME_PATTERN.matcher(trimmed).matches() || trimmed.startsWith(".")) {
      throw new IllegalArgumentException(message(name, "must use only [A-Za-z0-9._-] (was " + trimmed + ")"));
    }
    return trimmed;
  }

  /**
   * Parses a boolean flag strictly; only {@code true} and {@code false} (any case) are accepted.
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse
   * @return parsed flag
   * @throws IllegalArgumentException for any other value
   */
  public static boolean parseBoolean(String name, String raw) {
    String trimmed = requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    return switch (trimmed) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + raw + ")"));
    };
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    return (name == null || name.isBlank() ? "value" : name) + " " + suffix;
  }
}
