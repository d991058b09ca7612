package ca.gc.cra.trail.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into an ordered map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^-{0,2}[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}. A key given twice keeps its last value. Values may be empty, which
   * leaves the setting at its default.
   *
   * @param args arguments; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument has no {@code '='}, an invalid key, or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value);
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
