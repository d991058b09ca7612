package ca.gc.cra.trail.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Collects settings from the process environment and system properties.
 *
 * <p>Every key known to {@link TrailDefaults} can be set as {@code TRAIL_<KEY>} in upper snake case
 * ({@code logDir} becomes {@code TRAIL_LOG_DIR}, {@code rollMiB} becomes {@code TRAIL_ROLL_MIB}) or as the system
 * property {@code trail.<key>}. System properties win over environment variables.</p>
 */
public final class EnvironmentOverrides {
  static final String ENV_PREFIX = "TRAIL_";
  static final String PROPERTY_PREFIX = "trail.";
  private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z][a-z])");

  private EnvironmentOverrides() {}

  /**
   * Reads overrides from the supplied sources.
   *
   * @param env environment variables
   * @param properties system properties
   * @return settings keyed by configuration key; only keys with non-blank values appear
   */
  public static Map<String, String> collect(Map<String, String> env, Properties properties) {
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(properties, "properties");
    Map<String, String> result = new LinkedHashMap<>();
    for (String key : TrailDefaults.asFlatMap().keySet()) {
      String value = properties.getProperty(PROPERTY_PREFIX + key);
      if (value == null || value.isBlank()) {
        value = env.get(environmentName(key));
      }
      if (value != null && !value.isBlank()) {
        result.put(key, value.trim());
      }
    }
    return result;
  }

  /**
   * Returns the environment variable name for a configuration key.
   *
   * @param key camel-case configuration key
   * @return variable name, e.g. {@code TRAIL_QUEUE_CAPACITY}
   */
  public static String environmentName(String key) {
    Objects.requireNonNull(key, "key");
    return ENV_PREFIX + WORD_BOUNDARY.matcher(key).replaceAll("_").toUpperCase(Locale.ROOT);
  }
}
