package ca.gc.cra.trail.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges settings from defaults, YAML, the environment, and explicit overrides while enforcing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings using precedence overrides &gt; environment &gt; YAML &gt; defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param environment environment and system property settings
   * @param overrides explicit overrides, e.g. CLI {@code key=value} arguments (may be empty)
   * @param defaults embedded defaults
   * @param warn receives one message per unknown key and per override that shadows a lower source
   * @return immutable merged settings
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnSink = warn == null ? message -> {} : warn;
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> envCopy = environment == null ? Map.of() : environment;
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    layer(merged, yamlCopy, "YAML", defaultsCopy, Map.of(), warnSink);
    layer(merged, envCopy, "environment", defaultsCopy, yamlCopy, warnSink);
    Map<String, String> lower = new LinkedHashMap<>(yamlCopy);
    lower.putAll(envCopy);
    layer(merged, overridesCopy, "override", defaultsCopy, lower, warnSink);

    return Map.copyOf(merged);
  }

  private static void layer(
      Map<String, String> merged,
      Map<String, String> source,
      String sourceName,
      Map<String, String> defaults,
      Map<String, String> lower,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (!defaults.isEmpty() && !defaults.containsKey(key)) {
        warn.accept("Ignoring unknown " + sourceName + " key: " + key);
        continue;
      }
      if (lower.containsKey(key)) {
        warn.accept(sourceName + " overrides lower-precedence value for key: " + key);
      }
      merged.put(key, value);
    }
  }
}
