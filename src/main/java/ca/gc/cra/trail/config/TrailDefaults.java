package ca.gc.cra.trail.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default settings, keyed exactly as YAML, environment, and CLI sources key them.
 *
 * <p>The map is the single list of recognised keys: {@link EnvironmentOverrides} only looks up keys that appear
 * here.</p>
 */
public final class TrailDefaults {
  private static final Map<String, String> DEFAULTS = build();

  private TrailDefaults() {}

  /**
   * Returns the defaults as strings.
   *
   * @return unmodifiable ordered map of key to default value
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    TrailConfig d = TrailConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("enabled", Boolean.toString(d.enabled()));
    map.put("logDir", d.logDir().toString());
    map.put("compression", Boolean.toString(d.compression()));
    map.put("validateSchemas", Boolean.toString(d.validateSchemas()));
    map.put("validationMode", d.validationMode().name());
    map.put("sessionIdFormat", d.sessionIdFormat());
    map.put("eventIdWidth", Integer.toString(d.eventIdWidth()));
    map.put("maxSubmitLatencyMicros", Long.toString(d.maxSubmitLatencyMicros()));
    map.put("queueCapacity", Integer.toString(d.queueCapacity()));
    map.put("saturationPolicy", d.saturationPolicy().name());
    map.put("enqueueTimeoutMillis", Long.toString(d.enqueueTimeoutMillis()));
    map.put("pollIntervalMillis", Long.toString(d.pollIntervalMillis()));
    map.put("flushEachEvent", Boolean.toString(d.flushEachEvent()));
    map.put("rollMiB", Integer.toString(d.rollMiB()));
    map.put("shutdownTimeoutMillis", Long.toString(d.shutdownTimeoutMillis()));
    map.put("exitShutdownTimeoutMillis", Long.toString(d.exitShutdownTimeoutMillis()));
    map.put("registerShutdownHook", Boolean.toString(d.registerShutdownHook()));
    map.put("retentionCount", Integer.toString(d.retentionCount()));
    map.put("defaultTokenBudget", Long.toString(d.defaultTokenBudget()));
    map.put("metricsExporter", d.metricsExporter());
    map.put("verbose", Boolean.toString(d.verbose()));
    return Collections.unmodifiableMap(map);
  }
}
