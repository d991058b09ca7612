package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class EnvironmentOverridesTest {

  @Test
  void environmentNamesAreUpperSnakeCase() {
    assertEquals("TRAIL_LOG_DIR", EnvironmentOverrides.environmentName("logDir"));
    assertEquals("TRAIL_ROLL_MIB", EnvironmentOverrides.environmentName("rollMiB"));
    assertEquals("TRAIL_MAX_SUBMIT_LATENCY_MICROS", EnvironmentOverrides.environmentName("maxSubmitLatencyMicros"));
    assertEquals("TRAIL_ENABLED", EnvironmentOverrides.environmentName("enabled"));
  }

  @Test
  void systemPropertiesWinOverEnvironment() {
    Properties properties = new Properties();
    properties.setProperty("trail.queueCapacity", "256");
    Map<String, String> env = Map.of(
        "TRAIL_QUEUE_CAPACITY", "128",
        "TRAIL_COMPRESSION", " false ",
        "TRAIL_RETENTION_COUNT", " ",
        "TRAIL_UNKNOWN", "x");

    Map<String, String> collected = EnvironmentOverrides.collect(env, properties);

    assertEquals(Map.of("queueCapacity", "256", "compression", "false"), collected);
    assertFalse(collected.containsKey("retentionCount"));
  }
}
