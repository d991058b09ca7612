package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.pipeline.SaturationPolicy;
import ca.gc.cra.trail.application.schema.ValidationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TrailConfigTest {

  @Test
  void defaultsMatchFlatDefaults() {
    TrailConfig fromDefaults = TrailConfig.defaults();
    TrailConfig fromMap = TrailConfig.fromMap(TrailDefaults.asFlatMap());

    assertEquals(fromDefaults, fromMap);
    assertTrue(fromDefaults.enabled());
    assertEquals(Path.of(".trail", "logs"), fromDefaults.logDir());
    assertEquals(ValidationMode.LENIENT, fromDefaults.validationMode());
    assertEquals(SaturationPolicy.DROP_NEWEST, fromDefaults.saturationPolicy());
    assertEquals(10_000, fromDefaults.queueCapacity());
    assertEquals("none", fromDefaults.metricsExporter());
  }

  @Test
  void fromMapParsesOverrides() {
    TrailConfig config = TrailConfig.fromMap(Map.of(
        "logDir", " /tmp/trail ",
        "compression", "false",
        "validationMode", "strict",
        "saturationPolicy", "drop_oldest",
        "queueCapacity", "64",
        "metricsExporter", "OTLP",
        "retentionCount", "0"));

    assertEquals(Path.of("/tmp/trail"), config.logDir());
    assertFalse(config.compression());
    assertEquals(ValidationMode.STRICT, config.validationMode());
    assertEquals(SaturationPolicy.DROP_OLDEST, config.saturationPolicy());
    assertEquals(64, config.queueCapacity());
    assertEquals("otlp", config.metricsExporter());
    assertEquals(0, config.retentionCount());
  }

  @Test
  void blankValuesKeepDefaults() {
    TrailConfig config = TrailConfig.fromMap(Map.of("queueCapacity", " ", "logDir", ""));

    assertEquals(TrailConfig.defaults(), config);
  }

  @Test
  void validateSchemasFalseDisablesValidation() {
    TrailConfig config = TrailConfig.fromMap(Map.of("validateSchemas", "false", "validationMode", "STRICT"));

    assertEquals(ValidationMode.DISABLED, config.effectiveValidationMode());
    assertEquals(ValidationMode.DISABLED, config.producerSettings().validationMode());
  }

  @Test
  void derivedSettingsCarryDurations() {
    TrailConfig config = TrailConfig.fromMap(Map.of(
        "enqueueTimeoutMillis", "15",
        "maxSubmitLatencyMicros", "250",
        "shutdownTimeoutMillis", "750",
        "registerShutdownHook", "false"));

    assertEquals(Duration.ofMillis(15), config.writerSettings().enqueueTimeout());
    assertEquals(Duration.ofNanos(250_000), config.writerSettings().maxSubmitLatency());
    assertEquals(Duration.ofMillis(750), config.lifecycleSettings().shutdownTimeout());
    assertFalse(config.lifecycleSettings().registerShutdownHook());
  }

  @Test
  void rejectsOutOfRangeValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TrailConfig.fromMap(Map.of("queueCapacity", "0")));
    assertEquals("queueCapacity must be between 1 and 1000000 (was 0)", ex.getMessage());
  }

  @Test
  void rejectsMalformedValues() {
    IllegalArgumentException bool = assertThrows(IllegalArgumentException.class,
        () -> TrailConfig.fromMap(Map.of("compression", "yes")));
    assertEquals("compression must be true or false (was yes)", bool.getMessage());

    IllegalArgumentException number = assertThrows(IllegalArgumentException.class,
        () -> TrailConfig.fromMap(Map.of("retentionCount", "two")));
    assertEquals("retentionCount must be numeric (was two)", number.getMessage());

    assertThrows(IllegalArgumentException.class, () -> TrailConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class, () -> TrailConfig.fromMap(Map.of("validationMode", "loose")));
    assertThrows(IllegalArgumentException.class, () -> TrailConfig.fromMap(Map.of("sessionIdFormat", "{{bad")));
  }
}
