package ca.gc.cra.trail.config;

import ca.gc.cra.trail.application.events.ProducerSettings;
import ca.gc.cra.trail.application.pipeline.LifecycleSettings;
import ca.gc.cra.trail.application.pipeline.SaturationPolicy;
import ca.gc.cra.trail.application.pipeline.WriterSettings;
import ca.gc.cra.trail.application.schema.ValidationMode;
import ca.gc.cra.trail.application.session.SessionIdGenerator;
import ca.gc.cra.trail.validation.Numbers;
import ca.gc.cra.trail.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Effective configuration of the activity trail.
 *
 * @param enabled whether events are written at all; ids are still allocated when disabled
 * @param logDir directory receiving session log files
 * @param compression gzip the session log
 * @param validateSchemas whether events are checked against the schema registry
 * @param validationMode {@code STRICT} rejects invalid events, {@code LENIENT} annotates them
 * @param sessionIdFormat {@link DateTimeFormatter} pattern for generated session ids, evaluated in UTC
 * @param eventIdWidth zero-padding width of event ids
 * @param maxSubmitLatencyMicros submission latency above which a warning is logged
 * @param queueCapacity bounded writer queue size
 * @param saturationPolicy behaviour when the writer queue is full
 * @param enqueueTimeoutMillis longest a producer waits for queue space
 * @param pollIntervalMillis writer thread poll interval
 * @param flushEachEvent flush after each event rather than after each batch
 * @param rollMiB roll the session log into parts of this size; zero disables rolling
 * @param shutdownTimeoutMillis timeout of an explicit shutdown
 * @param exitShutdownTimeoutMillis timeout of the JVM exit hook shutdown
 * @param registerShutdownHook register the JVM exit hook on initialization
 * @param retentionCount sessions kept by startup retention, current included; zero disables retention
 * @param defaultTokenBudget budget applied to context snapshots that report token usage without a budget
 * @param metricsExporter {@code none} or {@code otlp}
 * @param verbose enable DEBUG logging in the CLI
 * @since 0.1.0
 */
public record TrailConfig(
    boolean enabled,
    Path logDir,
    boolean compression,
    boolean validateSchemas,
    ValidationMode validationMode,
    String sessionIdFormat,
    int eventIdWidth,
    long maxSubmitLatencyMicros,
    int queueCapacity,
    SaturationPolicy saturationPolicy,
    long enqueueTimeoutMillis,
    long pollIntervalMillis,
    boolean flushEachEvent,
    int rollMiB,
    long shutdownTimeoutMillis,
    long exitShutdownTimeoutMillis,
    boolean registerShutdownHook,
    int retentionCount,
    long defaultTokenBudget,
    String metricsExporter,
    boolean verbose) {

  private static final Path DEFAULT_LOG_DIR = Path.of(".trail", "logs");
  private static final int MAX_EVENT_ID_WIDTH = 18;
  private static final int MAX_QUEUE_CAPACITY = 1_000_000;
  private static final long MAX_TIMEOUT_MILLIS = 600_000L;
  private static final int MAX_ROLL_MIB = 10_240;
  private static final int MAX_RETENTION = 10_000;

  /**
   * Validates configuration values.
   *
   * @throws IllegalArgumentException naming the offending key
   */
  public TrailConfig {
    logDir = Objects.requireNonNull(logDir, "logDir").normalize();
    validationMode = Objects.requireNonNullElse(validationMode, ValidationMode.LENIENT);
    saturationPolicy = Objects.requireNonNullElse(saturationPolicy, SaturationPolicy.DROP_NEWEST);
    sessionIdFormat = Strings.requireNonBlank("sessionIdFormat", sessionIdFormat);
    requirePattern(sessionIdFormat);
    Numbers.requireRange("eventIdWidth", eventIdWidth, 1, MAX_EVENT_ID_WIDTH);
    Numbers.requireRange("maxSubmitLatencyMicros", maxSubmitLatencyMicros, 0, 60_000_000L);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange("enqueueTimeoutMillis", enqueueTimeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("pollIntervalMillis", pollIntervalMillis, 1, 60_000L);
    Numbers.requireRange("rollMiB", rollMiB, 0, MAX_ROLL_MIB);
    Numbers.requireRange("shutdownTimeoutMillis", shutdownTimeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("exitShutdownTimeoutMillis", exitShutdownTimeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("retentionCount", retentionCount, 0, MAX_RETENTION);
    Numbers.requireRange("defaultTokenBudget", defaultTokenBudget, 1, Long.MAX_VALUE);
    metricsExporter = parseExporter(metricsExporter);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static TrailConfig defaults() {
    return new TrailConfig(
        true,
        DEFAULT_LOG_DIR,
        true,
        true,
        ValidationMode.LENIENT,
        SessionIdGenerator.DEFAULT_PATTERN,
        3,
        1_000L,
        10_000,
        SaturationPolicy.DROP_NEWEST,
        10L,
        25L,
        true,
        0,
        5_000L,
        2_000L,
        true,
        2,
        200_000L,
        "none",
        false);
  }

  /**
   * Builds a configuration from flat string settings; missing or blank keys keep their defaults.
   *
   * @param kv settings keyed by configuration key
   * @return parsed configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static TrailConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    TrailConfig d = defaults();
    return new TrailConfig(
        bool(kv, "enabled", d.enabled()),
        path(kv, "logDir", d.logDir()),
        bool(kv, "compression", d.compression()),
        bool(kv, "validateSchemas", d.validateSchemas()),
        present(kv, "validationMode") ? ValidationMode.parse(kv.get("validationMode")) : d.validationMode(),
        present(kv, "sessionIdFormat") ? kv.get("sessionIdFormat") : d.sessionIdFormat(),
        (int) number(kv, "eventIdWidth", d.eventIdWidth(), 1, MAX_EVENT_ID_WIDTH),
        number(kv, "maxSubmitLatencyMicros", d.maxSubmitLatencyMicros(), 0, 60_000_000L),
        (int) number(kv, "queueCapacity", d.queueCapacity(), 1, MAX_QUEUE_CAPACITY),
        present(kv, "saturationPolicy")
            ? SaturationPolicy.parse(kv.get("saturationPolicy"))
            : d.saturationPolicy(),
        number(kv, "enqueueTimeoutMillis", d.enqueueTimeoutMillis(), 0, MAX_TIMEOUT_MILLIS),
        number(kv, "pollIntervalMillis", d.pollIntervalMillis(), 1, 60_000L),
        bool(kv, "flushEachEvent", d.flushEachEvent()),
        (int) number(kv, "rollMiB", d.rollMiB(), 0, MAX_ROLL_MIB),
        number(kv, "shutdownTimeoutMillis", d.shutdownTimeoutMillis(), 0, MAX_TIMEOUT_MILLIS),
        number(kv, "exitShutdownTimeoutMillis", d.exitShutdownTimeoutMillis(), 0, MAX_TIMEOUT_MILLIS),
        bool(kv, "registerShutdownHook", d.registerShutdownHook()),
        (int) number(kv, "retentionCount", d.retentionCount(), 0, MAX_RETENTION),
        number(kv, "defaultTokenBudget", d.defaultTokenBudget(), 1, Long.MAX_VALUE),
        present(kv, "metricsExporter") ? kv.get("metricsExporter") : d.metricsExporter(),
        bool(kv, "verbose", d.verbose()));
  }

  /**
   * Returns the validation mode in effect, folding {@link #validateSchemas()} into it.
   *
   * @return {@link ValidationMode#DISABLED} when schema validation is off, otherwise {@link #validationMode()}
   */
  public ValidationMode effectiveValidationMode() {
    return validateSchemas ? validationMode : ValidationMode.DISABLED;
  }

  /**
   * Returns the writer tuning derived from this configuration.
   *
   * @return writer settings
   */
  public WriterSettings writerSettings() {
    return new WriterSettings(
        queueCapacity,
        saturationPolicy,
        Duration.ofMillis(enqueueTimeoutMillis),
        Duration.ofMillis(pollIntervalMillis),
        flushEachEvent,
        Duration.ofNanos(maxSubmitLatencyMicros * 1_000L));
  }

  /**
   * Returns the lifecycle settings derived from this configuration.
   *
   * @return lifecycle settings
   */
  public LifecycleSettings lifecycleSettings() {
    return new LifecycleSettings(
        eventIdWidth,
        Duration.ofMillis(shutdownTimeoutMillis),
        Duration.ofMillis(exitShutdownTimeoutMillis),
        registerShutdownHook);
  }

  /**
   * Returns the producer settings derived from this configuration.
   *
   * @return producer settings
   */
  public ProducerSettings producerSettings() {
    return new ProducerSettings(enabled, effectiveValidationMode(), defaultTokenBudget);
  }

  private static boolean present(Map<String, String> kv, String key) {
    String value = kv.get(key);
    return value != null && !value.isBlank();
  }

  private static boolean bool(Map<String, String> kv, String key, boolean fallback) {
    return present(kv, key) ? Strings.parseBoolean(key, kv.get(key)) : fallback;
  }

  private static long number(Map<String, String> kv, String key, long fallback, long min, long max) {
    return present(kv, key) ? Numbers.parseRange(key, kv.get(key), min, max) : fallback;
  }

  private static Path path(Map<String, String> kv, String key, Path fallback) {
    if (!present(kv, key)) {
      return fallback;
    }
    try {
      return Path.of(kv.get(key).trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + kv.get(key), ex);
    }
  }

  private static void requirePattern(String pattern) {
    try {
      DateTimeFormatter.ofPattern(pattern);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sessionIdFormat is not a valid date-time pattern: " + pattern, ex);
    }
  }

  private static String parseExporter(String raw) {
    String normalized = raw == null || raw.isBlank() ? "none" : raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("none") && !normalized.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be none or otlp (was " + raw + ")");
    }
    return normalized;
  }
}
