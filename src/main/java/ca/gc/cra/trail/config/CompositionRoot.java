package ca.gc.cra.trail.config;

import ca.gc.cra.trail.application.events.ActivityLogger;
import ca.gc.cra.trail.application.pipeline.TrailLifecycle;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.schema.EventSchemaRegistry;
import ca.gc.cra.trail.application.session.HierarchyTracker;
import ca.gc.cra.trail.application.session.SessionIdGenerator;
import ca.gc.cra.trail.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.trail.infrastructure.persistence.EventJsonCodec;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog;
import ca.gc.cra.trail.infrastructure.persistence.NdjsonEventSinkAdapter;
import ca.gc.cra.trail.infrastructure.persistence.NoOpEventSinkAdapter;
import ca.gc.cra.trail.infrastructure.persistence.SessionLogFiles;
import ca.gc.cra.trail.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires configuration into a ready {@link ActivityLogger}.
 * <p><strong>Why:</strong> Keeps adapter selection (file or no-op sink, OpenTelemetry or no-op metrics, retention) in
 * one place so the application layer only sees ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the effective {@link TrailConfig} from overrides, environment, YAML, and defaults.</li>
 *   <li>Build the sink factory, metrics adapter, lifecycle, and logger.</li>
 *   <li>Run log retention when a session starts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; every call builds a new object graph.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  static final String CONFIG_KEY = "config";
  static final String PROFILE_KEY = "profile";
  private static final String CONFIG_ENV = "TRAIL_CONFIG";
  private static final String PROFILE_ENV = "TRAIL_PROFILE";
  private static final String CONFIG_PROPERTY = "trail.config";
  private static final String PROFILE_PROPERTY = "trail.profile";

  private CompositionRoot() {}

  /**
   * Builds a logger from the process environment, system properties, and the optional YAML file they name.
   *
   * @return logger whose session starts on first use
   * @throws IllegalArgumentException when the configuration is invalid
   */
  public static ActivityLogger fromEnvironment() {
    return create(loadConfig(Map.of()));
  }

  /**
   * Resolves configuration for the running process with explicit overrides on top.
   *
   * @param overrides highest-precedence settings, e.g. CLI {@code key=value} arguments; may name {@code config} and
   *     {@code profile}
   * @return effective configuration
   * @throws IllegalArgumentException when a value is invalid or an explicitly named YAML file is missing
   * @throws UncheckedIOException when the YAML file cannot be read
   */
  public static TrailConfig loadConfig(Map<String, String> overrides) {
    return loadConfig(overrides, System.getenv(), System.getProperties());
  }

  static TrailConfig loadConfig(Map<String, String> overrides, Map<String, String> env, Properties properties) {
    Objects.requireNonNull(overrides, "overrides");
    Map<String, String> remaining = new LinkedHashMap<>(overrides);
    String configPath = firstNonBlank(
        remaining.remove(CONFIG_KEY), remaining.remove("--" + CONFIG_KEY),
        properties.getProperty(CONFIG_PROPERTY), env.get(CONFIG_ENV));
    String profile = firstNonBlank(
        remaining.remove(PROFILE_KEY), properties.getProperty(PROFILE_PROPERTY), env.get(PROFILE_ENV));

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath.trim());
      if (!Files.exists(path)) {
        throw new IllegalArgumentException("Config file not found: " + path);
      }
      try {
        yaml = YamlConfigLoader.load(path, profile);
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to read config file " + path, ex);
      }
      log.debug("Loaded YAML configuration from {} (profile={})", path, profile == null ? "none" : profile);
    }

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml,
        EnvironmentOverrides.collect(env, properties),
        remaining,
        TrailDefaults.asFlatMap(),
        log::warn);
    return TrailConfig.fromMap(effective);
  }

  /**
   * Builds a logger on the system clock, with metrics chosen by {@link TrailConfig#metricsExporter()}. Raises the
   * log level to DEBUG when {@link TrailConfig#verbose()} is set.
   *
   * @param config effective configuration
   * @return logger whose session starts on first use
   */
  public static ActivityLogger create(TrailConfig config) {
    Objects.requireNonNull(config, "config");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    MetricsPort metrics = "otlp".equals(config.metricsExporter())
        ? new OpenTelemetryMetricsAdapter(config.metricsExporter())
        : MetricsPort.NO_OP;
    return create(config, new SystemClockAdapter(), metrics);
  }

  /**
   * Builds a logger with explicit clock and metrics, typically for tests.
   *
   * @param config effective configuration
   * @param clock time source for session ids and timestamps
   * @param metrics metrics sink
   * @return logger whose session starts on first use
   */
  public static ActivityLogger create(TrailConfig config, ClockPort clock, MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(metrics, "metrics");

    TrailLifecycle lifecycle = new TrailLifecycle(
        new SessionIdGenerator(config.sessionIdFormat(), clock),
        sinkFactory(config),
        retentionListener(config),
        metrics,
        clock,
        config.writerSettings(),
        config.lifecycleSettings());
    log.debug("Activity trail configured: enabled={} logDir={} compression={} validation={} policy={}",
        config.enabled(), config.logDir(), config.compression(), config.effectiveValidationMode(),
        config.saturationPolicy());
    return new ActivityLogger(
        config.producerSettings(),
        EventSchemaRegistry.standard(),
        lifecycle,
        new HierarchyTracker(),
        clock,
        metrics);
  }

  private static TrailLifecycle.SinkFactory sinkFactory(TrailConfig config) {
    if (!config.enabled()) {
      return sessionId -> new NoOpEventSinkAdapter();
    }
    EventJsonCodec codec = new EventJsonCodec();
    return new TrailLifecycle.SinkFactory() {
      @Override
      public EventSinkPort open(String sessionId) {
        return new NdjsonEventSinkAdapter(
            config.logDir(), sessionId, config.compression(), config.rollMiB(), codec);
      }

      @Override
      public String reserve(String candidate) {
        return SessionLogFiles.claimSessionId(config.logDir(), candidate);
      }
    };
  }

  private static TrailLifecycle.SessionStartListener retentionListener(TrailConfig config) {
    if (!config.enabled() || config.retentionCount() == 0) {
      return null;
    }
    return sessionId -> {
      LogFileCatalog catalog = new LogFileCatalog(config.logDir());
      try {
        catalog.rotate(config.retentionCount(), sessionId);
      } catch (IOException ex) {
        throw new UncheckedIOException("Log retention failed in " + config.logDir(), ex);
      }
    };
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate;
      }
    }
    return null;
  }
}
