package ca.gc.cra.trail.api;

import ca.gc.cra.trail.api.CliSupport.CliAbort;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import ca.gc.cra.trail.application.errors.TrailException;
import ca.gc.cra.trail.application.events.ActivityLogger;
import ca.gc.cra.trail.application.events.AgentInvocationScope;
import ca.gc.cra.trail.application.pipeline.WriterStats;
import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.TrailConfig;
import ca.gc.cra.trail.domain.events.ContextSnapshot;
import ca.gc.cra.trail.domain.events.ErrorSeverity;
import ca.gc.cra.trail.domain.events.FileOperation;
import ca.gc.cra.trail.domain.events.FileOperationType;
import ca.gc.cra.trail.domain.events.ValidationStatus;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a short sample session: an agent invocation with two nested tool calls, an error, and one event of every
 * other kind. Useful to check a deployment's log directory and configuration end to end.
 *
 * @since 0.1.0
 */
public final class DemoCli {
  private static final Logger log = LoggerFactory.getLogger(DemoCli.class);
  private static final String AGENT = "orchestrator";
  private static final String SUMMARY_USAGE = "usage: trail demo [key=value...] [--verbose]";
  private static final String HELP_TEXT = """
      Record a sample session

      Usage:
        trail demo [key=value...]

      Any configuration key may be overridden, for example:
        logDir=PATH               Directory receiving the session log (default ./.trail/logs)
        compression=true|false    Gzip the session log (default true)
        validationMode=STRICT|LENIENT
        config=PATH               YAML file with common and profile sections
        profile=NAME              YAML profile section to apply
      """;

  private DemoCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    TrailConfig config;
    try {
      config = CliSupport.loadConfig(CliSupport.parseSettings(input, SUMMARY_USAGE), SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    ActivityLogger logger = CompositionRoot.create(config);
    String sessionId;
    try {
      sessionId = logger.initialize();
      recordSampleSession(logger);
    } catch (TrailException ex) {
      log.error("Demo session failed: {}", ex.getMessage(), ex);
      shutdownQuietly(logger);
      return ExitCode.RUNTIME_FAILURE;
    }

    try {
      logger.shutdown();
    } catch (ShutdownTimeoutException ex) {
      log.error("Demo session did not drain: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    }

    WriterStats stats = logger.stats().orElseThrow();
    CliPrinter.printf("session   %s", sessionId);
    CliPrinter.printf("events    %d (written %d, dropped %d, sink errors %d)",
        logger.eventCount(), stats.written(), stats.dropped(), stats.sinkErrors());
    CliPrinter.printf("sink      %s",
        logger.sinkLocation().map(Object::toString).orElse(config.enabled() ? "-" : "disabled"));
    return ExitCode.SUCCESS;
  }

  static void recordSampleSession(ActivityLogger logger) {
    try (AgentInvocationScope scope = logger.agentInvocationScope(AGENT, "user", "demo run")) {
      logger.logToolUsage(AGENT, "Read", "read task list", 12L, true);
      logger.logToolUsage(AGENT, "Grep", "search sources for TODO markers", 8L, true);
    }
    logger.logError(AGENT, "TimeoutError", "tool call exceeded 30s", ErrorSeverity.MEDIUM, true);

    logger.log(FileOperation.of(AGENT, FileOperationType.MODIFY, "src/main/App.java")
        .withSize(2_048L, 14)
        .withLanguage("java"));
    logger.logDecision(AGENT, "Which writer policy?", List.of("block", "drop"), "drop",
        "Producers must never stall on a slow disk");
    logger.log(ContextSnapshot.of("demo_complete")
        .withAgent(AGENT)
        .withFiles(List.of("src/main/App.java")));
    logger.logValidation(AGENT, "unit_test", ValidationStatus.PASS, Map.of("compile", "ok", "tests", true));
  }

  private static void shutdownQuietly(ActivityLogger logger) {
    try {
      logger.shutdown();
    } catch (ShutdownTimeoutException ex) {
      log.warn("Demo session drain incomplete: {}", ex.getMessage());
    }
  }
}
