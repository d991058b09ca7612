package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.events.ActivityLogger;
import ca.gc.cra.trail.testutil.FixedClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ActivityLogsTest {

  @TempDir Path tempDir;

  @AfterEach
  void tearDown() {
    ActivityLogs.shutdown(Duration.ofSeconds(1));
  }

  @Test
  void installedLoggerIsShared() {
    ActivityLogger logger = newLogger();

    ActivityLogs.install(logger);

    assertSame(logger, ActivityLogs.get());
    ActivityLogs.install(logger);
    assertSame(logger, ActivityLogs.get());
  }

  @Test
  void secondRunningLoggerIsRejected() {
    ActivityLogs.install(newLogger());

    assertThrows(IllegalStateException.class, () -> ActivityLogs.install(newLogger()));
  }

  @Test
  void shutdownDrainsAndForgetsLogger() {
    ActivityLogger first = newLogger();
    ActivityLogs.install(first);
    assertEquals("evt_001", ActivityLogs.get().logToolUsage("orchestrator", "Read", "read plan"));

    ActivityLogs.shutdown();

    assertTrue(first.isStopped());
    ActivityLogger second = newLogger();
    ActivityLogs.install(second);
    assertSame(second, ActivityLogs.get());
  }

  @Test
  void restartInTheSameSecondStartsADistinctSession() {
    ActivityLogs.install(newLogger());
    ActivityLogs.get().logToolUsage("orchestrator", "Read", "read plan");
    String firstSession = ActivityLogs.get().initialize();
    ActivityLogs.shutdown();

    ActivityLogs.install(newLogger());
    assertEquals("evt_001", ActivityLogs.get().logToolUsage("orchestrator", "Grep", "find callers"));
    String secondSession = ActivityLogs.get().initialize();

    assertEquals("session_20250314_092653", firstSession);
    assertEquals("session_20250314_092653_2", secondSession);
  }

  private ActivityLogger newLogger() {
    TrailConfig config = TrailConfig.fromMap(Map.of(
        "logDir", tempDir.toString(),
        "registerShutdownHook", "false",
        "retentionCount", "0"));
    return CompositionRoot.create(config, new FixedClock(Instant.parse("2025-03-14T09:26:53Z")),
        new RecordingMetricsPort());
  }
}
