package ca.gc.cra.trail.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.errors.SchemaException;
import ca.gc.cra.trail.application.pipeline.LifecycleSettings;
import ca.gc.cra.trail.application.pipeline.TrailLifecycle;
import ca.gc.cra.trail.application.pipeline.WriterSettings;
import ca.gc.cra.trail.application.schema.EventSchemaRegistry;
import ca.gc.cra.trail.application.schema.ValidationMode;
import ca.gc.cra.trail.application.session.HierarchyTracker;
import ca.gc.cra.trail.application.session.SessionIdGenerator;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import ca.gc.cra.trail.domain.events.AgentInvocation;
import ca.gc.cra.trail.domain.events.ContextSnapshot;
import ca.gc.cra.trail.domain.events.Decision;
import ca.gc.cra.trail.domain.events.ErrorSeverity;
import ca.gc.cra.trail.domain.events.EventType;
import ca.gc.cra.trail.domain.events.FileOperationType;
import ca.gc.cra.trail.domain.events.ToolUsage;
import ca.gc.cra.trail.testutil.FixedClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import ca.gc.cra.trail.testutil.RecordingSink;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ActivityLoggerTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final FixedClock clock = new FixedClock(Instant.parse("2025-03-14T09:26:53Z"));
  private final RecordingSink sink = new RecordingSink();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void agentScopeParentsNestedToolCallsAndLaterEventsAreTopLevel() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    try (AgentInvocationScope scope = logger.agentInvocationScope("orchestrator", "user", "demo run")) {
      assertEquals("evt_001", scope.eventId());
      logger.logToolUsage("orchestrator", "Read", "read task list");
      logger.logToolUsage("orchestrator", "Grep", "search sources");
    }
    logger.logError("orchestrator", "TimeoutError", "tool call exceeded 30s", ErrorSeverity.MEDIUM, true);
    logger.shutdown(TIMEOUT);

    List<ActivityEvent> events = sink.events();
    assertEquals(List.of("evt_001", "evt_002", "evt_003", "evt_004"), sink.eventIds());
    assertNull(events.get(0).parentEventId());
    assertEquals("evt_001", events.get(1).parentEventId());
    assertEquals("evt_001", events.get(2).parentEventId());
    assertNull(events.get(3).parentEventId());
    assertEquals(EventType.ERROR, events.get(3).eventType());
    assertTrue(events.stream().allMatch(e -> e.sessionId().equals("session_20250314_092653")));
    assertTrue(events.stream().allMatch(e -> e.validationWarnings().isEmpty()));
    assertEquals(2, metrics.count("trail.events.tool_usage"));
  }

  @Test
  void strictModeRejectsInvalidEventWithoutConsumingAnId() {
    ActivityLogger logger = newLogger(ValidationMode.STRICT);

    SchemaException ex = assertThrows(SchemaException.class,
        () -> logger.log(Decision.of("planner", "q", List.of("a"), "a").withConfidence(2.0)));
    String next = logger.logToolUsage("planner", "Read", "read");
    logger.shutdown(TIMEOUT);

    assertEquals("decision", ex.eventType());
    assertEquals(List.of("confidence: must be between 0 and 1 (was 2.0)"), ex.violations());
    assertEquals("evt_001", next);
    assertEquals(List.of("evt_001"), sink.eventIds());
    assertEquals(1, metrics.count("trail.events.schema.rejected"));
  }

  @Test
  void lenientModeWritesInvalidEventWithWarnings() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    logger.logToolUsage("planner", "", "read");
    logger.shutdown(TIMEOUT);

    ActivityEvent event = sink.events().get(0);
    assertEquals(List.of("tool: must not be blank"), event.validationWarnings());
    assertEquals(1, metrics.count("trail.events.schema.warning"));
  }

  @Test
  void disabledValidationWritesWithoutWarnings() {
    ActivityLogger logger = newLogger(ValidationMode.DISABLED);

    logger.logToolUsage("planner", "", "read");
    logger.shutdown(TIMEOUT);

    assertTrue(sink.events().get(0).validationWarnings().isEmpty());
  }

  @Test
  void disabledLoggerAllocatesIdsButWritesNothing() {
    ActivityLogger logger = newLogger(new ProducerSettings(false, ValidationMode.STRICT, 1_000L));

    assertEquals("evt_001", logger.logToolUsage("planner", "", "read"));
    assertEquals("evt_002", logger.logContextSnapshot("manual"));
    logger.shutdown(TIMEOUT);

    assertTrue(sink.events().isEmpty());
    assertEquals(2, logger.eventCount());
  }

  @Test
  void toolScopeReservesIdAndWritesOnClose() {
    ActivityLogger logger = newLogger(ValidationMode.STRICT);

    String toolId;
    try (ToolUsageScope scope = logger.toolUsageScope("coder", "Edit", "apply patch")) {
      toolId = scope.eventId();
      assertEquals(Optional.of(toolId), logger.currentParent());
      logger.logFileOperation("coder", FileOperationType.MODIFY, "App.java", 120L, 4);
      scope.resultSummary("1 file changed");
    }
    assertTrue(logger.currentParent().isEmpty());
    logger.shutdown(TIMEOUT);

    Map<String, ActivityEvent> byId = byId(sink.events());
    assertEquals("evt_001", toolId);
    assertEquals(List.of("evt_002", "evt_001"), sink.eventIds());
    assertEquals("evt_001", byId.get("evt_002").parentEventId());
    ToolUsage tool = (ToolUsage) byId.get("evt_001").payload();
    assertEquals(Boolean.TRUE, tool.success());
    assertTrue(tool.durationMs() >= 0);
    assertEquals("1 file changed", tool.resultSummary());
    assertEquals(1, metrics.observations("trail.scope.tool.durationMillis").size());
  }

  @Test
  void withToolUsageRecordsFailureAndRethrows() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    IOException ex = assertThrows(IOException.class, () -> logger.withToolUsage("coder", "Bash", "mvn test", () -> {
      throw new IOException("disk full");
    }));
    logger.shutdown(TIMEOUT);

    assertEquals("disk full", ex.getMessage());
    ToolUsage tool = (ToolUsage) sink.events().get(0).payload();
    assertEquals(Boolean.FALSE, tool.success());
    assertEquals("disk full", tool.errorMessage());
  }

  @Test
  void withAgentInvocationReturnsBodyResultAndPopsScope() throws Exception {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    String result = logger.withAgentInvocation("reviewer", "orchestrator", "review", () -> {
      logger.logDecision("reviewer", "approve?", List.of("yes", "no"), "yes", "tests pass");
      return "approved";
    });
    logger.shutdown(TIMEOUT);

    assertEquals("approved", result);
    assertTrue(logger.currentParent().isEmpty());
    assertEquals("evt_001", sink.events().get(1).parentEventId());
    assertEquals(1, metrics.observations("trail.scope.agent.durationMillis").size());
  }

  @Test
  void failedAgentScopeIsCounted() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    assertThrows(IllegalStateException.class, () -> logger.withAgentInvocation("a", "b", "c", () -> {
      throw new IllegalStateException("nope");
    }));
    logger.shutdown(TIMEOUT);

    assertEquals(1, metrics.count("trail.scope.agent.failed"));
  }

  @Test
  void agentScopeOutcomeStaysOutOfTheTrail() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);
    IllegalStateException cause = new IllegalStateException("planner crashed");

    AgentInvocationScope scope = logger.agentInvocationScope("planner", "orchestrator", "plan sprint");
    assertTrue(scope.failure().isEmpty());
    scope.failed(cause);
    scope.close();
    logger.shutdown(TIMEOUT);

    assertEquals(List.of("evt_001"), sink.eventIds());
    AgentInvocation opening = (AgentInvocation) sink.events().get(0).payload();
    assertNull(opening.status());
    assertNull(opening.durationMs());
    assertEquals(Optional.of(cause), scope.failure());
    assertTrue(scope.durationMillis() >= 0);
    assertEquals(1, metrics.count("trail.scope.agent.failed"));
  }

  @Test
  void contextSnapshotGetsTokenDefaults() {
    ActivityLogger logger = newLogger(new ProducerSettings(true, ValidationMode.STRICT, 50_000L));

    logger.logContextSnapshot("compaction", Map.of("phase", "planning"));
    logger.shutdown(TIMEOUT);

    ContextSnapshot snapshot = (ContextSnapshot) sink.events().get(0).payload();
    assertEquals(50_000L, snapshot.tokensTotalBudget());
    assertEquals(50_000L, snapshot.tokensRemaining());
    assertEquals(0L, snapshot.tokensBefore());
    assertEquals(Map.of("phase", "planning"), snapshot.snapshot());
  }

  @Test
  void explicitParentBypassesHierarchy() {
    ActivityLogger logger = newLogger(ValidationMode.STRICT);

    String first = logger.logAgentInvocation("a", "user", "start");
    logger.log(ToolUsage.of("a", "Read", "r"), first);
    logger.shutdown(TIMEOUT);

    assertEquals(first, sink.events().get(1).parentEventId());
  }

  @Test
  void loggingAfterShutdownFails() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);
    logger.initialize();
    logger.shutdown(TIMEOUT);

    assertTrue(logger.isStopped());
    assertThrows(LoggerStoppedException.class, () -> logger.logToolUsage("a", "Read", "r"));
  }

  @Test
  void concurrentProducersKeepPerThreadHierarchy() throws Exception {
    ActivityLogger logger = newLogger(ValidationMode.STRICT);
    int threads = 8;
    int toolsPerThread = 50;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch go = new CountDownLatch(1);
    Map<String, String> agentIdByName = new ConcurrentHashMap<>();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        String agent = "agent-" + t;
        futures.add(pool.submit(() -> {
          go.await();
          try (AgentInvocationScope scope = logger.agentInvocationScope(agent, "orchestrator", "work")) {
            agentIdByName.put(agent, scope.eventId());
            for (int i = 0; i < toolsPerThread; i++) {
              logger.logToolUsage(agent, "Read", "file " + i);
            }
          }
          return null;
        }));
      }
      go.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    logger.shutdown(TIMEOUT);

    List<ActivityEvent> events = sink.events();
    int expected = threads * (toolsPerThread + 1);
    assertEquals(expected, events.size());
    Set<String> ids = events.stream().map(ActivityEvent::eventId).collect(Collectors.toSet());
    assertEquals(expected, ids.size());
    for (ActivityEvent event : events) {
      if (event.payload() instanceof ToolUsage tool) {
        assertEquals(agentIdByName.get(tool.agent()), event.parentEventId());
      } else {
        assertNull(event.parentEventId());
      }
    }
  }

  @Test
  void statsAndSessionAreEmptyBeforeFirstUse() {
    ActivityLogger logger = newLogger(ValidationMode.LENIENT);

    assertTrue(logger.sessionId().isEmpty());
    assertTrue(logger.stats().isEmpty());
    assertFalse(logger.isStopped());
    logger.shutdown(TIMEOUT);
  }

  private ActivityLogger newLogger(ValidationMode mode) {
    return newLogger(new ProducerSettings(true, mode, 200_000L));
  }

  private ActivityLogger newLogger(ProducerSettings settings) {
    TrailLifecycle lifecycle = new TrailLifecycle(
        new SessionIdGenerator(SessionIdGenerator.DEFAULT_PATTERN, clock),
        sessionId -> sink,
        null,
        metrics,
        clock,
        WriterSettings.defaults(),
        new LifecycleSettings(3, TIMEOUT, Duration.ofSeconds(1), false));
    return new ActivityLogger(
        settings, EventSchemaRegistry.standard(), lifecycle, new HierarchyTracker(), clock, metrics);
  }

  private static Map<String, ActivityEvent> byId(List<ActivityEvent> events) {
    return events.stream().collect(Collectors.toMap(ActivityEvent::eventId, Function.identity()));
  }
}
