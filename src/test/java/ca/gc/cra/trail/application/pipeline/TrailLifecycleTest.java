package ca.gc.cra.trail.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.session.SessionIdGenerator;
import ca.gc.cra.trail.testutil.FixedClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import ca.gc.cra.trail.testutil.RecordingSink;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TrailLifecycleTest {
  private final FixedClock clock = new FixedClock(Instant.parse("2025-03-14T09:26:53Z"));
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final AtomicInteger sinksOpened = new AtomicInteger();
  private final List<String> started = new ArrayList<>();

  @Test
  void initializeDerivesSessionIdFromClock() {
    TrailLifecycle lifecycle = newLifecycle(started::add);

    String sessionId = lifecycle.initialize();

    assertEquals("session_20250314_092653", sessionId);
    assertEquals(List.of(sessionId), started);
    assertEquals(1, sinksOpened.get());
    assertEquals(WriterState.RUNNING, lifecycle.writerStats().orElseThrow().state());
    lifecycle.shutdown();
  }

  @Test
  void initializeIsIdempotent() {
    TrailLifecycle lifecycle = newLifecycle(null);

    String first = lifecycle.initialize("session_a");
    clock.advanceMillis(5_000);
    String second = lifecycle.initialize("session_b");

    assertEquals("session_a", first);
    assertEquals(first, second);
    assertEquals(1, sinksOpened.get());
    assertEquals(1, metrics.count("trail.session.started"));
    lifecycle.shutdown();
  }

  @Test
  void concurrentInitializeCreatesOneSession() throws Exception {
    TrailLifecycle lifecycle = newLifecycle(null);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    Set<String> ids = ConcurrentHashMap.newKeySet();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        futures.add(pool.submit(() -> {
          go.await();
          ids.add(lifecycle.initialize());
          return null;
        }));
      }
      go.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, ids.size());
    assertEquals(1, sinksOpened.get());
    lifecycle.shutdown();
  }

  @Test
  void activeSessionInitializesLazily() {
    TrailLifecycle lifecycle = newLifecycle(null);
    assertTrue(lifecycle.sessionId().isEmpty());

    TrailLifecycle.ActiveSession session = lifecycle.activeSession();

    assertSame(session, lifecycle.activeSession());
    assertEquals(session.sessionId(), lifecycle.sessionId().orElseThrow());
    assertEquals(clock.now(), session.startTime());
    lifecycle.shutdown();
  }

  @Test
  void shutdownIsIdempotentAndKeepsSessionId() {
    TrailLifecycle lifecycle = newLifecycle(null);
    lifecycle.initialize();

    lifecycle.shutdown(Duration.ofSeconds(2));
    lifecycle.shutdown(Duration.ofSeconds(2));

    assertTrue(lifecycle.isStopped());
    assertEquals(WriterState.STOPPED, lifecycle.writerStats().orElseThrow().state());
    assertEquals("session_20250314_092653", lifecycle.initialize());
  }

  @Test
  void shutdownBeforeInitializeStopsForGood() {
    TrailLifecycle lifecycle = newLifecycle(null);
    lifecycle.shutdown();

    assertThrows(LoggerStoppedException.class, lifecycle::initialize);
    assertEquals(0, sinksOpened.get());
  }

  @Test
  void failingStartListenerDoesNotPreventSession() {
    TrailLifecycle lifecycle = newLifecycle(sessionId -> {
      throw new IllegalStateException("retention broke");
    });

    String sessionId = lifecycle.initialize();

    assertFalse(sessionId.isBlank());
    assertEquals(1, metrics.count("trail.session.startListener.error"));
    lifecycle.shutdown();
  }

  @Test
  void requestedSessionIdMustBeFileNameSafe() {
    TrailLifecycle lifecycle = newLifecycle(null);

    assertThrows(IllegalArgumentException.class, () -> lifecycle.initialize("../escape"));
    lifecycle.shutdown();
  }

  private TrailLifecycle newLifecycle(TrailLifecycle.SessionStartListener listener) {
    return new TrailLifecycle(
        new SessionIdGenerator(SessionIdGenerator.DEFAULT_PATTERN, clock),
        sessionId -> {
          sinksOpened.incrementAndGet();
          return new RecordingSink();
        },
        listener,
        metrics,
        clock,
        WriterSettings.defaults(),
        new LifecycleSettings(3, Duration.ofSeconds(5), Duration.ofSeconds(1), false));
  }
}
