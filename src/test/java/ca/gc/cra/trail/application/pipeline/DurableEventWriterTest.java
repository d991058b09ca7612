package ca.gc.cra.trail.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.errors.NotInitializedException;
import ca.gc.cra.trail.application.errors.QueueSaturationException;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import ca.gc.cra.trail.domain.events.EventIds;
import ca.gc.cra.trail.domain.events.ToolUsage;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import ca.gc.cra.trail.testutil.RecordingSink;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DurableEventWriterTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final RecordingSink sink = new RecordingSink();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void writesEventsInSubmissionOrder() {
    DurableEventWriter writer = newWriter(settings(100, SaturationPolicy.DROP_NEWEST));
    writer.start();
    for (int i = 1; i <= 50; i++) {
      writer.submit(event(i));
    }
    writer.shutdown(TIMEOUT);

    assertEquals(50, sink.events().size());
    assertEquals(EventIds.format(1, 3), sink.eventIds().get(0));
    assertEquals(EventIds.format(50, 3), sink.eventIds().get(49));
    assertTrue(sink.closed());
    WriterStats stats = writer.stats();
    assertEquals(WriterState.STOPPED, stats.state());
    assertEquals(50, stats.submitted());
    assertEquals(50, stats.written());
    assertEquals(0, stats.dropped());
    assertEquals(50, metrics.count("trail.writer.written"));
  }

  @Test
  void submitBeforeStartFails() {
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));

    assertThrows(NotInitializedException.class, () -> writer.submit(event(1)));
  }

  @Test
  void submitAfterShutdownFails() {
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));
    writer.start();
    writer.shutdown(TIMEOUT);

    assertThrows(LoggerStoppedException.class, () -> writer.submit(event(1)));
    assertEquals(1, metrics.count("trail.writer.rejected.stopped"));
  }

  @Test
  void shutdownTwiceIsNoOp() {
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));
    writer.start();
    writer.submit(event(1));
    writer.shutdown(TIMEOUT);
    writer.shutdown(TIMEOUT);

    assertEquals(List.of("evt_001"), sink.eventIds());
  }

  @Test
  void shutdownBeforeStartClosesSink() {
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));
    writer.shutdown(TIMEOUT);

    assertEquals(WriterState.STOPPED, writer.state());
    assertTrue(sink.closed());
  }

  @Test
  void dropNewestDiscardsIncomingEventWhenFull() throws InterruptedException {
    DurableEventWriter writer = newWriter(settings(2, SaturationPolicy.DROP_NEWEST));
    fillWhilePaused(writer);

    writer.submit(event(4));
    sink.resume();
    writer.shutdown(TIMEOUT);

    assertEquals(List.of("evt_001", "evt_002", "evt_003"), sink.eventIds());
    assertEquals(1, writer.stats().dropped());
    assertEquals(1, metrics.count("trail.writer.dropped"));
  }

  @Test
  void dropOldestEvictsHeadOfQueue() throws InterruptedException {
    DurableEventWriter writer = newWriter(settings(2, SaturationPolicy.DROP_OLDEST));
    fillWhilePaused(writer);

    writer.submit(event(4));
    sink.resume();
    writer.shutdown(TIMEOUT);

    assertEquals(List.of("evt_001", "evt_003", "evt_004"), sink.eventIds());
    assertEquals(1, writer.stats().dropped());
  }

  @Test
  void rejectPolicyThrows() throws InterruptedException {
    DurableEventWriter writer = newWriter(settings(2, SaturationPolicy.REJECT));
    fillWhilePaused(writer);

    QueueSaturationException ex = assertThrows(QueueSaturationException.class, () -> writer.submit(event(4)));
    assertEquals(2, ex.capacity());
    sink.resume();
    writer.shutdown(TIMEOUT);

    assertEquals(List.of("evt_001", "evt_002", "evt_003"), sink.eventIds());
    assertEquals(1, writer.stats().dropped());
  }

  @Test
  void sinkFailureIsCountedAndWriterContinues() {
    sink.failNext(1);
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));
    writer.start();
    writer.submit(event(1));
    writer.submit(event(2));
    writer.shutdown(TIMEOUT);

    assertEquals(List.of("evt_002"), sink.eventIds());
    assertEquals(1, writer.stats().sinkErrors());
    assertEquals(1, metrics.count("trail.writer.sink.error"));
  }

  @Test
  void shutdownTimeoutReportsUnflushedEvents() throws InterruptedException {
    DurableEventWriter writer = newWriter(settings(10, SaturationPolicy.DROP_NEWEST));
    fillWhilePaused(writer);

    ShutdownTimeoutException ex =
        assertThrows(ShutdownTimeoutException.class, () -> writer.shutdown(Duration.ofMillis(100)));

    assertTrue(ex.unflushedEvents() >= 2 && ex.unflushedEvents() <= 3, "unflushed=" + ex.unflushedEvents());
    assertEquals(WriterState.STOPPED, writer.state());
    assertEquals(1, metrics.count("trail.writer.shutdown.timeout"));
    sink.resume();
  }

  @Test
  void concurrentProducersLoseNothing() throws Exception {
    int producers = 8;
    int perProducer = 500;
    DurableEventWriter writer = newWriter(settings(producers * perProducer, SaturationPolicy.DROP_NEWEST));
    writer.start();
    ExecutorService pool = Executors.newFixedThreadPool(producers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int p = 0; p < producers; p++) {
        int base = p * perProducer;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 1; i <= perProducer; i++) {
            writer.submit(event(base + i));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    writer.shutdown(TIMEOUT);

    assertEquals(producers * perProducer, sink.events().size());
    assertEquals(producers * perProducer, sink.eventIds().stream().distinct().count());
  }

  /** Leaves evt_001 blocked in the sink and evt_002, evt_003 queued. */
  private void fillWhilePaused(DurableEventWriter writer) throws InterruptedException {
    sink.pause();
    writer.start();
    writer.submit(event(1));
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (writer.stats().queueDepth() > 0) {
      if (System.nanoTime() > deadline) {
        fail("writer thread never picked up the first event");
      }
      Thread.sleep(5);
    }
    writer.submit(event(2));
    writer.submit(event(3));
  }

  private DurableEventWriter newWriter(WriterSettings settings) {
    return new DurableEventWriter("session_test", sink, metrics, settings);
  }

  private static WriterSettings settings(int capacity, SaturationPolicy policy) {
    return new WriterSettings(
        capacity, policy, Duration.ofMillis(5), Duration.ofMillis(5), true, Duration.ofMillis(50));
  }

  private static ActivityEvent event(int sequence) {
    return ActivityEvent.of(Instant.parse("2025-01-01T00:00:00Z"), "session_test", EventIds.format(sequence, 3),
        null, ToolUsage.of("agent", "Read", "op " + sequence));
  }
}
