package ca.gc.cra.trail.application.pipeline;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.errors.NotInitializedException;
import ca.gc.cra.trail.application.errors.QueueSaturationException;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import ca.gc.cra.trail.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Persists activity events on a single background thread fed by a bounded queue.
 *
 * <p>Producers call {@link #submit(ActivityEvent)}, which only enqueues. The writer thread (named
 * <code>trail-writer-&lt;session&gt;</code>) polls the queue with a bounded interval, drains it in FIFO batches, and is
 * the only code that touches the sink. When the queue is full the configured {@link SaturationPolicy} applies and every
 * lost event is counted.</p>
 *
 * <p>{@link #shutdown(Duration)} moves the writer to {@link WriterState#DRAINING} under an exclusive admission lock, so
 * no producer is mid-enqueue when draining starts. The writer thread then empties the queue, closes the sink, and the
 * writer becomes {@link WriterState#STOPPED}. If draining overruns the timeout, the thread is aborted and the number of
 * events that never reached the sink is reported through {@link ShutdownTimeoutException}.</p>
 *
 * <p>Sink failures are logged on this class's logger and counted; the writer thread continues with the next event.</p>
 *
 * @since 0.1.0
 */
public final class DurableEventWriter {
  private static final Logger log = LoggerFactory.getLogger(DurableEventWriter.class);

  private static final int DRAIN_BATCH_SIZE = 64;
  private static final long ENQUEUE_BACKOFF_NANOS = TimeUnit.MICROSECONDS.toNanos(200);
  private static final int SATURATION_LOG_THRESHOLD = 1_000;
  private static final int SLOW_SUBMIT_LOG_THRESHOLD = 1_000;
  private static final Duration ABORT_GRACE = Duration.ofSeconds(1);
  private static final String MDC_SESSION = "trailSession";

  private final String sessionId;
  private final EventSinkPort sink;
  private final MetricsPort metrics;
  private final WriterSettings settings;
  private final BlockingQueue<QueuedEvent> queue;
  private final AtomicReference<WriterState> state = new AtomicReference<>(WriterState.UNINITIALIZED);
  private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();
  private final Object lifecycleMonitor = new Object();
  private final CountDownLatch terminated = new CountDownLatch(1);

  private final LongAdder submitted = new LongAdder();
  private final LongAdder enqueued = new LongAdder();
  private final LongAdder written = new LongAdder();
  private final LongAdder dropped = new LongAdder();
  private final LongAdder evicted = new LongAdder();
  private final LongAdder sinkErrors = new LongAdder();
  private final AtomicInteger queueHighWaterMark = new AtomicInteger();
  private final AtomicInteger saturationLogLimiter = new AtomicInteger();
  private final AtomicInteger slowSubmitLogLimiter = new AtomicInteger();
  private final long maxSubmitLatencyNanos;

  private volatile boolean abortRequested;
  private ExecutorService executor;

  /**
   * Creates a writer for one session. The writer does nothing until {@link #start()}.
   *
   * @param sessionId session the sink belongs to; used for the thread name and logging context
   * @param sink sink owned exclusively by the writer thread once started
   * @param metrics metrics sink for throughput, drops, and errors
   * @param settings queue and flush tuning
   */
  public DurableEventWriter(
      String sessionId, EventSinkPort sink, MetricsPort metrics, WriterSettings settings) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    this.maxSubmitLatencyNanos = settings.maxSubmitLatency().toNanos();
  }

  /**
   * Starts the writer thread and moves the writer to {@link WriterState#RUNNING}.
   *
   * @throws IllegalStateException when the writer was already started
   */
  public void start() {
    synchronized (lifecycleMonitor) {
      Lock lock = admission.writeLock();
      lock.lock();
      try {
        if (state.get() != WriterState.UNINITIALIZED) {
          throw new IllegalStateException("Writer for " + sessionId + " already started (state=" + state.get() + ")");
        }
        UncaughtExceptionHandler handler = this::handleWriterCrash;
        executor = ExecutorFactories.newWriterExecutor("trail-writer-" + sessionId, handler);
        state.set(WriterState.RUNNING);
      } finally {
        lock.unlock();
      }
      executor.execute(new WriterLoop());
      log.info(
          "Started event writer for {} (capacity={}, policy={}, flushEachEvent={})",
          sessionId,
          settings.queueCapacity(),
          settings.saturationPolicy(),
          settings.flushEachEvent());
    }
  }

  /**
   * Hands an event to the writer thread.
   *
   * <p>Returns once the event is queued. Under saturation the call waits at most the enqueue timeout; with
   * {@link SaturationPolicy#DROP_NEWEST} or {@link SaturationPolicy#DROP_OLDEST} an event is then dropped and counted,
   * with {@link SaturationPolicy#REJECT} a {@link QueueSaturationException} is thrown.</p>
   *
   * @param event validated event
   * @throws NotInitializedException when the writer has not been started
   * @throws LoggerStoppedException when shutdown has begun
   * @throws QueueSaturationException under the {@code REJECT} policy when the queue stays full
   */
  public void submit(ActivityEvent event) {
    Objects.requireNonNull(event, "event");
    long startNanos = System.nanoTime();
    Lock lock = admission.readLock();
    lock.lock();
    try {
      WriterState current = state.get();
      if (current == WriterState.UNINITIALIZED) {
        throw new NotInitializedException("Event writer for " + sessionId + " has not been started");
      }
      if (current != WriterState.RUNNING) {
        metrics.increment("trail.writer.rejected.stopped");
        throw new LoggerStoppedException(
            "Event writer for " + sessionId + " is " + current + "; event " + event.eventId() + " not accepted");
      }
      submitted.increment();
      enqueue(new QueuedEvent(event, startNanos));
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      recordDrop(event, "interrupted while waiting for queue space");
    } finally {
      lock.unlock();
    }
    recordSubmitLatency(System.nanoTime() - startNanos);
  }

  private void enqueue(QueuedEvent task) throws InterruptedException {
    if (settings.saturationPolicy() == SaturationPolicy.DROP_OLDEST) {
      while (!queue.offer(task)) {
        QueuedEvent oldest = queue.poll();
        if (oldest != null) {
          evicted.increment();
          recordDrop(oldest.event(), "evicted to admit " + task.event().eventId());
        }
      }
      enqueued.increment();
      recordQueueDepth();
      return;
    }

    long deadline = System.nanoTime() + settings.enqueueTimeout().toNanos();
    while (true) {
      if (queue.offer(task)) {
        enqueued.increment();
        recordQueueDepth();
        return;
      }
      if (System.nanoTime() >= deadline) {
        if (settings.saturationPolicy() == SaturationPolicy.REJECT) {
          recordDrop(task.event(), "rejected");
          throw new QueueSaturationException(task.event().eventId(), settings.queueCapacity());
        }
        recordDrop(task.event(), "dropped");
        return;
      }
      metrics.increment("trail.writer.enqueue.retry");
      TimeUnit.NANOSECONDS.sleep(ENQUEUE_BACKOFF_NANOS);
    }
  }

  /**
   * Drains and stops the writer, waiting at most {@code timeout}. Calling it again after the writer stopped is a no-op.
   *
   * @param timeout longest time to wait for the queue to drain
   * @throws ShutdownTimeoutException when events were still pending after {@code timeout}
   */
  public void shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    synchronized (lifecycleMonitor) {
      WriterState previous;
      Lock lock = admission.writeLock();
      lock.lock();
      try {
        previous = state.get();
        if (previous == WriterState.RUNNING) {
          state.set(WriterState.DRAINING);
        } else if (previous == WriterState.UNINITIALIZED) {
          state.set(WriterState.STOPPED);
        }
      } finally {
        lock.unlock();
      }
      if (previous == WriterState.UNINITIALIZED) {
        closeSink();
        log.info("Event writer for {} stopped before it was started", sessionId);
        return;
      }
      if (previous == WriterState.STOPPED) {
        return;
      }

      log.info("Draining event writer for {} ({} queued, timeout {} ms)", sessionId, queue.size(), timeout.toMillis());
      boolean drained = awaitTermination(timeout);
      if (!drained) {
        abortRequested = true;
        metrics.increment("trail.writer.shutdown.timeout");
        executor.shutdownNow();
        if (!awaitTermination(ABORT_GRACE)) {
          log.error("Event writer thread for {} did not stop after abort", sessionId);
        }
        long unflushed = unflushedCount();
        queue.clear();
        state.set(WriterState.STOPPED);
        log.warn("Event writer for {} timed out after {} ms; {} event(s) not flushed",
            sessionId, timeout.toMillis(), unflushed);
        throw new ShutdownTimeoutException(timeout, unflushed);
      }
      executor.shutdown();
      state.set(WriterState.STOPPED);
      metrics.observe("trail.writer.queue.highWater", queueHighWaterMark.get());
      WriterStats stats = stats();
      log.info(
          "Event writer for {} stopped; written={} dropped={} sinkErrors={}",
          sessionId,
          stats.written(),
          stats.dropped(),
          stats.sinkErrors());
    }
  }

  /**
   * Returns the current writer state.
   *
   * @return state
   */
  public WriterState state() {
    return state.get();
  }

  /**
   * Returns a snapshot of the writer counters.
   *
   * @return counters
   */
  public WriterStats stats() {
    return new WriterStats(
        state.get(),
        submitted.sum(),
        written.sum(),
        dropped.sum(),
        sinkErrors.sum(),
        queue.size(),
        queueHighWaterMark.get());
  }

  /**
   * Returns the file the sink is currently writing, for file-backed sinks.
   *
   * @return sink file, or empty for sinks without a location
   */
  public Optional<Path> sinkLocation() {
    return sink.location();
  }

  String sessionId() {
    return sessionId;
  }

  private boolean awaitTermination(Duration timeout) {
    try {
      return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      metrics.increment("trail.writer.shutdown.interrupted");
      return false;
    }
  }

  private long unflushedCount() {
    long pending = enqueued.sum() - evicted.sum() - written.sum() - sinkErrors.sum();
    return Math.max(0L, pending);
  }

  private final class WriterLoop implements Runnable {
    @Override
    public void run() {
      MDC.put(MDC_SESSION, sessionId);
      List<QueuedEvent> batch = new ArrayList<>(DRAIN_BATCH_SIZE);
      try {
        while (!abortRequested) {
          if (state.get() != WriterState.RUNNING && queue.isEmpty()) {
            break;
          }
          QueuedEvent first = queue.poll(settings.pollInterval().toNanos(), TimeUnit.NANOSECONDS);
          if (first == null) {
            continue;
          }
          batch.add(first);
          queue.drainTo(batch, DRAIN_BATCH_SIZE - 1);
          for (QueuedEvent next : batch) {
            if (abortRequested) {
              break;
            }
            write(next);
          }
          batch.clear();
          if (!settings.flushEachEvent()) {
            flushSink();
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!abortRequested) {
          metrics.increment("trail.writer.interrupted");
          log.warn("Event writer for {} interrupted with {} event(s) queued", sessionId, queue.size());
        }
      } finally {
        closeSink();
        MDC.remove(MDC_SESSION);
        terminated.countDown();
      }
    }
  }

  private void write(QueuedEvent task) {
    ActivityEvent event = task.event();
    long startNanos = System.nanoTime();
    try {
      sink.persist(event);
      if (settings.flushEachEvent()) {
        sink.flush();
      }
      written.increment();
      metrics.increment("trail.writer.written");
      metrics.observe("trail.writer.latencyNanos", System.nanoTime() - startNanos);
      metrics.observe("trail.writer.endToEndNanos", System.nanoTime() - task.enqueuedNanos());
    } catch (RuntimeException ex) {
      sinkErrors.increment();
      metrics.increment("trail.writer.sink.error");
      log.error("Failed to write event {} ({}) for {}; continuing", event.eventId(), event.eventType().wireName(),
          sessionId, ex);
    }
  }

  private void flushSink() {
    try {
      sink.flush();
    } catch (RuntimeException ex) {
      metrics.increment("trail.writer.flush.error");
      log.error("Failed to flush sink for {}", sessionId, ex);
    }
  }

  private void closeSink() {
    try {
      sink.close();
    } catch (RuntimeException ex) {
      metrics.increment("trail.writer.close.error");
      log.error("Failed to close sink for {}", sessionId, ex);
    }
  }

  private void recordDrop(ActivityEvent event, String reason) {
    dropped.increment();
    metrics.increment("trail.writer.dropped");
    int count = saturationLogLimiter.incrementAndGet();
    if (count == 1 || count % SATURATION_LOG_THRESHOLD == 0) {
      log.warn(
          "Event writer queue saturated for {} (capacity={}, policy={}); event {} {}; {} dropped so far",
          sessionId,
          settings.queueCapacity(),
          settings.saturationPolicy(),
          event.eventId(),
          reason,
          dropped.sum());
      if (count >= SATURATION_LOG_THRESHOLD * 100) {
        saturationLogLimiter.set(0);
      }
    }
  }

  private void recordQueueDepth() {
    int depth = queue.size();
    metrics.observe("trail.writer.queue.depth", depth);
    int previous;
    do {
      previous = queueHighWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!queueHighWaterMark.compareAndSet(previous, depth));
  }

  private void recordSubmitLatency(long elapsedNanos) {
    metrics.observe("trail.submit.latencyNanos", elapsedNanos);
    if (elapsedNanos <= maxSubmitLatencyNanos) {
      return;
    }
    metrics.increment("trail.submit.slow");
    int count = slowSubmitLogLimiter.incrementAndGet();
    if (count == 1 || count % SLOW_SUBMIT_LOG_THRESHOLD == 0) {
      log.warn("Event submission for {} took {} us (threshold {} us)",
          sessionId,
          TimeUnit.NANOSECONDS.toMicros(elapsedNanos),
          TimeUnit.NANOSECONDS.toMicros(maxSubmitLatencyNanos));
    }
  }

  private void handleWriterCrash(Thread thread, Throwable throwable) {
    metrics.increment("trail.writer.crash");
    log.error("Event writer thread {} terminated unexpectedly", thread.getName(), throwable);
    Lock lock = admission.writeLock();
    lock.lock();
    try {
      state.set(WriterState.STOPPED);
    } finally {
      lock.unlock();
    }
  }

  private record QueuedEvent(ActivityEvent event, long enqueuedNanos) {}
}
