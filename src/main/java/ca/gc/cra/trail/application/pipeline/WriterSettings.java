package ca.gc.cra.trail.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning parameters of a {@link DurableEventWriter}.
 *
 * @param queueCapacity bounded queue size
 * @param saturationPolicy behaviour when the queue is full
 * @param enqueueTimeout longest a producer waits for queue space
 * @param pollInterval longest the writer thread blocks waiting for events before re-checking its state
 * @param flushEachEvent flush the sink after every event instead of after every batch
 * @param maxSubmitLatency submission latency above which a slow-submit warning is logged; not enforced
 * @since 0.1.0
 */
public record WriterSettings(
    int queueCapacity,
    SaturationPolicy saturationPolicy,
    Duration enqueueTimeout,
    Duration pollInterval,
    boolean flushEachEvent,
    Duration maxSubmitLatency) {

  static final int DEFAULT_QUEUE_CAPACITY = 10_000;
  static final Duration DEFAULT_ENQUEUE_TIMEOUT = Duration.ofMillis(10);
  static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(25);
  static final Duration DEFAULT_MAX_SUBMIT_LATENCY = Duration.ofNanos(1_000_000);

  /**
   * Normalizes settings: capacity is at least one, durations default when {@code null} and are never negative.
   */
  public WriterSettings {
    queueCapacity = Math.max(1, queueCapacity);
    saturationPolicy = Objects.requireNonNullElse(saturationPolicy, SaturationPolicy.DROP_NEWEST);
    enqueueTimeout = nonNegative(enqueueTimeout, DEFAULT_ENQUEUE_TIMEOUT);
    pollInterval = nonNegative(pollInterval, DEFAULT_POLL_INTERVAL);
    if (pollInterval.isZero()) {
      pollInterval = Duration.ofMillis(1);
    }
    maxSubmitLatency = nonNegative(maxSubmitLatency, DEFAULT_MAX_SUBMIT_LATENCY);
  }

  /**
   * Returns the writer defaults: 10 000 events, drop-newest after 10 ms, 25 ms poll, flush per event.
   *
   * @return default settings
   */
  public static WriterSettings defaults() {
    return new WriterSettings(
        DEFAULT_QUEUE_CAPACITY,
        SaturationPolicy.DROP_NEWEST,
        DEFAULT_ENQUEUE_TIMEOUT,
        DEFAULT_POLL_INTERVAL,
        true,
        DEFAULT_MAX_SUBMIT_LATENCY);
  }

  private static Duration nonNegative(Duration value, Duration fallback) {
    if (value == null) {
      return fallback;
    }
    return value.isNegative() ? Duration.ZERO : value;
  }
}
