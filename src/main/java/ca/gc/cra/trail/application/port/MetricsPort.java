package ca.gc.cra.trail.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the activity trail.
 * <p><strong>Why:</strong> Lets the writer and logger count drops, sink errors, and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and when
 * metrics are disabled.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from producer and writer threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code trail.writer.dropped}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (nanoseconds, milliseconds, depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
