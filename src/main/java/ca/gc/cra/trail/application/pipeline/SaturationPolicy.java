package ca.gc.cra.trail.application.pipeline;

import java.util.Locale;

/**
 * What a producer experiences when the writer queue is full. Every lost event is counted in
 * {@link WriterStats#dropped()} and the {@code trail.writer.dropped} metric.
 *
 * @since 0.1.0
 */
public enum SaturationPolicy {
  /** Wait up to the enqueue timeout for space, then drop the submitted event. */
  DROP_NEWEST,
  /** Evict the oldest queued event to make room; never waits. */
  DROP_OLDEST,
  /** Wait up to the enqueue timeout, then throw {@code QueueSaturationException} to the producer. */
  REJECT;

  /**
   * Parses a configured policy name, accepting dashes for underscores.
   *
   * @param raw configured value
   * @return matching policy
   * @throws IllegalArgumentException when the value is unknown
   */
  public static SaturationPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("saturationPolicy must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown saturationPolicy: " + raw, ex);
    }
  }
}
