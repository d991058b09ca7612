package ca.gc.cra.trail.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Session-level settings of a {@link TrailLifecycle}.
 *
 * @param eventIdWidth zero-padding width of event ids
 * @param shutdownTimeout timeout used by {@link TrailLifecycle#shutdown()}
 * @param exitShutdownTimeout timeout used by the JVM exit hook
 * @param registerShutdownHook whether to register the exit hook on initialization
 * @since 0.1.0
 */
public record LifecycleSettings(
    int eventIdWidth,
    Duration shutdownTimeout,
    Duration exitShutdownTimeout,
    boolean registerShutdownHook) {

  public LifecycleSettings {
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    Objects.requireNonNull(exitShutdownTimeout, "exitShutdownTimeout");
  }

  /**
   * Returns the defaults: width 3, 5 s explicit shutdown, 2 s exit-hook shutdown, hook registered.
   *
   * @return default settings
   */
  public static LifecycleSettings defaults() {
    return new LifecycleSettings(3, Duration.ofSeconds(5), Duration.ofSeconds(2), true);
  }
}
