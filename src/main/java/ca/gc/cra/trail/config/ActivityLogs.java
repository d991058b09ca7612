package ca.gc.cra.trail.config;

import ca.gc.cra.trail.application.events.ActivityLogger;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide access to one {@link ActivityLogger}.
 *
 * <p>Code that cannot have a logger passed in calls {@link #get()}. The first call builds a logger from
 * {@link CompositionRoot#fromEnvironment()} unless the host already {@link #install installed} one.
 * {@link #shutdown()} drains and forgets the logger, so a later {@link #get()} starts a new session.</p>
 *
 * @since 0.1.0
 */
public final class ActivityLogs {
  private static final ReentrantLock LOCK = new ReentrantLock();
  private static volatile ActivityLogger current;

  private ActivityLogs() {}

  /**
   * Makes {@code logger} the process-wide logger.
   *
   * @param logger logger to expose
   * @throws IllegalStateException when a different logger is already installed and not shut down
   */
  public static void install(ActivityLogger logger) {
    Objects.requireNonNull(logger, "logger");
    LOCK.lock();
    try {
      ActivityLogger existing = current;
      if (existing != null && existing != logger && !existing.isStopped()) {
        throw new IllegalStateException("An activity logger is already installed; shut it down first");
      }
      current = logger;
    } finally {
      LOCK.unlock();
    }
  }

  /**
   * Returns the process-wide logger, building it from the environment on first use.
   *
   * @return shared logger
   */
  public static ActivityLogger get() {
    ActivityLogger logger = current;
    if (logger != null) {
      return logger;
    }
    LOCK.lock();
    try {
      if (current == null) {
        current = CompositionRoot.fromEnvironment();
      }
      return current;
    } finally {
      LOCK.unlock();
    }
  }

  /**
   * Shuts the process-wide logger down with its configured timeout and forgets it. Does nothing when none exists.
   *
   * @throws ShutdownTimeoutException when events could not be flushed in time
   */
  public static void shutdown() {
    ActivityLogger logger = detach();
    if (logger != null) {
      logger.shutdown();
    }
  }

  /**
   * Shuts the process-wide logger down and forgets it.
   *
   * @param timeout longest time to wait for queued events
   * @throws ShutdownTimeoutException when events could not be flushed in time
   */
  public static void shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ActivityLogger logger = detach();
    if (logger != null) {
      logger.shutdown(timeout);
    }
  }

  private static ActivityLogger detach() {
    LOCK.lock();
    try {
      ActivityLogger logger = current;
      current = null;
      return logger;
    } finally {
      LOCK.unlock();
    }
  }
}
