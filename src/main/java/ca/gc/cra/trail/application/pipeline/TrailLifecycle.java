package ca.gc.cra.trail.application.pipeline;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.EventSinkPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.session.EventIdAllocator;
import ca.gc.cra.trail.application.session.SessionIdGenerator;
import ca.gc.cra.trail.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns one logging session: its id, its event id allocator, and its durable writer.
 * <p><strong>Why:</strong> Producers may start logging from any thread at any time; the first call must create exactly
 * one session and one writer, and the process must be able to drain the writer on the way out.</p>
 * <p><strong>Role:</strong> Application service behind {@code ActivityLogger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Idempotent, thread-safe {@link #initialize()}.</li>
 *   <li>Bounded {@link #shutdown(Duration)} that reports unflushed events on timeout.</li>
 *   <li>Optional JVM exit hook that performs the same shutdown when the host never calls it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Initialization and shutdown are serialized by a lock; introspection reads a volatile
 * snapshot and never blocks.</p>
 *
 * @since 0.1.0
 */
public final class TrailLifecycle {
  private static final Logger log = LoggerFactory.getLogger(TrailLifecycle.class);

  /** Opens the sink for a newly created session. */
  @FunctionalInterface
  public interface SinkFactory {
    EventSinkPort open(String sessionId);

    /**
     * Claims a generated session id before the sink is opened. Factories backed by shared storage return a suffixed
     * variant when the candidate is already taken.
     *
     * @param candidate generated id
     * @return id the session will use
     */
    default String reserve(String candidate) {
      return candidate;
    }
  }

  /** Callback run once when a session starts, before its writer accepts events. */
  @FunctionalInterface
  public interface SessionStartListener {
    void onSessionStart(String sessionId);
  }

  /**
   * A started session.
   *
   * @param sessionId session id
   * @param startTime instant the session was created
   * @param eventIds allocator of the session's event ids
   * @param writer durable writer owning the session's sink
   */
  public record ActiveSession(
      String sessionId, Instant startTime, EventIdAllocator eventIds, DurableEventWriter writer) {}

  private final SessionIdGenerator sessionIds;
  private final SinkFactory sinkFactory;
  private final SessionStartListener startListener;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final WriterSettings writerSettings;
  private final LifecycleSettings settings;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile ActiveSession session;
  private volatile boolean stopped;
  private Thread shutdownHook;

  /**
   * Creates an uninitialized lifecycle.
   *
   * @param sessionIds session id generator
   * @param sinkFactory opens the sink for a session
   * @param startListener callback run when the session starts (e.g. log retention); failures are logged, not thrown
   * @param metrics metrics sink shared with the writer
   * @param clock time source for the session start time
   * @param writerSettings writer tuning
   * @param settings lifecycle settings
   */
  public TrailLifecycle(
      SessionIdGenerator sessionIds,
      SinkFactory sinkFactory,
      SessionStartListener startListener,
      MetricsPort metrics,
      ClockPort clock,
      WriterSettings writerSettings,
      LifecycleSettings settings) {
    this.sessionIds = Objects.requireNonNull(sessionIds, "sessionIds");
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
    this.startListener = Objects.requireNonNullElse(startListener, sessionId -> {});
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.writerSettings = Objects.requireNonNull(writerSettings, "writerSettings");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Starts a session with a generated id, or returns the id of the running session.
   *
   * @return session id
   * @throws LoggerStoppedException when the lifecycle was already shut down
   */
  public String initialize() {
    return initialize(null);
  }

  /**
   * Starts a session, or returns the id of the running session without side effects.
   *
   * @param requestedSessionId explicit session id, or {@code null} to derive one from the clock; ignored when a session
   *     is already running
   * @return session id
   * @throws LoggerStoppedException when the lifecycle was already shut down
   * @throws IllegalArgumentException when the requested id is not usable as a file name
   */
  public String initialize(String requestedSessionId) {
    ActiveSession current = session;
    if (current != null) {
      return current.sessionId();
    }
    lock.lock();
    try {
      if (session != null) {
        return session.sessionId();
      }
      if (stopped) {
        throw new LoggerStoppedException("Activity trail was shut down and cannot be re-initialized");
      }
      String sessionId = requestedSessionId == null
          ? reserveGenerated(sessionIds.newSessionId())
          : Strings.requireFileNameSafe("sessionId", requestedSessionId);
      notifyStart(sessionId);

      EventSinkPort sink = sinkFactory.open(sessionId);
      DurableEventWriter writer = new DurableEventWriter(sessionId, sink, metrics, writerSettings);
      writer.start();
      session = new ActiveSession(
          sessionId, clock.now(), new EventIdAllocator(settings.eventIdWidth()), writer);
      if (settings.registerShutdownHook()) {
        registerShutdownHook(sessionId);
      }
      metrics.increment("trail.session.started");
      log.info("Activity trail session {} started", sessionId);
      return sessionId;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the running session, initializing it on first use.
   *
   * @return active session
   * @throws LoggerStoppedException when the lifecycle was shut down before any session started
   */
  public ActiveSession activeSession() {
    ActiveSession current = session;
    if (current != null) {
      return current;
    }
    initialize();
    return session;
  }

  /**
   * Shuts down using the configured timeout.
   *
   * @throws ShutdownTimeoutException when the writer could not drain in time
   */
  public void shutdown() {
    shutdown(settings.shutdownTimeout());
  }

  /**
   * Drains the writer and closes the sink. Subsequent calls return immediately. Writes after shutdown fail with
   * {@link LoggerStoppedException}.
   *
   * @param timeout longest time to wait for queued events to be written
   * @throws ShutdownTimeoutException when the writer could not drain in time; the exception reports the lost count
   */
  public void shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    lock.lock();
    try {
      if (stopped) {
        return;
      }
      stopped = true;
      removeShutdownHook();
      ActiveSession current = session;
      if (current == null) {
        log.debug("Activity trail shut down before a session started");
        return;
      }
      current.writer().shutdown(timeout);
      log.info("Activity trail session {} closed after {} event(s)",
          current.sessionId(), current.eventIds().eventCount());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the running session id.
   *
   * @return session id, or empty before initialization
   */
  public Optional<String> sessionId() {
    ActiveSession current = session;
    return current == null ? Optional.empty() : Optional.of(current.sessionId());
  }

  /**
   * Returns how many event ids the session has allocated.
   *
   * @return allocated event count; zero before initialization
   */
  public long eventCount() {
    ActiveSession current = session;
    return current == null ? 0L : current.eventIds().eventCount();
  }

  /**
   * Returns the writer counters of the session.
   *
   * @return counters, or empty before initialization
   */
  public Optional<WriterStats> writerStats() {
    ActiveSession current = session;
    return current == null ? Optional.empty() : Optional.of(current.writer().stats());
  }

  /**
   * Returns the file the session is being written to.
   *
   * @return sink file, or empty before initialization or when the sink is not file-backed
   */
  public Optional<Path> sinkLocation() {
    ActiveSession current = session;
    return current == null ? Optional.empty() : current.writer().sinkLocation();
  }

  /**
   * Returns whether {@link #shutdown(Duration)} has been called.
   *
   * @return {@code true} once shut down
   */
  public boolean isStopped() {
    return stopped;
  }

  private String reserveGenerated(String candidate) {
    String sessionId = sinkFactory.reserve(candidate);
    if (!candidate.equals(sessionId)) {
      log.debug("Session id {} already in use; using {}", candidate, sessionId);
    }
    return sessionId;
  }

  private void notifyStart(String sessionId) {
    try {
      startListener.onSessionStart(sessionId);
    } catch (RuntimeException ex) {
      metrics.increment("trail.session.startListener.error");
      log.warn("Session start callback failed for {}; continuing", sessionId, ex);
    }
  }

  private void registerShutdownHook(String sessionId) {
    Thread hook = new Thread(this::shutdownOnExit, "trail-exit-" + sessionId);
    try {
      Runtime.getRuntime().addShutdownHook(hook);
      shutdownHook = hook;
    } catch (IllegalStateException ex) {
      log.warn("JVM is already shutting down; exit hook for {} not registered", sessionId);
    }
  }

  private void removeShutdownHook() {
    Thread hook = shutdownHook;
    shutdownHook = null;
    if (hook == null || Thread.currentThread() == hook) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; exit hook left in place");
    }
  }

  private void shutdownOnExit() {
    try {
      shutdown(settings.exitShutdownTimeout());
    } catch (ShutdownTimeoutException ex) {
      log.warn("Exit-time drain incomplete: {}", ex.getMessage());
    }
  }
}
