package ca.gc.cra.trail.application.events;

import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.session.HierarchyScope;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Open scope of an agent invocation. The invocation event is written when the scope opens; closing the scope pops it
 * from the hierarchy and records how long it stayed open. No closing event is written, so the trail holds the opening
 * event only: duration and failure reach metrics ({@code trail.scope.agent.durationMillis},
 * {@code trail.scope.agent.failed}) and stay readable through {@link #durationMillis()} and {@link #failure()}. Callers
 * that want the outcome on disk log it themselves, for example with
 * {@link ActivityLogger#logError(String, Throwable, ca.gc.cra.trail.domain.events.ErrorSeverity)}
 * inside the scope.
 *
 * <pre>{@code
 * try (AgentInvocationScope scope = logger.agentInvocationScope("planner", "orchestrator", "plan sprint")) {
 *   logger.logToolUsage("planner", "Read", "read backlog");
 * }
 * }</pre>
 *
 * <p>Confined to the opening thread.</p>
 *
 * @since 0.1.0
 */
public final class AgentInvocationScope implements AutoCloseable {
  private final String eventId;
  private final HierarchyScope scope;
  private final MetricsPort metrics;
  private final long startNanos;
  private Throwable failure;
  private long durationMillis = -1L;

  AgentInvocationScope(String eventId, HierarchyScope scope, MetricsPort metrics) {
    this.eventId = eventId;
    this.scope = scope;
    this.metrics = metrics;
    this.startNanos = System.nanoTime();
  }

  /**
   * Returns the id of the invocation event; children logged inside the scope use it as their parent.
   *
   * @return event id
   */
  public String eventId() {
    return eventId;
  }

  /**
   * Marks the invocation as failed.
   *
   * @param cause failure that ended the invocation
   */
  public void failed(Throwable cause) {
    this.failure = cause;
  }

  /**
   * Returns the failure passed to {@link #failed(Throwable)}.
   *
   * @return failure, or empty when the invocation was not marked failed
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Returns the wall-clock time the scope was open.
   *
   * @return milliseconds from open to close, or elapsed so far while still open
   */
  public long durationMillis() {
    if (durationMillis >= 0) {
      return durationMillis;
    }
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  @Override
  public void close() {
    if (durationMillis >= 0) {
      return;
    }
    durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    try {
      scope.close();
    } finally {
      metrics.observe("trail.scope.agent.durationMillis", durationMillis);
      if (failure != null) {
        metrics.increment("trail.scope.agent.failed");
      }
    }
  }
}
