package ca.gc.cra.trail.application.events;

import ca.gc.cra.trail.application.pipeline.TrailLifecycle.ActiveSession;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.session.HierarchyScope;
import ca.gc.cra.trail.domain.events.ToolUsage;
import java.util.concurrent.TimeUnit;

/**
 * Open scope of a tool call. The event id is reserved when the scope opens; the tool usage event is written when the
 * scope closes, with the measured duration and outcome. Because children are written first, readers must order a
 * session by {@code event_id} rather than by file position.
 *
 * <p>Confined to the opening thread.</p>
 *
 * @since 0.1.0
 */
public final class ToolUsageScope implements AutoCloseable {
  private final ActivityLogger logger;
  private final ActiveSession session;
  private final String eventId;
  private final String parentEventId;
  private final ToolUsage payload;
  private final HierarchyScope scope;
  private final MetricsPort metrics;
  private final long startNanos;
  private Throwable failure;
  private String resultSummary;
  private boolean closed;

  ToolUsageScope(
      ActivityLogger logger,
      ActiveSession session,
      String eventId,
      String parentEventId,
      ToolUsage payload,
      HierarchyScope scope,
      MetricsPort metrics) {
    this.logger = logger;
    this.session = session;
    this.eventId = eventId;
    this.parentEventId = parentEventId;
    this.payload = payload;
    this.scope = scope;
    this.metrics = metrics;
    this.startNanos = System.nanoTime();
  }

  public String eventId() {
    return eventId;
  }

  /**
   * Marks the tool call as failed; the event records {@code success=false} and the failure message.
   *
   * @param cause failure raised by the tool
   */
  public void failed(Throwable cause) {
    this.failure = cause;
  }

  /**
   * Attaches a short description of the outcome.
   *
   * @param summary outcome text
   */
  public void resultSummary(String summary) {
    this.resultSummary = summary;
  }

  public long durationMillis() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  /**
   * Pops the scope and writes the tool usage event. Calling close twice is a no-op.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    long elapsed = durationMillis();
    try {
      scope.close();
    } finally {
      ToolUsage outcome = payload.withOutcome(failure == null, elapsed);
      if (failure != null) {
        String message = failure.getMessage() == null ? failure.toString() : failure.getMessage();
        outcome = outcome.withErrorMessage(message);
      }
      if (resultSummary != null) {
        outcome = outcome.withResultSummary(resultSummary);
      }
      metrics.observe("trail.scope.tool.durationMillis", elapsed);
      logger.record(session, eventId, parentEventId, outcome);
    }
  }
}
