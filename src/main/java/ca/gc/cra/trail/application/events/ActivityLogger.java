package ca.gc.cra.trail.application.events;

import ca.gc.cra.trail.application.errors.LoggerStoppedException;
import ca.gc.cra.trail.application.errors.QueueSaturationException;
import ca.gc.cra.trail.application.errors.SchemaException;
import ca.gc.cra.trail.application.errors.ShutdownTimeoutException;
import ca.gc.cra.trail.application.pipeline.TrailLifecycle;
import ca.gc.cra.trail.application.pipeline.TrailLifecycle.ActiveSession;
import ca.gc.cra.trail.application.pipeline.WriterStats;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.schema.EventSchemaRegistry;
import ca.gc.cra.trail.application.schema.SchemaValidationResult;
import ca.gc.cra.trail.application.schema.ValidationMode;
import ca.gc.cra.trail.application.session.HierarchyTracker;
import ca.gc.cra.trail.domain.events.ActivityEvent;
import ca.gc.cra.trail.domain.events.AgentInvocation;
import ca.gc.cra.trail.domain.events.ContextSnapshot;
import ca.gc.cra.trail.domain.events.Decision;
import ca.gc.cra.trail.domain.events.ErrorReport;
import ca.gc.cra.trail.domain.events.ErrorSeverity;
import ca.gc.cra.trail.domain.events.EventIds;
import ca.gc.cra.trail.domain.events.EventPayload;
import ca.gc.cra.trail.domain.events.FileOperation;
import ca.gc.cra.trail.domain.events.FileOperationType;
import ca.gc.cra.trail.domain.events.ToolUsage;
import ca.gc.cra.trail.domain.events.ValidationRun;
import ca.gc.cra.trail.domain.events.ValidationStatus;
import ca.gc.cra.trail.logging.Logs;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Producer API of the activity trail: one method per event kind plus scoped wrappers.
 * <p><strong>Why:</strong> Callers record what an agent did in one call; the logger allocates the id, links the event
 * to the innermost open scope, stamps it, validates it, and hands it to the background writer.</p>
 * <p><strong>Role:</strong> Application service on the driving side; built by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Lazily start the session on first use, exactly once across threads.</li>
 *   <li>Apply the configured {@link ValidationMode}: throw in strict mode, annotate in lenient mode.</li>
 *   <li>Open {@link AgentInvocationScope} and {@link ToolUsageScope} hierarchy scopes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent producers. Hierarchy scopes belong to the thread that opened
 * them.</p>
 * <p><strong>Performance:</strong> A logging call allocates an id, builds the event, validates it in one pass, and
 * enqueues it; no I/O happens on the caller's thread.</p>
 * <p><strong>Observability:</strong> Counts events per kind ({@code trail.events.<kind>}), schema rejections and
 * warnings.</p>
 *
 * @since 0.1.0
 */
public final class ActivityLogger {
  private static final Logger log = LoggerFactory.getLogger(ActivityLogger.class);
  private static final int LOGGED_TEXT_MAX_BYTES = 512;

  private final ProducerSettings settings;
  private final EventSchemaRegistry registry;
  private final TrailLifecycle lifecycle;
  private final HierarchyTracker hierarchy;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a logger over a lifecycle that has not necessarily been started.
   *
   * @param settings producer settings
   * @param registry schema registry
   * @param lifecycle session lifecycle
   * @param hierarchy hierarchy tracker
   * @param clock time source for event timestamps
   * @param metrics metrics sink
   */
  public ActivityLogger(
      ProducerSettings settings,
      EventSchemaRegistry registry,
      TrailLifecycle lifecycle,
      HierarchyTracker hierarchy,
      ClockPort clock,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts the session now instead of on the first logging call.
   *
   * @return session id
   * @throws LoggerStoppedException after shutdown
   */
  public String initialize() {
    return lifecycle.initialize();
  }

  /**
   * Starts the session with an explicit id; ignored when a session is already running.
   *
   * @param sessionId file-name-safe session id
   * @return id of the running session
   */
  public String initialize(String sessionId) {
    return lifecycle.initialize(Objects.requireNonNull(sessionId, "sessionId"));
  }

  public String logAgentInvocation(String agent, String invokedBy, String reason) {
    return log(AgentInvocation.of(agent, invokedBy, reason));
  }

  /**
   * Records an agent invocation with caller context.
   *
   * @param agent invoked agent
   * @param invokedBy invoking party
   * @param reason why the agent was invoked
   * @param context invocation context, may be {@code null}
   * @param metadata caller metadata, may be {@code null}
   * @return event id
   */
  public String logAgentInvocation(
      String agent, String invokedBy, String reason, Map<String, Object> context, Map<String, Object> metadata) {
    return log(AgentInvocation.of(agent, invokedBy, reason).withContext(context).withMetadata(metadata));
  }

  public String logToolUsage(String agent, String tool, String operation) {
    return log(ToolUsage.of(agent, tool, operation));
  }

  /**
   * Records a completed tool call.
   *
   * @param agent agent using the tool
   * @param tool tool name
   * @param operation what the tool was asked to do
   * @param durationMs measured duration, may be {@code null}
   * @param success outcome, may be {@code null} when unknown
   * @return event id
   */
  public String logToolUsage(String agent, String tool, String operation, Long durationMs, Boolean success) {
    ToolUsage payload = new ToolUsage(agent, tool, operation, success, durationMs, null, null, null);
    return log(payload);
  }

  public String logFileOperation(String agent, FileOperationType operation, String filePath) {
    return log(FileOperation.of(agent, operation, filePath));
  }

  public String logFileOperation(
      String agent, FileOperationType operation, String filePath, Long fileSizeBytes, Integer linesChanged) {
    return log(FileOperation.of(agent, operation, filePath).withSize(fileSizeBytes, linesChanged));
  }

  public String logDecision(String agent, String question, List<String> options, String selected) {
    return log(Decision.of(agent, question, options, selected));
  }

  public String logDecision(
      String agent, String question, List<String> options, String selected, String rationale) {
    return log(Decision.of(agent, question, options, selected).withRationale(rationale));
  }

  public String logError(String agent, String errorType, String errorMessage) {
    return log(ErrorReport.of(agent, errorType, errorMessage));
  }

  public String logError(
      String agent, String errorType, String errorMessage, ErrorSeverity severity, Boolean recoverable) {
    return log(ErrorReport.of(agent, errorType, errorMessage).withSeverity(severity, recoverable));
  }

  /**
   * Records a caught failure, using its simple class name as the error type and capturing its stack trace.
   *
   * @param agent agent that caught the failure
   * @param failure caught throwable
   * @param severity severity, may be {@code null}
   * @return event id
   */
  public String logError(String agent, Throwable failure, ErrorSeverity severity) {
    Objects.requireNonNull(failure, "failure");
    return log(ErrorReport.fromThrowable(agent, failure).withSeverity(severity, null));
  }

  public String logContextSnapshot(String trigger) {
    return log(ContextSnapshot.of(trigger));
  }

  public String logContextSnapshot(String trigger, Map<String, Object> snapshot) {
    return log(ContextSnapshot.of(trigger).withSnapshot(snapshot));
  }

  public String logValidation(String agent, String validationType, ValidationStatus result) {
    return log(ValidationRun.of(agent, validationType, result));
  }

  /**
   * Records a validation run with per-check results.
   *
   * @param agent validating agent
   * @param validationType kind of validation
   * @param result overall result
   * @param checks check name to result in any form {@link ValidationStatus#normalize} accepts
   * @return event id
   */
  public String logValidation(String agent, String validationType, ValidationStatus result, Map<String, ?> checks) {
    return log(ValidationRun.of(agent, validationType, result).withChecks(checks));
  }

  /**
   * Records a prepared payload, parented to the innermost open scope of the calling thread.
   *
   * @param payload event payload
   * @return event id
   * @throws SchemaException in strict mode when the event is invalid; nothing is written and no id is consumed
   * @throws LoggerStoppedException after shutdown
   * @throws QueueSaturationException under the {@code REJECT} saturation policy
   */
  public String log(EventPayload payload) {
    return log(payload, hierarchy.currentParent().orElse(null));
  }

  /**
   * Records a prepared payload with an explicit parent, bypassing the hierarchy tracker.
   *
   * @param payload event payload
   * @param parentEventId parent id, or {@code null} for a top-level event
   * @return event id
   */
  public String log(EventPayload payload, String parentEventId) {
    Objects.requireNonNull(payload, "payload");
    ActiveSession session = lifecycle.activeSession();
    EventPayload resolved = resolveDefaults(payload);
    if (settings.enabled() && settings.validationMode() == ValidationMode.STRICT) {
      requireValid(session, resolved, parentEventId);
    }
    String eventId = session.eventIds().nextEventId();
    record(session, eventId, parentEventId, resolved);
    return eventId;
  }

  /**
   * Logs an agent invocation and opens a hierarchy scope for it. Events logged on this thread until the scope closes
   * are parented to the invocation.
   *
   * @param agent invoked agent
   * @param invokedBy invoking party
   * @param reason why the agent was invoked
   * @return open scope; close it with try-with-resources
   */
  public AgentInvocationScope agentInvocationScope(String agent, String invokedBy, String reason) {
    return agentInvocationScope(AgentInvocation.of(agent, invokedBy, reason));
  }

  public AgentInvocationScope agentInvocationScope(AgentInvocation payload) {
    String eventId = log(payload);
    return new AgentInvocationScope(eventId, hierarchy.scopeBegin(eventId), metrics);
  }

  /**
   * Opens a tool usage scope. The event id is reserved now so nested events can reference it; the tool usage event
   * itself is written when the scope closes, carrying the measured duration and outcome.
   *
   * @param agent agent using the tool
   * @param tool tool name
   * @param operation what the tool was asked to do
   * @return open scope; close it with try-with-resources
   */
  public ToolUsageScope toolUsageScope(String agent, String tool, String operation) {
    return toolUsageScope(ToolUsage.of(agent, tool, operation));
  }

  public ToolUsageScope toolUsageScope(ToolUsage payload) {
    Objects.requireNonNull(payload, "payload");
    ActiveSession session = lifecycle.activeSession();
    String parent = hierarchy.currentParent().orElse(null);
    if (settings.enabled() && settings.validationMode() == ValidationMode.STRICT) {
      requireValid(session, payload, parent);
    }
    String eventId = session.eventIds().nextEventId();
    return new ToolUsageScope(this, session, eventId, parent, payload, hierarchy.scopeBegin(eventId), metrics);
  }

  /**
   * Runs {@code body} inside an agent invocation scope.
   *
   * @param agent invoked agent
   * @param invokedBy invoking party
   * @param reason why the agent was invoked
   * @param body work to run
   * @param <T> result type
   * @return result of {@code body}
   * @throws Exception whatever {@code body} throws, after the scope has been closed
   */
  public <T> T withAgentInvocation(String agent, String invokedBy, String reason, Callable<T> body)
      throws Exception {
    Objects.requireNonNull(body, "body");
    try (AgentInvocationScope scope = agentInvocationScope(agent, invokedBy, reason)) {
      try {
        return body.call();
      } catch (Exception ex) {
        scope.failed(ex);
        throw ex;
      }
    }
  }

  /**
   * Runs {@code body} inside a tool usage scope; the tool usage records {@code success=false} when it throws.
   *
   * @param agent agent using the tool
   * @param tool tool name
   * @param operation what the tool was asked to do
   * @param body work to run
   * @param <T> result type
   * @return result of {@code body}
   * @throws Exception whatever {@code body} throws, after the tool usage has been recorded
   */
  public <T> T withToolUsage(String agent, String tool, String operation, Callable<T> body) throws Exception {
    Objects.requireNonNull(body, "body");
    try (ToolUsageScope scope = toolUsageScope(agent, tool, operation)) {
      try {
        return body.call();
      } catch (Exception ex) {
        scope.failed(ex);
        throw ex;
      }
    }
  }

  /**
   * Returns the innermost open scope of the calling thread.
   *
   * @return event id of the innermost scope, or empty at top level
   */
  public Optional<String> currentParent() {
    return hierarchy.currentParent();
  }

  public Optional<String> sessionId() {
    return lifecycle.sessionId();
  }

  public long eventCount() {
    return lifecycle.eventCount();
  }

  public Optional<WriterStats> stats() {
    return lifecycle.writerStats();
  }

  public Optional<Path> sinkLocation() {
    return lifecycle.sinkLocation();
  }

  /**
   * Drains the writer using the configured timeout and releases metrics resources.
   *
   * @throws ShutdownTimeoutException when events could not be flushed in time
   */
  public void shutdown() {
    try {
      lifecycle.shutdown();
    } finally {
      closeMetrics();
    }
  }

  /**
   * Drains the writer and releases metrics resources.
   *
   * @param timeout longest time to wait for queued events
   * @throws ShutdownTimeoutException when events could not be flushed in time
   */
  public void shutdown(Duration timeout) {
    try {
      lifecycle.shutdown(timeout);
    } finally {
      closeMetrics();
    }
  }

  public boolean isStopped() {
    return lifecycle.isStopped();
  }

  void record(ActiveSession session, String eventId, String parentEventId, EventPayload payload) {
    if (!settings.enabled()) {
      return;
    }
    ActivityEvent event = ActivityEvent.of(clock.now(), session.sessionId(), eventId, parentEventId, payload);
    if (settings.validationMode() == ValidationMode.LENIENT) {
      SchemaValidationResult result = registry.validate(event);
      if (!result.valid()) {
        metrics.increment("trail.events.schema.warning");
        log.warn("Event {} ({}) failed validation; writing with warnings: {}",
            eventId, result.eventType(), Logs.truncate(String.join("; ", result.messages()), LOGGED_TEXT_MAX_BYTES));
        event = event.withValidationWarnings(result.messages());
      }
    }
    session.writer().submit(event);
    metrics.increment("trail.events." + payload.type().wireName());
  }

  private void requireValid(ActiveSession session, EventPayload payload, String parentEventId) {
    // Checked against the next id before one is taken, so a rejected event leaves no gap in the sequence.
    String provisionalId = EventIds.format(session.eventIds().eventCount() + 1, EventIds.DEFAULT_WIDTH);
    ActivityEvent candidate =
        ActivityEvent.of(clock.now(), session.sessionId(), provisionalId, parentEventId, payload);
    SchemaValidationResult result = registry.validate(candidate);
    if (!result.valid()) {
      metrics.increment("trail.events.schema.rejected");
      log.debug("Rejected {} event: {}", payload.type().wireName(), result.messages());
      throw new SchemaException(payload.type().wireName(), result.messages());
    }
  }

  private EventPayload resolveDefaults(EventPayload payload) {
    if (payload instanceof ContextSnapshot snapshot) {
      return snapshot.withTokenDefaults(settings.defaultTokenBudget());
    }
    return payload;
  }

  private void closeMetrics() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
