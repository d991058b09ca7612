package ca.gc.cra.trail.domain.events;

import java.util.Map;

/**
 * <strong>What:</strong> Kind-specific body of an {@link ActivityEvent}.
 * <p><strong>Why:</strong> One record per event kind keeps required fields visible in the factory signatures while the
 * schema registry still checks values that arrive blank or {@code null}.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code ActivityLogger} and flattened by sinks.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface EventPayload
    permits AgentInvocation, ToolUsage, FileOperation, Decision, ErrorReport, ContextSnapshot, ValidationRun {

  /**
   * Returns the event kind this payload belongs to.
   *
   * @return event kind
   */
  EventType type();

  /**
   * Returns the payload as wire-named fields in a stable order, omitting absent optional values.
   *
   * @return unmodifiable ordered map of field name to value (strings, numbers, booleans, lists, maps)
   */
  Map<String, Object> fields();
}
