package ca.gc.cra.trail.domain.events;

import java.util.Map;

/**
 * Payload recording that an agent was invoked.
 *
 * @param agent name of the invoked agent
 * @param invokedBy caller that invoked the agent (user, orchestrator, another agent)
 * @param reason why the agent was invoked
 * @param status lifecycle status; {@code null} when not reported
 * @param context free-form invocation context
 * @param metadata free-form caller metadata
 * @param result results reported on completion
 * @param durationMs wall-clock duration in milliseconds, when known
 * @param tokensConsumed tokens consumed by the agent, when known
 * @since 0.1.0
 */
public record AgentInvocation(
    String agent,
    String invokedBy,
    String reason,
    AgentStatus status,
    Map<String, Object> context,
    Map<String, Object> metadata,
    Map<String, Object> result,
    Long durationMs,
    Long tokensConsumed) implements EventPayload {

  public AgentInvocation {
    context = PayloadFields.copyMap(context);
    metadata = PayloadFields.copyMap(metadata);
    result = PayloadFields.copyMap(result);
  }

  /**
   * Creates an invocation payload carrying only the required fields.
   *
   * @param agent invoked agent
   * @param invokedBy invoking party
   * @param reason invocation reason
   * @return payload without optional fields
   */
  public static AgentInvocation of(String agent, String invokedBy, String reason) {
    return new AgentInvocation(agent, invokedBy, reason, null, null, null, null, null, null);
  }

  public AgentInvocation withStatus(AgentStatus newStatus) {
    return new AgentInvocation(
        agent, invokedBy, reason, newStatus, context, metadata, result, durationMs, tokensConsumed);
  }

  public AgentInvocation withContext(Map<String, Object> newContext) {
    return new AgentInvocation(
        agent, invokedBy, reason, status, newContext, metadata, result, durationMs, tokensConsumed);
  }

  public AgentInvocation withMetadata(Map<String, Object> newMetadata) {
    return new AgentInvocation(
        agent, invokedBy, reason, status, context, newMetadata, result, durationMs, tokensConsumed);
  }

  public AgentInvocation withResult(Map<String, Object> newResult, Long newDurationMs, Long newTokens) {
    return new AgentInvocation(
        agent, invokedBy, reason, status, context, metadata, newResult, newDurationMs, newTokens);
  }

  @Override
  public EventType type() {
    return EventType.AGENT_INVOCATION;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("agent", agent)
        .put("invoked_by", invokedBy)
        .put("reason", reason)
        .put("status", status == null ? null : status.wireName())
        .put("context", context)
        .put("metadata", metadata)
        .put("result", result)
        .put("duration_ms", durationMs)
        .put("tokens_consumed", tokensConsumed)
        .build();
  }
}
