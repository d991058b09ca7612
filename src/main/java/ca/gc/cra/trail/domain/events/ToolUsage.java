package ca.gc.cra.trail.domain.events;

import java.util.Map;

/**
 * Payload recording a single tool call made by an agent.
 *
 * @param agent agent using the tool
 * @param tool tool name (e.g. {@code Read}, {@code Bash})
 * @param operation description of what the tool was asked to do
 * @param success whether the call succeeded; {@code null} when not reported
 * @param durationMs duration in milliseconds, when measured
 * @param parameters tool parameters
 * @param errorMessage failure message when {@code success} is {@code false}
 * @param resultSummary short description of the outcome
 * @since 0.1.0
 */
public record ToolUsage(
    String agent,
    String tool,
    String operation,
    Boolean success,
    Long durationMs,
    Map<String, Object> parameters,
    String errorMessage,
    String resultSummary) implements EventPayload {

  public ToolUsage {
    parameters = PayloadFields.copyMap(parameters);
  }

  public static ToolUsage of(String agent, String tool, String operation) {
    return new ToolUsage(agent, tool, operation, null, null, null, null, null);
  }

  public ToolUsage withOutcome(boolean newSuccess, Long newDurationMs) {
    return new ToolUsage(
        agent, tool, operation, newSuccess, newDurationMs, parameters, errorMessage, resultSummary);
  }

  public ToolUsage withParameters(Map<String, Object> newParameters) {
    return new ToolUsage(
        agent, tool, operation, success, durationMs, newParameters, errorMessage, resultSummary);
  }

  public ToolUsage withErrorMessage(String newErrorMessage) {
    return new ToolUsage(
        agent, tool, operation, success, durationMs, parameters, newErrorMessage, resultSummary);
  }

  public ToolUsage withResultSummary(String newResultSummary) {
    return new ToolUsage(
        agent, tool, operation, success, durationMs, parameters, errorMessage, newResultSummary);
  }

  @Override
  public EventType type() {
    return EventType.TOOL_USAGE;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("agent", agent)
        .put("tool", tool)
        .put("operation", operation)
        .put("success", success)
        .put("duration_ms", durationMs)
        .put("parameters", parameters)
        .put("error_message", errorMessage)
        .put("result_summary", resultSummary)
        .build();
  }
}
