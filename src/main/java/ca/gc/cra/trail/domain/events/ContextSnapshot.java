package ca.gc.cra.trail.domain.events;

import java.util.List;
import java.util.Map;

/**
 * Payload checkpointing token consumption and context contents.
 *
 * @param trigger what caused the snapshot (e.g. {@code task_complete}, {@code periodic})
 * @param tokensBefore token count before the operation
 * @param tokensAfter token count after the operation
 * @param tokensConsumed tokens consumed by the operation
 * @param tokensRemaining tokens left in the budget
 * @param tokensTotalBudget total token budget of the session
 * @param filesInContext files currently in context
 * @param filesInContextCount number of files in context
 * @param memoryMb memory usage in megabytes
 * @param agent agent the snapshot belongs to
 * @param snapshot free-form snapshot body
 * @since 0.1.0
 */
public record ContextSnapshot(
    String trigger,
    Long tokensBefore,
    Long tokensAfter,
    Long tokensConsumed,
    Long tokensRemaining,
    Long tokensTotalBudget,
    List<String> filesInContext,
    Integer filesInContextCount,
    Double memoryMb,
    String agent,
    Map<String, Object> snapshot) implements EventPayload {

  public ContextSnapshot {
    filesInContext = PayloadFields.copyList(filesInContext);
    snapshot = PayloadFields.copyMap(snapshot);
  }

  public static ContextSnapshot of(String trigger) {
    return new ContextSnapshot(trigger, null, null, null, null, null, null, null, null, null, null);
  }

  /**
   * Derives the token counters from a starting count, a consumption figure, and a budget.
   * {@code tokens_after} is {@code before + consumed}; {@code tokens_remaining} never goes below zero.
   *
   * @param before tokens in context before the operation
   * @param consumed tokens consumed by the operation
   * @param budget total budget
   * @return copy carrying all five token counters
   */
  public ContextSnapshot withTokenUsage(long before, long consumed, long budget) {
    long after = before + consumed;
    long remaining = Math.max(budget - after, 0L);
    return new ContextSnapshot(
        trigger, before, after, consumed, remaining, budget, filesInContext, filesInContextCount, memoryMb,
        agent, snapshot);
  }

  public ContextSnapshot withFiles(List<String> files) {
    Integer count = files == null ? null : files.size();
    return new ContextSnapshot(
        trigger, tokensBefore, tokensAfter, tokensConsumed, tokensRemaining, tokensTotalBudget, files, count,
        memoryMb, agent, snapshot);
  }

  public ContextSnapshot withMemoryMb(Double newMemoryMb) {
    return new ContextSnapshot(
        trigger, tokensBefore, tokensAfter, tokensConsumed, tokensRemaining, tokensTotalBudget, filesInContext,
        filesInContextCount, newMemoryMb, agent, snapshot);
  }

  public ContextSnapshot withAgent(String newAgent) {
    return new ContextSnapshot(
        trigger, tokensBefore, tokensAfter, tokensConsumed, tokensRemaining, tokensTotalBudget, filesInContext,
        filesInContextCount, memoryMb, newAgent, snapshot);
  }

  public ContextSnapshot withSnapshot(Map<String, Object> newSnapshot) {
    return new ContextSnapshot(
        trigger, tokensBefore, tokensAfter, tokensConsumed, tokensRemaining, tokensTotalBudget, filesInContext,
        filesInContextCount, memoryMb, agent, newSnapshot);
  }

  /**
   * Fills the token counters the caller left out: {@code tokens_before} and {@code tokens_consumed} default to zero,
   * {@code tokens_after} to their sum, {@code tokens_total_budget} to {@code defaultBudget}, and
   * {@code tokens_remaining} to what is left of the budget, never below zero. The file list defaults to empty and its
   * count is always derived from it.
   *
   * @param defaultBudget budget applied when none was given
   * @return copy with every token counter set
   */
  public ContextSnapshot withTokenDefaults(long defaultBudget) {
    long before = tokensBefore == null ? 0L : tokensBefore;
    long consumed = tokensConsumed == null ? 0L : tokensConsumed;
    long after = tokensAfter == null ? before + consumed : tokensAfter;
    long budget = tokensTotalBudget == null ? defaultBudget : tokensTotalBudget;
    long remaining = tokensRemaining == null ? Math.max(budget - after, 0L) : tokensRemaining;
    List<String> files = filesInContext == null ? List.of() : filesInContext;
    return new ContextSnapshot(
        trigger, before, after, consumed, remaining, budget, files, files.size(), memoryMb, agent, snapshot);
  }

  @Override
  public EventType type() {
    return EventType.CONTEXT_SNAPSHOT;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("trigger", trigger)
        .put("tokens_before", tokensBefore)
        .put("tokens_after", tokensAfter)
        .put("tokens_consumed", tokensConsumed)
        .put("tokens_remaining", tokensRemaining)
        .put("tokens_total_budget", tokensTotalBudget)
        .put("files_in_context", filesInContext)
        .put("files_in_context_count", filesInContextCount)
        .put("memory_mb", memoryMb)
        .put("agent", agent)
        .put("snapshot", snapshot)
        .build();
  }
}
