package ca.gc.cra.trail.domain.events;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload recording a validation performed by an agent (tests, acceptance criteria, performance checks).
 *
 * @param agent validating agent
 * @param validationType kind of validation (e.g. {@code unit_test})
 * @param result overall result
 * @param task task being validated
 * @param checks individual checks and their results
 * @param failures failed check descriptions
 * @param warnings warning messages
 * @param metrics measured values such as coverage
 * @since 0.1.0
 */
public record ValidationRun(
    String agent,
    String validationType,
    ValidationStatus result,
    String task,
    Map<String, ValidationStatus> checks,
    List<String> failures,
    List<String> warnings,
    Map<String, Object> metrics) implements EventPayload {

  public ValidationRun {
    checks = PayloadFields.copyMap(checks);
    failures = PayloadFields.copyList(failures);
    warnings = PayloadFields.copyList(warnings);
    metrics = PayloadFields.copyMap(metrics);
  }

  public static ValidationRun of(String agent, String validationType, ValidationStatus result) {
    return new ValidationRun(agent, validationType, result, null, null, null, null, null);
  }

  /**
   * Attaches checks whose results may be given in any form accepted by {@link ValidationStatus#normalize}.
   *
   * @param rawChecks check name to raw result
   * @return copy carrying normalized checks
   */
  public ValidationRun withChecks(Map<String, ?> rawChecks) {
    Map<String, ValidationStatus> normalized = null;
    if (rawChecks != null) {
      normalized = new LinkedHashMap<>();
      for (Map.Entry<String, ?> entry : rawChecks.entrySet()) {
        normalized.put(entry.getKey(), ValidationStatus.normalize(entry.getValue()));
      }
    }
    return new ValidationRun(agent, validationType, result, task, normalized, failures, warnings, metrics);
  }

  public ValidationRun withTask(String newTask) {
    return new ValidationRun(agent, validationType, result, newTask, checks, failures, warnings, metrics);
  }

  public ValidationRun withFindings(List<String> newFailures, List<String> newWarnings) {
    return new ValidationRun(agent, validationType, result, task, checks, newFailures, newWarnings, metrics);
  }

  public ValidationRun withMetrics(Map<String, Object> newMetrics) {
    return new ValidationRun(agent, validationType, result, task, checks, failures, warnings, newMetrics);
  }

  @Override
  public EventType type() {
    return EventType.VALIDATION;
  }

  @Override
  public Map<String, Object> fields() {
    Map<String, Object> wireChecks = null;
    if (checks != null) {
      wireChecks = new LinkedHashMap<>();
      for (Map.Entry<String, ValidationStatus> entry : checks.entrySet()) {
        ValidationStatus status = entry.getValue() == null ? ValidationStatus.SKIPPED : entry.getValue();
        wireChecks.put(entry.getKey(), status.wireName());
      }
    }
    return new PayloadFields()
        .put("agent", agent)
        .put("validation_type", validationType)
        .put("result", result == null ? null : result.wireName())
        .put("task", task)
        .put("checks", wireChecks)
        .put("failures", failures)
        .put("warnings", warnings)
        .put("metrics", metrics)
        .build();
  }
}
