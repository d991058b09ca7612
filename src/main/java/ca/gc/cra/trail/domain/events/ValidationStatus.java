package ca.gc.cra.trail.domain.events;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Outcome of a validation run or of one of its checks.
 * <p><strong>Why:</strong> Agents report results in free-form words ({@code "ok"}, {@code "failed"}, booleans);
 * {@link #normalize(Object)} folds them into the four persisted values.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ValidationStatus {
  PASS("pass"),
  FAIL("fail"),
  WARNING("warning"),
  SKIPPED("skipped");

  private static final Set<String> PASS_ALIASES =
      Set.of("pass", "passed", "success", "successful", "ok", "true", "1", "yes");
  private static final Set<String> FAIL_ALIASES =
      Set.of("fail", "failed", "failure", "error", "false", "0", "no");
  private static final Set<String> WARNING_ALIASES =
      Set.of("warn", "warning", "warnings", "alert", "caution");

  private final String wireName;

  ValidationStatus(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value written to the sink.
   *
   * @return lowercase wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Folds an arbitrary status value into a {@link ValidationStatus}.
   *
   * <p>Booleans map to {@link #PASS}/{@link #FAIL}; strings are matched case-insensitively against known
   * aliases; anything else, including {@code null}, is {@link #SKIPPED}.</p>
   *
   * @param raw status reported by the caller
   * @return normalized status; never {@code null}
   */
  public static ValidationStatus normalize(Object raw) {
    if (raw == null) {
      return SKIPPED;
    }
    if (raw instanceof ValidationStatus status) {
      return status;
    }
    if (raw instanceof Boolean flag) {
      return flag ? PASS : FAIL;
    }
    String normalized = raw.toString().trim().toLowerCase(Locale.ROOT);
    if (PASS_ALIASES.contains(normalized)) {
      return PASS;
    }
    if (FAIL_ALIASES.contains(normalized)) {
      return FAIL;
    }
    if (WARNING_ALIASES.contains(normalized)) {
      return WARNING;
    }
    return SKIPPED;
  }

  /**
   * Strict lookup used when reading persisted events.
   *
   * @param raw persisted wire value
   * @return matching status, or empty when the value is not one of the four wire names
   */
  public static Optional<ValidationStatus> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ValidationStatus status : values()) {
      if (status.wireName.equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
