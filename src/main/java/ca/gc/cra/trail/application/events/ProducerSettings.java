package ca.gc.cra.trail.application.events;

import ca.gc.cra.trail.application.schema.ValidationMode;
import ca.gc.cra.trail.validation.Numbers;
import java.util.Objects;

/**
 * Producer-side behaviour of an {@link ActivityLogger}.
 *
 * @param enabled when {@code false} ids are still allocated and returned but nothing is validated or written
 * @param validationMode validation applied before submission
 * @param defaultTokenBudget budget applied to context snapshots that do not carry one
 * @since 0.1.0
 */
public record ProducerSettings(boolean enabled, ValidationMode validationMode, long defaultTokenBudget) {
  public ProducerSettings {
    Objects.requireNonNull(validationMode, "validationMode");
    Numbers.requireRange("defaultTokenBudget", defaultTokenBudget, 1, Long.MAX_VALUE);
  }

  /**
   * Returns enabled, lenient settings with the standard 200 000 token budget.
   *
   * @return default settings
   */
  public static ProducerSettings defaults() {
    return new ProducerSettings(true, ValidationMode.LENIENT, 200_000L);
  }
}
