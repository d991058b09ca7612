package ca.gc.cra.trail.application.schema;

import ca.gc.cra.trail.domain.events.EventType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field rules for one event kind.
 *
 * @since 0.1.0
 */
public final class EventSchema {
  private final EventType type;
  private final Map<String, FieldRule> rules;

  private EventSchema(EventType type, Map<String, FieldRule> rules) {
    this.type = type;
    this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
  }

  public static Builder builder(EventType type) {
    return new Builder(type);
  }

  public EventType type() {
    return type;
  }

  /**
   * Returns all rules keyed by field name, in declaration order.
   *
   * @return unmodifiable rule map
   */
  public Map<String, FieldRule> rules() {
    return rules;
  }

  /**
   * Returns the names of the fields every event of this kind must carry.
   *
   * @return required field names in declaration order
   */
  public List<String> requiredFields() {
    List<String> required = new ArrayList<>();
    for (FieldRule rule : rules.values()) {
      if (rule.required()) {
        required.add(rule.name());
      }
    }
    return List.copyOf(required);
  }

  /** Fluent builder used by {@link EventSchemaRegistry}. */
  public static final class Builder {
    private final EventType type;
    private final Map<String, FieldRule> rules = new LinkedHashMap<>();

    private Builder(EventType type) {
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder required(String name, FieldShape shape) {
      return add(new FieldRule(name, shape, true, Set.of(), null, null));
    }

    public Builder requiredOneOf(String name, Set<String> allowed) {
      return add(new FieldRule(name, FieldShape.STRING, true, allowed, null, null));
    }

    public Builder optional(String name, FieldShape shape) {
      return add(new FieldRule(name, shape, false, Set.of(), null, null));
    }

    public Builder optionalOneOf(String name, FieldShape shape, Set<String> allowed) {
      return add(new FieldRule(name, shape, false, allowed, null, null));
    }

    public Builder optionalRange(String name, FieldShape shape, Double min, Double max) {
      return add(new FieldRule(name, shape, false, Set.of(), min, max));
    }

    private Builder add(FieldRule rule) {
      if (rules.putIfAbsent(rule.name(), rule) != null) {
        throw new IllegalArgumentException("duplicate rule for " + type.wireName() + "." + rule.name());
      }
      return this;
    }

    public EventSchema build() {
      return new EventSchema(type, rules);
    }
  }
}
