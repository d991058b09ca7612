package ca.gc.cra.trail.application.schema;

import ca.gc.cra.trail.domain.events.ActivityEvent;
import ca.gc.cra.trail.domain.events.AgentStatus;
import ca.gc.cra.trail.domain.events.ErrorSeverity;
import ca.gc.cra.trail.domain.events.EventIds;
import ca.gc.cra.trail.domain.events.EventTimestamps;
import ca.gc.cra.trail.domain.events.EventType;
import ca.gc.cra.trail.domain.events.FileOperationType;
import ca.gc.cra.trail.domain.events.ValidationStatus;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * <strong>What:</strong> Registry of the seven event schemas and the validator that checks events against them.
 * <p><strong>Why:</strong> Payload records give compile-time structure to in-process producers, but values may still
 * arrive blank or out of range, and events replayed from sink files arrive as plain maps. Both paths share one
 * check.</p>
 * <p><strong>Role:</strong> Application service consulted by {@code ActivityLogger} before submission and by the
 * {@code verify} CLI when replaying sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check the common fields: {@code event_type}, {@code timestamp}, {@code session_id}, {@code event_id}.</li>
 *   <li>Check that {@code parent_event_id}, when set, names an earlier event.</li>
 *   <li>Check kind-specific required fields, shapes, enumerations, and numeric ranges.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent validation.</p>
 * <p><strong>Performance:</strong> One pass over the flattened event; no reflection.</p>
 *
 * @since 0.1.0
 */
public final class EventSchemaRegistry {
  private static final Double ZERO = 0d;

  private final Map<EventType, EventSchema> schemas;

  private EventSchemaRegistry(Map<EventType, EventSchema> schemas) {
    this.schemas = new EnumMap<>(schemas);
  }

  /**
   * Builds the registry holding the standard schema of every event kind.
   *
   * @return registry covering all {@link EventType} values
   */
  public static EventSchemaRegistry standard() {
    Map<EventType, EventSchema> schemas = new EnumMap<>(EventType.class);
    for (EventSchema schema : List.of(
        agentInvocation(),
        toolUsage(),
        fileOperation(),
        decision(),
        error(),
        contextSnapshot(),
        validation())) {
      schemas.put(schema.type(), schema);
    }
    return new EventSchemaRegistry(schemas);
  }

  /**
   * Returns the schema for an event kind.
   *
   * @param type event kind
   * @return schema for the kind
   */
  public EventSchema schemaFor(EventType type) {
    EventSchema schema = schemas.get(Objects.requireNonNull(type, "type"));
    if (schema == null) {
      throw new IllegalStateException("No schema registered for " + type);
    }
    return schema;
  }

  /**
   * Validates an in-process event.
   *
   * @param event stamped event
   * @return validation outcome
   */
  public SchemaValidationResult validate(ActivityEvent event) {
    Objects.requireNonNull(event, "event");
    return validate(event.toFields());
  }

  /**
   * Validates a flattened event, typically one parsed from a sink file.
   *
   * @param fields event object keyed by wire field name
   * @return validation outcome
   */
  public SchemaValidationResult validate(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    List<SchemaViolation> violations = new ArrayList<>();

    Object rawType = fields.get("event_type");
    Optional<EventType> type =
        rawType instanceof String text ? EventType.fromWire(text) : Optional.empty();
    if (rawType == null) {
      violations.add(new SchemaViolation("event_type", "is required"));
    } else if (type.isEmpty()) {
      violations.add(new SchemaViolation("event_type", "unknown event type '" + rawType + "'"));
    }

    checkCommonFields(fields, violations);
    type.ifPresent(t -> checkPayload(schemaFor(t), fields, violations));

    Object warnings = fields.get("validation_warnings");
    if (warnings != null && !FieldShape.STRING_LIST.accepts(warnings)) {
      violations.add(new SchemaViolation("validation_warnings", "must be a list of strings"));
    }
    return new SchemaValidationResult(type.map(EventType::wireName).orElse(null), violations);
  }

  private static void checkCommonFields(Map<String, ?> fields, List<SchemaViolation> violations) {
    Object timestamp = fields.get("timestamp");
    if (timestamp == null) {
      violations.add(new SchemaViolation("timestamp", "is required"));
    } else if (!(timestamp instanceof String text) || EventTimestamps.parse(text).isEmpty()) {
      violations.add(new SchemaViolation("timestamp", "must be an ISO-8601 date-time with offset"));
    }

    Object sessionId = fields.get("session_id");
    if (!(sessionId instanceof String text) || text.isBlank()) {
      violations.add(new SchemaViolation("session_id", "is required"));
    }

    Object eventId = fields.get("event_id");
    long sequence = -1L;
    if (eventId == null) {
      violations.add(new SchemaViolation("event_id", "is required"));
    } else if (!(eventId instanceof String text) || !EventIds.isWellFormed(text)) {
      violations.add(new SchemaViolation("event_id", "must match evt_<digits> (was " + eventId + ")"));
    } else {
      sequence = EventIds.sequenceOf(text);
    }

    Object parent = fields.get("parent_event_id");
    if (parent != null) {
      if (!(parent instanceof String text) || !EventIds.isWellFormed(text)) {
        violations.add(new SchemaViolation("parent_event_id", "must match evt_<digits> (was " + parent + ")"));
      } else if (sequence > 0 && EventIds.sequenceOf(text) >= sequence) {
        violations.add(new SchemaViolation("parent_event_id", "must reference an earlier event (was " + text + ")"));
      }
    }
  }

  private static void checkPayload(EventSchema schema, Map<String, ?> fields, List<SchemaViolation> violations) {
    for (FieldRule rule : schema.rules().values()) {
      Object value = fields.get(rule.name());
      if (value == null) {
        if (rule.required()) {
          violations.add(new SchemaViolation(rule.name(), "is required"));
        }
        continue;
      }
      if (!rule.shape().accepts(value)) {
        violations.add(new SchemaViolation(
            rule.name(), "must be " + describe(rule.shape()) + " (was " + value.getClass().getSimpleName() + ")"));
        continue;
      }
      if (rule.required() && value instanceof String text && text.isBlank()) {
        violations.add(new SchemaViolation(rule.name(), "must not be blank"));
        continue;
      }
      checkAllowedValues(rule, value, violations);
      checkRange(rule, value, violations);
    }
  }

  private static void checkAllowedValues(FieldRule rule, Object value, List<SchemaViolation> violations) {
    if (rule.allowedValues().isEmpty()) {
      return;
    }
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        Object nested = entry.getValue();
        if (!(nested instanceof String text) || !rule.allowedValues().contains(text)) {
          violations.add(new SchemaViolation(
              rule.name() + "." + entry.getKey(), "must be one of " + sorted(rule.allowedValues())));
        }
      }
      return;
    }
    if (!rule.allowedValues().contains(value.toString())) {
      violations.add(new SchemaViolation(
          rule.name(), "must be one of " + sorted(rule.allowedValues()) + " (was " + value + ")"));
    }
  }

  private static void checkRange(FieldRule rule, Object value, List<SchemaViolation> violations) {
    if (!(value instanceof Number number)) {
      return;
    }
    double numeric = number.doubleValue();
    if ((rule.min() != null && numeric < rule.min()) || (rule.max() != null && numeric > rule.max())) {
      String bounds = rule.max() == null
          ? ">= " + format(rule.min())
          : "between " + format(rule.min()) + " and " + format(rule.max());
      violations.add(new SchemaViolation(rule.name(), "must be " + bounds + " (was " + value + ")"));
    }
  }

  private static String describe(FieldShape shape) {
    return switch (shape) {
      case STRING -> "a string";
      case INTEGER -> "an integer";
      case NUMBER -> "a number";
      case BOOLEAN -> "a boolean";
      case STRING_LIST -> "a list of strings";
      case OBJECT -> "an object";
    };
  }

  private static String format(Double bound) {
    return bound == Math.rint(bound) ? Long.toString(bound.longValue()) : bound.toString();
  }

  private static List<String> sorted(Set<String> values) {
    return values.stream().sorted().toList();
  }

  private static <E extends Enum<E>> Set<String> wireNames(E[] values, Function<E, String> wireName) {
    Set<String> names = new LinkedHashSet<>();
    Arrays.stream(values).map(wireName).forEach(names::add);
    return names;
  }

  private static EventSchema agentInvocation() {
    return EventSchema.builder(EventType.AGENT_INVOCATION)
        .required("agent", FieldShape.STRING)
        .required("invoked_by", FieldShape.STRING)
        .required("reason", FieldShape.STRING)
        .optionalOneOf("status", FieldShape.STRING, wireNames(AgentStatus.values(), AgentStatus::wireName))
        .optional("context", FieldShape.OBJECT)
        .optional("metadata", FieldShape.OBJECT)
        .optional("result", FieldShape.OBJECT)
        .optionalRange("duration_ms", FieldShape.INTEGER, ZERO, null)
        .optionalRange("tokens_consumed", FieldShape.INTEGER, ZERO, null)
        .build();
  }

  private static EventSchema toolUsage() {
    return EventSchema.builder(EventType.TOOL_USAGE)
        .required("agent", FieldShape.STRING)
        .required("tool", FieldShape.STRING)
        .required("operation", FieldShape.STRING)
        .optional("success", FieldShape.BOOLEAN)
        .optionalRange("duration_ms", FieldShape.INTEGER, ZERO, null)
        .optional("parameters", FieldShape.OBJECT)
        .optional("error_message", FieldShape.STRING)
        .optional("result_summary", FieldShape.STRING)
        .build();
  }

  private static EventSchema fileOperation() {
    return EventSchema.builder(EventType.FILE_OPERATION)
        .required("agent", FieldShape.STRING)
        .requiredOneOf("operation", wireNames(FileOperationType.values(), FileOperationType::wireName))
        .required("file_path", FieldShape.STRING)
        .optionalRange("file_size_bytes", FieldShape.INTEGER, ZERO, null)
        .optionalRange("lines_changed", FieldShape.INTEGER, ZERO, null)
        .optional("diff", FieldShape.STRING)
        .optional("git_hash_before", FieldShape.STRING)
        .optional("git_hash_after", FieldShape.STRING)
        .optional("language", FieldShape.STRING)
        .build();
  }

  private static EventSchema decision() {
    return EventSchema.builder(EventType.DECISION)
        .required("agent", FieldShape.STRING)
        .required("question", FieldShape.STRING)
        .required("options", FieldShape.STRING_LIST)
        .required("selected", FieldShape.STRING)
        .optional("rationale", FieldShape.STRING)
        .optionalRange("confidence", FieldShape.NUMBER, ZERO, 1d)
        .optional("alternative_considered", FieldShape.STRING)
        .build();
  }

  private static EventSchema error() {
    return EventSchema.builder(EventType.ERROR)
        .required("agent", FieldShape.STRING)
        .required("error_type", FieldShape.STRING)
        .required("error_message", FieldShape.STRING)
        .optionalOneOf("severity", FieldShape.STRING, wireNames(ErrorSeverity.values(), ErrorSeverity::wireName))
        .optional("recoverable", FieldShape.BOOLEAN)
        .optional("context", FieldShape.OBJECT)
        .optional("stack_trace", FieldShape.STRING)
        .optional("attempted_fix", FieldShape.STRING)
        .optional("fix_successful", FieldShape.BOOLEAN)
        .optionalRange("recovery_time_ms", FieldShape.INTEGER, ZERO, null)
        .build();
  }

  private static EventSchema contextSnapshot() {
    return EventSchema.builder(EventType.CONTEXT_SNAPSHOT)
        .required("trigger", FieldShape.STRING)
        .optionalRange("tokens_before", FieldShape.INTEGER, ZERO, null)
        .optionalRange("tokens_after", FieldShape.INTEGER, ZERO, null)
        .optionalRange("tokens_consumed", FieldShape.INTEGER, ZERO, null)
        .optionalRange("tokens_remaining", FieldShape.INTEGER, ZERO, null)
        .optionalRange("tokens_total_budget", FieldShape.INTEGER, ZERO, null)
        .optional("files_in_context", FieldShape.STRING_LIST)
        .optionalRange("files_in_context_count", FieldShape.INTEGER, ZERO, null)
        .optionalRange("memory_mb", FieldShape.NUMBER, ZERO, null)
        .optional("agent", FieldShape.STRING)
        .optional("snapshot", FieldShape.OBJECT)
        .build();
  }

  private static EventSchema validation() {
    Set<String> statuses = wireNames(ValidationStatus.values(), ValidationStatus::wireName);
    return EventSchema.builder(EventType.VALIDATION)
        .required("agent", FieldShape.STRING)
        .required("validation_type", FieldShape.STRING)
        .requiredOneOf("result", statuses)
        .optional("task", FieldShape.STRING)
        .optionalOneOf("checks", FieldShape.OBJECT, statuses)
        .optional("failures", FieldShape.STRING_LIST)
        .optional("warnings", FieldShape.STRING_LIST)
        .optional("metrics", FieldShape.OBJECT)
        .build();
  }
}
