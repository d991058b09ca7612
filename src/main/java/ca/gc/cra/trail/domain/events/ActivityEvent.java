package ca.gc.cra.trail.domain.events;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One immutable, stamped record in a session's activity trail.
 * <p><strong>Why:</strong> Couples the kind-specific payload with the identifiers that give the trail its causal
 * order ({@code event_id}) and hierarchy ({@code parent_event_id}).</p>
 * <p><strong>Role:</strong> Domain value handed from {@code ActivityLogger} to the durable writer and sink adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to publish across producer and writer threads.</p>
 * <p><strong>Observability:</strong> {@link #toFields()} is the exact object persisted as one NDJSON line.</p>
 *
 * @param timestamp creation instant, millisecond precision, UTC
 * @param sessionId owning session id
 * @param eventId session-scoped id, e.g. {@code evt_001}
 * @param parentEventId id of an earlier event in the same session, or {@code null}
 * @param payload kind-specific body
 * @param validationWarnings schema problems tolerated in lenient mode; empty when the event is valid
 * @since 0.1.0
 */
public record ActivityEvent(
    Instant timestamp,
    String sessionId,
    String eventId,
    String parentEventId,
    EventPayload payload,
    List<String> validationWarnings) {

  public ActivityEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(payload, "payload");
    timestamp = EventTimestamps.truncate(timestamp);
    validationWarnings = validationWarnings == null ? List.of() : List.copyOf(validationWarnings);
  }

  /**
   * Creates an event without validation warnings.
   *
   * @param timestamp creation instant
   * @param sessionId owning session
   * @param eventId allocated id
   * @param parentEventId parent id or {@code null}
   * @param payload kind-specific body
   * @return new event
   */
  public static ActivityEvent of(
      Instant timestamp, String sessionId, String eventId, String parentEventId, EventPayload payload) {
    return new ActivityEvent(timestamp, sessionId, eventId, parentEventId, payload, List.of());
  }

  /**
   * Returns the kind of this event, as carried by its payload.
   *
   * @return event kind
   */
  public EventType eventType() {
    return payload.type();
  }

  /**
   * Returns a copy annotated with validation warnings.
   *
   * @param warnings warning messages
   * @return annotated copy
   */
  public ActivityEvent withValidationWarnings(List<String> warnings) {
    return new ActivityEvent(timestamp, sessionId, eventId, parentEventId, payload, warnings);
  }

  /**
   * Flattens the event into the persisted object: common fields first, then payload fields, then
   * {@code validation_warnings} when present. {@code parent_event_id} is always included.
   *
   * @return mutable ordered map
   */
  public Map<String, Object> toFields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event_type", eventType().wireName());
    fields.put("timestamp", EventTimestamps.format(timestamp));
    fields.put("session_id", sessionId);
    fields.put("event_id", eventId);
    fields.put("parent_event_id", parentEventId);
    fields.putAll(payload.fields());
    if (!validationWarnings.isEmpty()) {
      fields.put("validation_warnings", validationWarnings);
    }
    return fields;
  }
}
