package ca.gc.cra.trail.domain.events;

import java.util.List;
import java.util.Map;

/**
 * Payload recording a choice made by an agent.
 *
 * @param agent deciding agent
 * @param question decision being made
 * @param options available options
 * @param selected option that was chosen
 * @param rationale why the option was chosen
 * @param confidence confidence between 0.0 and 1.0
 * @param alternativeConsidered main alternative that lost
 * @since 0.1.0
 */
public record Decision(
    String agent,
    String question,
    List<String> options,
    String selected,
    String rationale,
    Double confidence,
    String alternativeConsidered) implements EventPayload {

  public Decision {
    options = PayloadFields.copyList(options);
  }

  public static Decision of(String agent, String question, List<String> options, String selected) {
    return new Decision(agent, question, options, selected, null, null, null);
  }

  public Decision withRationale(String newRationale) {
    return new Decision(agent, question, options, selected, newRationale, confidence, alternativeConsidered);
  }

  public Decision withConfidence(Double newConfidence) {
    return new Decision(agent, question, options, selected, rationale, newConfidence, alternativeConsidered);
  }

  public Decision withAlternativeConsidered(String alternative) {
    return new Decision(agent, question, options, selected, rationale, confidence, alternative);
  }

  @Override
  public EventType type() {
    return EventType.DECISION;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("agent", agent)
        .put("question", question)
        .put("options", options)
        .put("selected", selected)
        .put("rationale", rationale)
        .put("confidence", confidence)
        .put("alternative_considered", alternativeConsidered)
        .build();
  }
}
