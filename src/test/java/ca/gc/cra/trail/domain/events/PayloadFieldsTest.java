package ca.gc.cra.trail.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayloadFieldsTest {

  @Test
  void nestedContextValuesAreDetachedFromTheCaller() {
    List<String> files = new ArrayList<>(List.of("a.py"));
    Map<String, Object> limits = new HashMap<>(Map.of("max_tokens", 4_000));
    Map<String, Object> context = new HashMap<>();
    context.put("files", files);
    context.put("limits", limits);

    AgentInvocation invocation = AgentInvocation.of("planner", "orchestrator", "plan").withContext(context);
    files.add("b.py");
    limits.put("max_tokens", 1);
    context.put("late", true);

    assertEquals(List.of("a.py"), invocation.context().get("files"));
    assertEquals(Map.of("max_tokens", 4_000), invocation.context().get("limits"));
    assertEquals(2, invocation.context().size());
  }

  @Test
  void nestedCopiesAreReadOnly() {
    AgentInvocation invocation = AgentInvocation.of("planner", "orchestrator", "plan")
        .withContext(Map.of("files", new ArrayList<>(List.of("a.py"))));

    @SuppressWarnings("unchecked")
    List<Object> files = (List<Object>) invocation.context().get("files");
    assertThrows(UnsupportedOperationException.class, () -> files.add("b.py"));
  }

  @Test
  void arraysBecomeLists() {
    int[] exitCodes = {0, 2};
    String[] tags = {"lint"};

    Map<String, Object> copy = PayloadFields.copyMap(Map.of("exit_codes", exitCodes, "tags", tags));
    exitCodes[0] = 9;
    tags[0] = "changed";

    assertEquals(List.of(0, 2), copy.get("exit_codes"));
    assertEquals(List.of("lint"), copy.get("tags"));
  }
}
