package ca.gc.cra.trail.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("agent", Strings.requireNonBlank("agent", "  agent "));
  }

  @Test
  void requireNonBlankRejectsBlankNullAndControl() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("agent", "   "));
    assertEquals("agent must not be blank", blank.getMessage());

    IllegalArgumentException control = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank(null, "a\u0007b"));
    assertEquals("value must not contain control characters", control.getMessage());

    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("agent", null));
  }

  @Test
  void fileNameSafeAcceptsSessionIds() {
    assertEquals("session_20250314_092653", Strings.requireFileNameSafe("sessionId", "session_20250314_092653"));
    assertEquals("run-1.a", Strings.requireFileNameSafe("sessionId", "run-1.a"));
  }

  @Test
  void fileNameSafeRejectsSeparatorsAndHiddenNames() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("sessionId", "../etc"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("sessionId", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("sessionId", ".hidden"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("sessionId", "with space"));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Strings.parseBoolean("flag", "TRUE"));
    assertFalse(Strings.parseBoolean("flag", " false "));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.parseBoolean("flag", "1"));
    assertEquals("flag must be true or false (was 1)", ex.getMessage());
  }
}
