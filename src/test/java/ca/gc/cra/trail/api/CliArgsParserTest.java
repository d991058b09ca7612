package ca.gc.cra.trail.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"logDir=/tmp/x", "keep=3", "logDir=/tmp/y"});

    assertEquals(List.of("logDir", "keep"), List.copyOf(map.keySet()));
    assertEquals("/tmp/y", map.get("logDir"));
    assertEquals("3", map.get("keep"));
  }

  @Test
  void splitsOnFirstEqualsAndKeepsEmptyValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"sessionIdFormat='run_'yyyy=MM", "profile="});

    assertEquals("'run_'yyyy=MM", map.get("sessionIdFormat"));
    assertEquals("", map.get("profile"));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid", "key=value"}));
    assertEquals("argument must be key=value (was 'invalid')", ex.getMessage());
  }

  @Test
  void rejectsBadKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0000b"}));
  }
}
