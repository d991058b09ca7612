package ca.gc.cra.trail.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesWordsFlagsHelpAndVerbose() {
    CliInput input = CliInput.parse(new String[] {"verify", "--VERBOSE", "file=a.jsonl", "--dry-run", " ", "-h"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertEquals(Set.of("--dry-run"), input.flags());
    assertArrayEquals(new String[] {"verify", "file=a.jsonl"}, input.keyValueArgs());
  }

  @Test
  void withoutCommandDropsFirstWordOnly() {
    CliInput input = CliInput.parse(new String[] {"rotate", "keep=1", "-v"});

    CliInput delegate = input.withoutCommand();

    assertArrayEquals(new String[] {"keep=1"}, delegate.keyValueArgs());
    assertTrue(delegate.verbose());
    assertFalse(delegate.help());
  }

  @Test
  void emptyArgumentsYieldEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.help());
    assertTrue(input.flags().isEmpty());
    assertEquals(0, input.withoutCommand().keyValueArgs().length);
  }

  @Test
  void dashedSettingsStayWords() {
    CliInput input = CliInput.parse(new String[] {"--config=trail.yaml"});

    assertArrayEquals(new String[] {"--config=trail.yaml"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }
}
