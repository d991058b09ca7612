package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndProfileSections() throws IOException {
    Path yaml = tempDir.resolve("trail.yaml");
    Files.writeString(yaml, """
        common:
          logDir: /var/log/trail
          compression: true
        ci:
          compression: false
          queueCapacity: 512
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "CI");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("/var/log/trail", map.get("logDir"));
    assertEquals("false", map.get("compression"));
    assertEquals("512", map.get("queueCapacity"));
  }

  @Test
  void unknownProfileUsesCommonOnly() throws IOException {
    Path yaml = tempDir.resolve("trail.yaml");
    Files.writeString(yaml, """
        common:
          retentionCount: 5
        """);

    assertEquals(Map.of("retentionCount", "5"), YamlConfigLoader.load(yaml, "prod").orElseThrow());
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          writer:
            queue:
              capacity: 64
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, null).orElseThrow();
    assertEquals("64", map.get("writer.queue.capacity"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, null).orElseThrow());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "ci").isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - common:
            logDir: x
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, null));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        common:
          logDir:
            - a
            - b
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, null));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, null));
  }
}
