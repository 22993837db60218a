package ca.gc.eccc.sentinel.config;

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
  void modeSectionOverridesCommonSection() throws IOException {
    Path yaml = tempDir.resolve("sentinel.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          verbose: true
        monitor:
          verbose: false
          workers: 8
        replay:
          incident: ignored
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "monitor");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("false", map.get("verbose"));
    assertEquals("8", map.get("workers"));
    assertFalse(map.containsKey("incident"));
  }

  @Test
  void nestedMapsFlattenToDottedKeys() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        monitor:
          retry:
            maxRetries: 5
          policy:
            requiresApproval:
              Medium: false
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "MONITOR").orElseThrow();

    assertEquals("5", map.get("retry.maxRetries"));
    assertEquals("false", map.get("policy.requiresApproval.Medium"));
  }

  @Test
  void scalarListsJoinWithCommas() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        monitor:
          locations:
            - Ottawa
            - Halifax
          recipients: [ops@example.org, duty@example.org]
          approvalInbox:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "monitor").orElseThrow();

    assertEquals("Ottawa,Halifax", map.get("locations"));
    assertEquals("ops@example.org,duty@example.org", map.get("recipients"));
    assertEquals("", map.get("approvalInbox"));
  }

  @Test
  void nestedListIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad-list.yaml");
    Files.writeString(yaml, """
        monitor:
          locations:
            - [Ottawa, Halifax]
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "monitor"));
    assertTrue(ex.getMessage().contains("locations"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "monitor").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "monitor").orElseThrow());
  }

  @Test
  void sequenceRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - monitor:
            workers: 2
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "monitor"));
  }

  @Test
  void malformedYamlIsReportedWithPath() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "monitor: [unclosed\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "monitor"));
    assertTrue(ex.getMessage().contains("broken.yaml"));
  }
}
