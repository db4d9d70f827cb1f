package ca.gc.cra.tether.config;

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
  void loadMergesCommonAndNamedSections() throws IOException {
    Path yaml = tempDir.resolve("tether.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        pipeline:
          pipelineName: device-7
          shutdownTimeoutMs: 2500
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "pipeline");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("device-7", map.get("pipelineName"));
    assertEquals("2500", map.get("shutdownTimeoutMs"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        pipeline:
          retry:
            maxAttempts: 4
            initialBackoffMs: 250
          registration:
            pollIntervalMs: 1500
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "pipeline").orElseThrow();
    assertEquals("4", map.get("retry.maxAttempts"));
    assertEquals("250", map.get("retry.initialBackoffMs"));
    assertEquals("1500", map.get("registration.pollIntervalMs"));
  }

  @Test
  void namedSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          shutdownTimeoutMs: 10000
        Pipeline:
          shutdownTimeoutMs: 500
        """);

    assertEquals("500", YamlConfigLoader.load(yaml, "pipeline").orElseThrow().get("shutdownTimeoutMs"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "pipeline").orElseThrow());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result =
        YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "pipeline");

    assertFalse(result.isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - pipeline:
            pipelineName: device
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "pipeline"));
  }

  @Test
  void listsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        pipeline:
          pipelineName: [a, b]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "pipeline"));
  }
}
