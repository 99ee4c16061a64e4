package ca.gc.cra.harvest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CollectorConfigTest {

  @TempDir Path tempDir;

  @Test
  void defaultsApplyWhenOnlySectionIsGiven() {
    CollectorConfig config = CollectorConfig.fromMap(Map.of("sectionName", "primary"));

    assertEquals("primary", config.server().sectionName());
    assertTrue(config.opts().collectLogs());
    assertTrue(config.opts().submitCollectedData());
    assertFalse(config.opts().testRun());
    assertFalse(config.opts().debugLogs());
    assertEquals(Duration.ofSeconds(1), config.pollInterval());
    assertEquals("none", config.metricsExporter());
    assertTrue(config.grantFile().isEmpty());
    assertTrue(config.tempDir().isEmpty());
  }

  @Test
  void logSettingsAreParsed() {
    CollectorConfig config = CollectorConfig.fromMap(Map.of(
        "sectionName", "primary",
        "logs.submit", "no",
        "logs.testRun", "on",
        "logs.localDir", tempDir.toString(),
        "logs.pollInterval", "250ms",
        "logs.grantFile", tempDir.resolve("grant.json").toString(),
        "metricsExporter", "OTLP",
        "verbose", "true"));

    assertFalse(config.opts().submitCollectedData());
    assertTrue(config.opts().testRun());
    assertEquals(tempDir, config.opts().localDir());
    assertEquals(Duration.ofMillis(250), config.pollInterval());
    assertEquals(tempDir.resolve("grant.json"), config.grantFile().orElseThrow());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.verbose());
  }

  @Test
  void sectionNameIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> CollectorConfig.fromMap(Map.of("apiKey", "abc")));
  }

  @Test
  void invalidBooleanIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CollectorConfig.fromMap(Map.of("sectionName", "primary", "logs.debug", "maybe")));
    assertEquals("logs.debug must be true or false (was 'maybe')", ex.getMessage());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> CollectorConfig.fromMap(Map.of("sectionName", "primary", "metricsExporter", "prometheus")));
  }

  @Test
  void durationsAcceptUnits() {
    assertEquals(Duration.ofMillis(500), CollectorConfig.parseDuration("d", "500ms"));
    assertEquals(Duration.ofSeconds(3), CollectorConfig.parseDuration("d", "3s"));
    assertEquals(Duration.ofMinutes(2), CollectorConfig.parseDuration("d", "2M"));
    assertEquals(Duration.ofMillis(750), CollectorConfig.parseDuration("d", "750"));
  }

  @Test
  void durationsMustBePositiveNumbers() {
    assertThrows(IllegalArgumentException.class, () -> CollectorConfig.parseDuration("d", "0s"));
    assertThrows(IllegalArgumentException.class, () -> CollectorConfig.parseDuration("d", "soon"));
  }

  @Test
  void loadReadsEveryServer() throws IOException {
    Path yaml = tempDir.resolve("harvest.yaml");
    Files.writeString(yaml, """
        servers:
          primary:
            apiKey: key-1
          replica:
            logs:
              enabled: false
        """);

    List<CollectorConfig> configs = CollectorConfig.load(yaml);

    assertEquals(2, configs.size());
    assertTrue(configs.get(0).opts().collectLogs());
    assertFalse(configs.get(1).opts().collectLogs());
    assertFalse(configs.get(0).toString().contains("key-1"));
  }

  @Test
  void loadRejectsMissingFile() {
    assertThrows(IllegalArgumentException.class, () -> CollectorConfig.load(tempDir.resolve("absent.yaml")));
  }
}
