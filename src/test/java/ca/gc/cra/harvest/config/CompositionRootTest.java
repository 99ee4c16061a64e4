package ca.gc.cra.harvest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.application.logs.DispatchOutcome;
import ca.gc.cra.harvest.application.logs.PipelineResult;
import ca.gc.cra.harvest.application.pipeline.LogCollectionUseCase;
import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.harvest.infrastructure.source.InMemoryLogLineSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @BeforeEach
  void createSpool() throws IOException {
    Files.createDirectories(tempDir.resolve("spool"));
  }

  @Test
  void offlineRunWritesBatchToLocalDirectory() throws IOException {
    Path out = tempDir.resolve("out");
    CompositionRoot root = new CompositionRoot(config(Map.of("logs.submit", "false", "logs.localDir", out.toString())));
    InMemoryLogLineSource source = new InMemoryLogLineSource();
    source.submit(settled("ERROR:  syntax error at or near \"SELEC\"", LogLevel.ERROR, 4242));
    source.submit(settled("STATEMENT:  SELEC 1", LogLevel.UNKNOWN, 0));

    try (LogCollectionUseCase useCase = root.logCollectionUseCase(source)) {
      PipelineResult result = useCase.tick();

      assertEquals(DispatchOutcome.SENT, result.outcome());
      assertTrue(result.backlog().isEmpty());
    }

    List<Path> written = list(out);
    assertEquals(2, written.size());
    Path log = written.stream().filter(p -> p.toString().endsWith(".log")).findFirst().orElseThrow();
    Path manifest = written.stream().filter(p -> p.toString().endsWith(".json")).findFirst().orElseThrow();
    assertEquals("ERROR:  syntax error at or near \"SELEC\" STATEMENT:  SELEC 1",
        Files.readString(log, StandardCharsets.UTF_8));
    assertTrue(Files.readString(manifest).contains("\"server\" : \"primary\""));
    assertTrue(list(tempDir.resolve("spool")).isEmpty());
  }

  @Test
  void grantFileDrivesSubmittingRuns() throws IOException {
    Path out = tempDir.resolve("granted");
    Path grantFile = tempDir.resolve("grant.json");
    Files.writeString(grantFile, "{\"valid\": true, \"local_dir\": \"" + out.toString().replace("\\", "\\\\") + "\"}");
    CompositionRoot root = new CompositionRoot(config(Map.of("logs.grantFile", grantFile.toString())));
    InMemoryLogLineSource source = new InMemoryLogLineSource();
    source.submit(settled("LOG:  checkpoint complete", LogLevel.LOG, 77));

    try (LogCollectionUseCase useCase = root.logCollectionUseCase(source)) {
      assertEquals(DispatchOutcome.SENT, useCase.tick().outcome());
    }
    assertEquals(2, list(out).size());
  }

  @Test
  void submittingRunWithoutGrantSourceRetriesEverything() throws IOException {
    CompositionRoot root = new CompositionRoot(config(Map.of()));
    InMemoryLogLineSource source = new InMemoryLogLineSource();
    LogLine line = settled("LOG:  checkpoint complete", LogLevel.LOG, 77);
    source.submit(line);

    try (LogCollectionUseCase useCase = root.logCollectionUseCase(source)) {
      PipelineResult result = useCase.tick();

      assertEquals(DispatchOutcome.GRANT_FAILED, result.outcome());
      assertEquals(List.of(line), useCase.backlog());
    }
  }

  @Test
  void disabledCollectionCannotBuildUseCase() {
    CompositionRoot root = new CompositionRoot(config(Map.of("logs.enabled", "false")));

    assertThrows(IllegalStateException.class, () -> root.logCollectionUseCase(new InMemoryLogLineSource()));
  }

  @Test
  void metricsAdapterIsSharedAndNoOpByDefault() {
    CompositionRoot root = new CompositionRoot(config(Map.of()));

    assertTrue(root.metrics() instanceof NoOpMetricsAdapter);
    assertSame(root.metrics(), root.metrics());
  }

  private CollectorConfig config(Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>();
    values.put("sectionName", "primary");
    values.put("logs.tempDir", tempDir.resolve("spool").toString());
    values.putAll(overrides);
    return CollectorConfig.fromMap(values);
  }

  private static LogLine settled(String content, LogLevel level, int pid) {
    return LogLine.observed(content, level, pid, Instant.now().minusSeconds(10));
  }

  private static List<Path> list(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files.toList();
    }
  }
}
