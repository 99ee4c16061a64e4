package ca.gc.cra.harvest.infrastructure.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.application.port.LogAnalyzer.AnalysisResult;
import ca.gc.cra.harvest.domain.log.LogClassification;
import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import ca.gc.cra.harvest.testutil.LogFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class BasicLogAnalyzerTest {
  private final BasicLogAnalyzer analyzer = new BasicLogAnalyzer();

  @Test
  void identifyMarkerCarriesSectionName() {
    LogLine line = LogFixtures.ready("statement: SELECT 'harvest-collector-identify: primary'", LogLevel.LOG, 5);

    LogLine out = analyzer.analyze(List.of(line)).lines().get(0);

    assertEquals(LogClassification.COLLECTOR_IDENTIFY, out.classification());
    assertEquals("primary", out.details().get(LogLine.CONFIG_SECTION_DETAIL));
  }

  @Test
  void durationReportYieldsSample() {
    LogLine line = LogFixtures.ready("duration: 12.5 ms  statement: SELECT * FROM orders", LogLevel.LOG, 6);

    AnalysisResult result = analyzer.analyze(List.of(line));

    assertEquals(LogClassification.STATEMENT_DURATION, result.lines().get(0).classification());
    assertEquals("12.5", result.lines().get(0).details().get("duration_ms"));
    QuerySample sample = result.samples().get(0);
    assertEquals("SELECT * FROM orders", sample.query());
    assertEquals(12.5, sample.runtimeMs());
    assertEquals(line.collectedAt(), sample.occurredAt());
  }

  @Test
  void executeReportsAreSampledToo() {
    LogLine line = LogFixtures.ready("duration: 3 ms  execute S_1: UPDATE t SET a = $1", LogLevel.LOG, 6);

    AnalysisResult result = analyzer.analyze(List.of(line));

    assertEquals("UPDATE t SET a = $1", result.samples().get(0).query());
  }

  @Test
  void syntaxErrorsAndConnectionsAreClassified() {
    AnalysisResult result = analyzer.analyze(List.of(
        LogFixtures.ready("syntax error at or near \"SELEC\"", LogLevel.ERROR, 7),
        LogFixtures.ready("connection authorized: user=app database=shop", LogLevel.LOG, 7)));

    assertEquals(LogClassification.SYNTAX_ERROR, result.lines().get(0).classification());
    assertEquals(LogClassification.CONNECTION_EVENT, result.lines().get(1).classification());
  }

  @Test
  void unmatchedLinesPassThroughInOrder() {
    LogLine first = LogFixtures.ready("checkpoint starting: time", LogLevel.LOG, 8);
    LogLine second = LogFixtures.ready("syntax error reported elsewhere", LogLevel.LOG, 8);

    AnalysisResult result = analyzer.analyze(List.of(first, second));

    assertSame(first, result.lines().get(0));
    assertSame(second, result.lines().get(1));
    assertTrue(result.samples().isEmpty());
  }
}
