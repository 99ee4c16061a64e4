package ca.gc.cra.harvest.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogLineTest {
  private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

  @Test
  void fragmentNeedsUnknownLevelAndNoBackend() {
    assertTrue(LogLine.observed("tail", LogLevel.UNKNOWN, 0, AT).isFragment());
    assertFalse(LogLine.observed("tail", LogLevel.UNKNOWN, 42, AT).isFragment());
    assertFalse(LogLine.observed("tail", LogLevel.LOG, 0, AT).isFragment());
  }

  @Test
  void nullOptionalsNormalize() {
    LogLine line = new LogLine("x", null, 1, AT, 0, 0, 0, null, null);

    assertEquals(LogLevel.UNKNOWN, line.level());
    assertEquals(LogClassification.UNKNOWN, line.classification());
    assertTrue(line.details().isEmpty());
  }

  @Test
  void contentIsRequired() {
    assertThrows(NullPointerException.class, () -> LogLine.observed(null, LogLevel.LOG, 1, AT));
  }

  @Test
  void contentLengthCountsUtf8Bytes() {
    assertEquals(8, LogLine.observed("café ü", LogLevel.LOG, 1, AT).contentLength());
  }

  @Test
  void detailsAreCopied() {
    Map<String, String> details = new HashMap<>();
    details.put("duration_ms", "1.5");
    LogLine line = LogLine.observed("x", LogLevel.LOG, 1, AT)
        .withClassification(LogClassification.STATEMENT_DURATION, details);

    details.clear();

    assertEquals("1.5", line.details().get("duration_ms"));
  }

  @Test
  void clearedByteRangeIsReportedAsUnwritten() {
    LogLine written = LogLine.observed("x", LogLevel.LOG, 1, AT).withByteRange(10, 10, 10);
    LogLine cleared = written.withoutByteRange();

    assertTrue(written.hasByteRange());
    assertFalse(cleared.hasByteRange());
    assertEquals(LogLine.NO_OFFSET, cleared.byteStart());
    assertEquals(LogLine.NO_OFFSET, cleared.byteContentStart());
    assertEquals(LogLine.NO_OFFSET, cleared.byteEnd());
    assertEquals("x", cleared.content());
  }
}
