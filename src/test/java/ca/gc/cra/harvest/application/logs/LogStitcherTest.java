package ca.gc.cra.harvest.application.logs;

import static ca.gc.cra.harvest.testutil.LogFixtures.fragment;
import static ca.gc.cra.harvest.testutil.LogFixtures.ready;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogStitcherTest {
  private final LogStitcher stitcher = new LogStitcher();

  @Test
  void fragmentIsAppendedWithSingleSpace() {
    LogLine error = ready("syntax error", LogLevel.ERROR, 100);

    List<LogLine> stitched = stitcher.stitch(List.of(error, fragment("at character 5")));

    assertEquals(1, stitched.size());
    LogLine merged = stitched.get(0);
    assertEquals("syntax error at character 5", merged.content());
    assertEquals(LogLevel.ERROR, merged.level());
    assertEquals(100, merged.backendPid());
    assertEquals(error.collectedAt(), merged.collectedAt());
  }

  @Test
  void consecutiveFragmentsAttachToSameParent() {
    List<LogLine> stitched = stitcher.stitch(List.of(
        ready("a", LogLevel.LOG, 1), fragment("b"), fragment("c"), ready("d", LogLevel.LOG, 2)));

    assertEquals(List.of("a b c", "d"), stitched.stream().map(LogLine::content).toList());
  }

  @Test
  void leadingFragmentIsDropped() {
    List<LogLine> stitched = stitcher.stitch(List.of(fragment("orphan"), ready("first", LogLevel.INFO, 7)));

    assertEquals(1, stitched.size());
    assertEquals("first", stitched.get(0).content());
  }

  @Test
  void unknownLevelWithBackendIsNotAFragment() {
    LogLine continuation = ready("part two", LogLevel.UNKNOWN, 42);

    List<LogLine> stitched = stitcher.stitch(List.of(ready("part one", LogLevel.LOG, 42), continuation));

    assertEquals(2, stitched.size());
    assertEquals(continuation, stitched.get(1));
  }

  @Test
  void emptyInputYieldsEmptyOutput() {
    assertTrue(stitcher.stitch(List.of()).isEmpty());
  }
}
