package ca.gc.cra.harvest.application.logs;

import static ca.gc.cra.harvest.testutil.LogFixtures.NOW;
import static ca.gc.cra.harvest.testutil.LogFixtures.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReadinessWindowTest {
  private final ReadinessWindow window = new ReadinessWindow();
  private final long now = NOW.toEpochMilli();

  @Test
  void lineExactlyAtWindowIsTooFresh() {
    LogLine boundary = line("boundary", LogLevel.LOG, 1, Duration.ofSeconds(3));

    ReadinessWindow.Partition partition = window.partition(List.of(boundary), now);

    assertTrue(partition.ready().isEmpty());
    assertSame(boundary, partition.tooFresh().get(0));
  }

  @Test
  void lineJustPastWindowIsReady() {
    LogLine old = line("old", LogLevel.LOG, 1, Duration.ofMillis(3001));

    ReadinessWindow.Partition partition = window.partition(List.of(old), now);

    assertEquals(List.of(old), partition.ready());
    assertTrue(partition.tooFresh().isEmpty());
  }

  @Test
  void partitionPreservesOrderOnBothSides() {
    LogLine r1 = line("r1", LogLevel.LOG, 1, Duration.ofSeconds(10));
    LogLine f1 = line("f1", LogLevel.LOG, 1, Duration.ofSeconds(1));
    LogLine r2 = line("r2", LogLevel.LOG, 2, Duration.ofSeconds(5));
    LogLine f2 = line("f2", LogLevel.LOG, 2, Duration.ZERO);

    ReadinessWindow.Partition partition = window.partition(List.of(r1, f1, r2, f2), now);

    assertEquals(List.of(r1, r2), partition.ready());
    assertEquals(List.of(f1, f2), partition.tooFresh());
  }

  @Test
  void customWindowIsHonoured() {
    ReadinessWindow zero = new ReadinessWindow(Duration.ZERO);
    LogLine past = line("past", LogLevel.LOG, 1, Duration.ofMillis(1));
    LogLine present = line("present", LogLevel.LOG, 1, Duration.ZERO);

    ReadinessWindow.Partition partition = zero.partition(List.of(past, present), now);

    assertEquals(List.of(past), partition.ready());
    assertEquals(List.of(present), partition.tooFresh());
  }

  @Test
  void negativeWindowIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ReadinessWindow(Duration.ofSeconds(-1)));
  }
}
