package ca.gc.cra.harvest.application.logs;

import static ca.gc.cra.harvest.testutil.LogFixtures.ready;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BackendJoinerTest {
  private final BackendJoiner joiner = new BackendJoiner();

  @Test
  void interleavedBackendsAreNeverMerged() {
    List<LogLine> ready = List.of(
        ready("A1", LogLevel.LOG, 10),
        ready("B1", LogLevel.LOG, 20),
        ready("-a", LogLevel.UNKNOWN, 10),
        ready("-b", LogLevel.UNKNOWN, 20));

    List<LogLine> joined = joiner.join(ready);

    assertEquals(List.of("A1-a", "B1-b"), contents(joined));
  }

  @Test
  void joinedLinesKeepArrivalOrderAcrossBackends() {
    List<LogLine> joined = joiner.join(List.of(
        ready("A1", LogLevel.LOG, 1),
        ready("B1", LogLevel.LOG, 2),
        ready("A2", LogLevel.LOG, 1),
        ready("+a2", LogLevel.UNKNOWN, 1)));

    assertEquals(List.of("A1", "B1", "A2+a2"), contents(joined));
  }

  @Test
  void continuationIsAppendedWithoutSeparator() {
    List<LogLine> joined = joiner.join(List.of(
        ready("SELECT *", LogLevel.STATEMENT, 5),
        ready(" FROM t", LogLevel.UNKNOWN, 5)));

    assertEquals(List.of("SELECT * FROM t"), contents(joined));
    assertEquals(LogLevel.STATEMENT, joined.get(0).level());
  }

  @Test
  void continuationAttachesToNearestPrecedingLineOfSameBackend() {
    List<LogLine> joined = joiner.join(List.of(
        ready("ERROR x", LogLevel.ERROR, 9),
        ready("DETAIL y", LogLevel.DETAIL, 9),
        ready("+z", LogLevel.UNKNOWN, 9)));

    assertEquals(List.of("ERROR x", "DETAIL y+z"), contents(joined));
  }

  @Test
  void unknownLinesBeforeAnyClassifiedLineOfTheirBackendAreDropped() {
    List<LogLine> joined = joiner.join(List.of(
        ready("orphan", LogLevel.UNKNOWN, 5),
        ready(" more", LogLevel.UNKNOWN, 5),
        ready("other backend", LogLevel.LOG, 6),
        ready("LOG first", LogLevel.LOG, 5),
        ready(" kept", LogLevel.UNKNOWN, 5)));

    assertEquals(List.of("other backend", "LOG first kept"), contents(joined));
  }

  @Test
  void onlyUnknownLinesJoinToNothing() {
    assertTrue(joiner.join(List.of(
        ready("orphan", LogLevel.UNKNOWN, 5),
        ready(" more", LogLevel.UNKNOWN, 5))).isEmpty());
  }

  @Test
  void byBackendGroupsInFirstAppearanceOrder() {
    Map<Integer, List<LogLine>> groups = BackendJoiner.byBackend(List.of(
        ready("B1", LogLevel.LOG, 20),
        ready("A1", LogLevel.LOG, 10),
        ready("B2", LogLevel.LOG, 20)));

    assertEquals(List.of(20, 10), List.copyOf(groups.keySet()));
    assertEquals(List.of("B1", "B2"), contents(groups.get(20)));
    assertEquals(List.of("A1"), contents(groups.get(10)));
  }

  private static List<String> contents(List<LogLine> lines) {
    return lines.stream().map(LogLine::content).toList();
  }
}
