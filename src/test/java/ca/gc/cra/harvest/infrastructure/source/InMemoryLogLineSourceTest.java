package ca.gc.cra.harvest.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.testutil.LogFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryLogLineSourceTest {
  private final InMemoryLogLineSource source = new InMemoryLogLineSource();

  @Test
  void pollDrainsInSubmissionOrder() {
    LogLine a = LogFixtures.ready("a", LogLevel.LOG, 1);
    LogLine b = LogFixtures.ready("b", LogLevel.LOG, 2);
    LogLine c = LogFixtures.fragment("c");
    source.submit(a);
    source.submitAll(List.of(b, c));

    assertEquals(3, source.pendingCount());
    assertEquals(List.of(a, b, c), source.poll());
    assertTrue(source.poll().isEmpty());
    assertEquals(0, source.pendingCount());
  }

  @Test
  void rejectsNullLines() {
    assertThrows(NullPointerException.class, () -> source.submit(null));
  }
}
