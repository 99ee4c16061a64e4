package ca.gc.cra.harvest.application.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.harvest.domain.grant.Grant;
import ca.gc.cra.harvest.testutil.LogFixtures;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ServerContextTest {
  private final ServerContext server = LogFixtures.server("primary");

  @Test
  void snapshotGrantStartsDenied() {
    assertFalse(server.snapshotGrant().valid());
  }

  @Test
  void updateRequiresStateLock() {
    assertThrows(IllegalStateException.class, () -> server.updateSnapshotGrant(Grant.local(Path.of("/tmp"))));
  }

  @Test
  void updateUnderLockIsVisible() {
    Grant grant = Grant.local(Path.of("/tmp/harvest"));
    server.stateLock().lock();
    try {
      server.updateSnapshotGrant(grant);
    } finally {
      server.stateLock().unlock();
    }

    assertEquals(grant, server.snapshotGrant());
  }

  @Test
  void toStringNamesSectionOnly() {
    assertEquals("ServerContext{primary}", server.toString());
  }
}
