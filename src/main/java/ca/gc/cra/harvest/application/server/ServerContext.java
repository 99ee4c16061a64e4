package ca.gc.cra.harvest.application.server;

import ca.gc.cra.harvest.config.ServerConfig;
import ca.gc.cra.harvest.domain.grant.Grant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Long-lived state of one monitored server, shared by the subsystems that collect from it.
 * <p><strong>Why:</strong> Log dispatch and full snapshots run on independent schedules against the same server;
 * the shared mutable fields are guarded by one explicit lock owned by this context.</p>
 * <p><strong>Role:</strong> Application-level context passed explicitly to pipelines and ports.</p>
 * <p><strong>Thread-safety:</strong> {@link #config()} is immutable. {@link #snapshotGrant()} may be read without
 * the lock; {@link #updateSnapshotGrant(Grant)} requires {@link #stateLock()} to be held.</p>
 *
 * @implNote The log pipeline only reads {@link #config()} and never acquires {@link #stateLock()}.
 * @since 0.1.0
 */
public final class ServerContext {
  private final ServerConfig config;
  private final ReentrantLock stateLock = new ReentrantLock();
  private volatile Grant snapshotGrant = Grant.denied();

  public ServerContext(ServerConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public ServerConfig config() {
    return config;
  }

  /**
   * Returns the lock guarding mutable server state shared across subsystems.
   *
   * @return state lock
   */
  public ReentrantLock stateLock() {
    return stateLock;
  }

  /**
   * Returns the grant most recently obtained by the full snapshot subsystem.
   *
   * @return snapshot grant; denied until a snapshot has run
   */
  public Grant snapshotGrant() {
    return snapshotGrant;
  }

  /**
   * Replaces the snapshot grant.
   *
   * @param grant new grant; must not be {@code null}
   * @throws IllegalStateException if the caller does not hold {@link #stateLock()}
   */
  public void updateSnapshotGrant(Grant grant) {
    if (!stateLock.isHeldByCurrentThread()) {
      throw new IllegalStateException("stateLock must be held to update the snapshot grant");
    }
    this.snapshotGrant = Objects.requireNonNull(grant, "grant");
  }

  @Override
  public String toString() {
    return "ServerContext{" + config.sectionName() + '}';
  }
}
