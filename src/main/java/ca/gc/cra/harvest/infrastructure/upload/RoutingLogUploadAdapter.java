package ca.gc.cra.harvest.infrastructure.upload;

import ca.gc.cra.harvest.application.logs.LogState;
import ca.gc.cra.harvest.application.port.LogUploadPort;
import ca.gc.cra.harvest.application.port.UploadException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.domain.grant.Grant;
import java.util.Objects;

/**
 * {@link LogUploadPort} choosing the delivery target from the grant.
 * <p>A local directory takes precedence over an object store endpoint. A grant naming neither is an upload
 * failure, so the batch is replayed once the control plane issues a usable grant.</p>
 *
 * @since 0.1.0
 */
public final class RoutingLogUploadAdapter implements LogUploadPort {
  private final LogUploadPort local;
  private final LogUploadPort objectStore;

  /**
   * Creates the router.
   *
   * @param local adapter for local directory grants
   * @param objectStore adapter for object store grants
   */
  public RoutingLogUploadAdapter(LogUploadPort local, LogUploadPort objectStore) {
    this.local = Objects.requireNonNull(local, "local");
    this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
  }

  @Override
  public void upload(ServerContext server, Grant grant, LogState state) throws UploadException {
    if (grant.localDirectory().isPresent()) {
      local.upload(server, grant, state);
    } else if (grant.targetsObjectStore()) {
      objectStore.upload(server, grant, state);
    } else {
      throw new UploadException("Grant names neither a local directory nor an object store endpoint");
    }
  }
}
