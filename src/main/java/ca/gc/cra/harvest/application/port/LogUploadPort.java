package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.application.logs.LogState;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.domain.grant.Grant;

/**
 * <strong>What:</strong> Port delivering a packaged log batch to the target named by a grant.
 * <p><strong>Why:</strong> Decouples packaging and retry policy from transport.</p>
 * <p><strong>Role:</strong> Domain port implemented by local-directory and object-store adapters.</p>
 * <p><strong>Thread-safety:</strong> Called from the single collection thread.</p>
 *
 * @implNote Implementations must not retry internally; the dispatcher replays the whole batch on failure.
 * @since 0.1.0
 */
public interface LogUploadPort {
  /**
   * Uploads the batch.
   *
   * @param server server the batch belongs to
   * @param grant grant obtained for this attempt; always valid
   * @param state batch envelope holding the packaged file, its line metadata and query samples
   * @throws UploadException if delivery failed
   */
  void upload(ServerContext server, Grant grant, LogState state) throws UploadException;
}
