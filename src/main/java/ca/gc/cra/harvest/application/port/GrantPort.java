package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.grant.Grant;

/**
 * <strong>What:</strong> Port requesting a log upload grant for one dispatch attempt.
 * <p><strong>Why:</strong> The control plane decides per attempt whether logs are accepted and where they go;
 * the dispatcher must not cache its answer.</p>
 * <p><strong>Role:</strong> Domain port called by the log dispatcher after debug and test modes are ruled out.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface GrantPort {
  /**
   * Requests a fresh grant.
   *
   * @param server server whose logs are being dispatched
   * @param opts run-mode options
   * @return grant; {@link Grant#valid()} is {@code false} when log collection is declined
   * @throws GrantRequestException if the grant could not be obtained
   */
  Grant fetchLogsGrant(ServerContext server, CollectionOpts opts) throws GrantRequestException;
}
