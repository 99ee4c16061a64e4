package ca.gc.cra.harvest.infrastructure.grant;

import ca.gc.cra.harvest.application.port.GrantPort;
import ca.gc.cra.harvest.application.port.GrantRequestException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.grant.Grant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GrantPort} that only consults the control plane when collected data is actually submitted.
 * <p>With submission disabled it answers with a local grant for {@link CollectionOpts#localDir()}, so offline runs
 * exercise the full dispatch path without network access.</p>
 *
 * @since 0.1.0
 */
public final class SubmissionAwareGrantAdapter implements GrantPort {
  private static final Logger log = LoggerFactory.getLogger(SubmissionAwareGrantAdapter.class);

  private final GrantPort remote;

  /**
   * Creates the adapter.
   *
   * @param remote control-plane grant source used when data is submitted
   */
  public SubmissionAwareGrantAdapter(GrantPort remote) {
    this.remote = Objects.requireNonNull(remote, "remote");
  }

  @Override
  public Grant fetchLogsGrant(ServerContext server, CollectionOpts opts) throws GrantRequestException {
    if (!opts.submitCollectedData()) {
      log.debug("Submission disabled; granting local upload to {}", opts.localDir());
      return Grant.local(opts.localDir());
    }
    Grant grant = remote.fetchLogsGrant(server, opts);
    if (grant == null) {
      throw new GrantRequestException("Grant source returned no grant for " + server.config().sectionName());
    }
    return grant;
  }
}
