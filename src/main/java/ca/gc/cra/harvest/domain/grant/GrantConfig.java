package ca.gc.cra.harvest.domain.grant;

import java.util.Objects;

/**
 * Control-plane configuration attached to a grant.
 *
 * @param serverId identifier the backend assigned to this database server; empty when unknown
 * @param errorReportingDsn endpoint the agent may report its own failures to; empty when disabled
 * @param features server-side feature switches
 * @since 0.1.0
 */
public record GrantConfig(String serverId, String errorReportingDsn, GrantFeatures features) {

  public GrantConfig {
    serverId = Objects.requireNonNullElse(serverId, "");
    errorReportingDsn = Objects.requireNonNullElse(errorReportingDsn, "");
    features = Objects.requireNonNullElse(features, GrantFeatures.none());
  }

  public static GrantConfig empty() {
    return new GrantConfig("", "", GrantFeatures.none());
  }
}
