package ca.gc.cra.harvest.domain.grant;

/**
 * Server-side feature switches delivered with a grant.
 *
 * @param logs whether log collection is enabled for this server
 * @param explain whether explain plan collection is enabled
 * @param statementResetFrequency number of full snapshots between statement statistics resets; {@code 0} disables resets
 * @param statementTimeoutMs statement timeout applied to collector queries in milliseconds; {@code 0} keeps the default
 * @since 0.1.0
 */
public record GrantFeatures(
    boolean logs,
    boolean explain,
    int statementResetFrequency,
    int statementTimeoutMs) {

  public GrantFeatures {
    if (statementResetFrequency < 0) {
      throw new IllegalArgumentException("statementResetFrequency must not be negative");
    }
    if (statementTimeoutMs < 0) {
      throw new IllegalArgumentException("statementTimeoutMs must not be negative");
    }
  }

  /**
   * Returns the feature set used when the control plane has not been consulted.
   *
   * @return features with log collection enabled and everything else off
   */
  public static GrantFeatures logsOnly() {
    return new GrantFeatures(true, false, 0, 0);
  }

  /**
   * Returns a feature set with every feature disabled.
   *
   * @return disabled features
   */
  public static GrantFeatures none() {
    return new GrantFeatures(false, false, 0, 0);
  }
}
