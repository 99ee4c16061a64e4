package ca.gc.cra.harvest.application.logs;

import java.util.Locale;

/**
 * Terminal outcome of one log pipeline invocation.
 *
 * @since 0.1.0
 */
public enum DispatchOutcome {
  /** No line was older than the quiescence window. */
  NOT_READY(false),
  /** The packaging store could not be allocated. */
  STORE_UNAVAILABLE(true),
  /** Analysis produced neither output lines nor query samples. */
  NOTHING_TO_SEND(false),
  /** Debug mode printed the batch instead of sending it. */
  DEBUG_PRINTED(false),
  /** Test mode scanned the batch for the collector identify marker. */
  TEST_RUN(false),
  /** The grant request failed. */
  GRANT_FAILED(true),
  /** The control plane declined log collection. */
  GRANT_DENIED(false),
  /** The upload failed. */
  UPLOAD_FAILED(true),
  /** The batch was delivered. */
  SENT(false);

  private final boolean fullRetry;

  DispatchOutcome(boolean fullRetry) {
    this.fullRetry = fullRetry;
  }

  /**
   * Reports whether the whole pipeline input must be replayed on the next tick.
   *
   * @return {@code true} for transient failures
   */
  public boolean fullRetry() {
    return fullRetry;
  }

  /**
   * Returns the counter incremented for this outcome.
   *
   * @return metric key such as {@code logs.dispatch.sent}
   */
  public String metricKey() {
    return "logs.dispatch." + name().toLowerCase(Locale.ROOT);
  }
}
