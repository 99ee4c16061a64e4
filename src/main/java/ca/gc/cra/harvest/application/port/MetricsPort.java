package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Port abstracting HARVEST metrics emission.
 * <p><strong>Why:</strong> Lets the log pipeline count dispatch outcomes and record batch sizes without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code logs.dispatch.sent},
 * {@code logs.batch.bytes}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g. {@code logs.dispatch.upload_failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g. bytes, line counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates; useful for tests. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
