package ca.gc.cra.harvest.infrastructure.metrics;

import ca.gc.cra.harvest.application.port.MetricsPort;

/**
 * Metrics adapter used when no exporter is configured; every update is dropped.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
