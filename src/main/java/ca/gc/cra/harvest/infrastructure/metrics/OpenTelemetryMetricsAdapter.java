package ca.gc.cra.harvest.infrastructure.metrics;

import ca.gc.cra.harvest.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that records HARVEST counters and histograms through OpenTelemetry.
 * <p>Instruments are created lazily per metric key and cached. Keys ending in {@code .bytes} are recorded with
 * unit {@code By}; other histograms are unitless.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting through the named exporter.
   *
   * @param exporter {@code otlp} or {@code none}
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::counter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::histogram).record(value);
  }

  boolean isExporting() {
    return !bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter counter(String key) {
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("HARVEST counter " + key)
        .build();
  }

  private LongHistogram histogram(String key) {
    return meter.histogramBuilder(key)
        .ofLongs()
        .setUnit(key.endsWith(".bytes") ? "By" : "1")
        .setDescription("HARVEST observation " + key)
        .build();
  }
}
