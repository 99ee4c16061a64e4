package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.application.logs.LogDebugPrinter;
import ca.gc.cra.harvest.application.logs.LogDispatcher;
import ca.gc.cra.harvest.application.logs.LogPipeline;
import ca.gc.cra.harvest.application.logs.TestRunSignal;
import ca.gc.cra.harvest.application.pipeline.LogCollectionUseCase;
import ca.gc.cra.harvest.application.port.ClockPort;
import ca.gc.cra.harvest.application.port.GrantPort;
import ca.gc.cra.harvest.application.port.GrantRequestException;
import ca.gc.cra.harvest.application.port.LogAnalyzer;
import ca.gc.cra.harvest.application.port.LogLineSource;
import ca.gc.cra.harvest.application.port.LogStorePort;
import ca.gc.cra.harvest.application.port.LogUploadPort;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.UploadException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.infrastructure.analysis.BasicLogAnalyzer;
import ca.gc.cra.harvest.infrastructure.grant.FileGrantAdapter;
import ca.gc.cra.harvest.infrastructure.grant.SubmissionAwareGrantAdapter;
import ca.gc.cra.harvest.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.harvest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.harvest.infrastructure.storage.TempFileLogStoreAdapter;
import ca.gc.cra.harvest.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.harvest.infrastructure.upload.LocalDirectoryUploadAdapter;
import ca.gc.cra.harvest.infrastructure.upload.RoutingLogUploadAdapter;
import ca.gc.cra.harvest.logging.LoggingConfigurator;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires one server's log collection from its {@link CollectorConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection (grant source, upload routing, metrics exporter) in one place
 * so the pipeline only sees ports.</p>
 * <p><strong>Role:</strong> Composition root for the acquire, reassemble and dispatch stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the grant source: local grants when submission is off, the grant file when configured, otherwise the
 *   supplied control-plane port.</li>
 *   <li>Route uploads to the local directory adapter or the supplied object store port.</li>
 *   <li>Expose shared adapters such as metrics, clock and the test-run signal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the startup thread; shared adapters are created once.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.harvest.application.pipeline.LogCollectionUseCase
 */
public final class CompositionRoot {
  private static final GrantPort NO_CONTROL_PLANE = (server, opts) -> {
    throw new GrantRequestException("No grant source configured for [" + server.config().sectionName()
        + "]; set logs.grantFile or disable logs.submit");
  };
  private static final LogUploadPort NO_OBJECT_STORE = (server, grant, state) -> {
    throw new UploadException("No object store uploader configured for [" + server.config().sectionName() + "]");
  };

  private final CollectorConfig config;
  private final GrantPort controlPlaneGrants;
  private final LogUploadPort objectStoreUploads;
  private final ServerContext server;
  private final TestRunSignal testRunSignal = new TestRunSignal();
  private MetricsPort metrics;

  /**
   * Creates a root without control-plane transports; suitable for offline, grant-file and test runs.
   *
   * @param config server configuration
   */
  public CompositionRoot(CollectorConfig config) {
    this(config, NO_CONTROL_PLANE, NO_OBJECT_STORE);
  }

  /**
   * Creates a root with control-plane transports.
   *
   * @param config server configuration
   * @param controlPlaneGrants remote grant source
   * @param objectStoreUploads object store uploader
   */
  public CompositionRoot(CollectorConfig config, GrantPort controlPlaneGrants, LogUploadPort objectStoreUploads) {
    this.config = Objects.requireNonNull(config, "config");
    this.controlPlaneGrants = Objects.requireNonNull(controlPlaneGrants, "controlPlaneGrants");
    this.objectStoreUploads = Objects.requireNonNull(objectStoreUploads, "objectStoreUploads");
    this.server = new ServerContext(config.server());
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  public ServerContext server() {
    return server;
  }

  public TestRunSignal testRunSignal() {
    return testRunSignal;
  }

  /**
   * Returns the shared metrics adapter, created on first use.
   *
   * @return OpenTelemetry adapter, or a no-op adapter when the exporter is {@code none}
   */
  public synchronized MetricsPort metrics() {
    if (metrics == null) {
      metrics = "none".equals(config.metricsExporter())
          ? new NoOpMetricsAdapter()
          : new OpenTelemetryMetricsAdapter(config.metricsExporter());
    }
    return metrics;
  }

  public ClockPort clock() {
    return new SystemClockAdapter();
  }

  public GrantPort grantPort() {
    GrantPort remote = config.grantFile()
        .<GrantPort>map(FileGrantAdapter::new)
        .orElse(controlPlaneGrants);
    return new SubmissionAwareGrantAdapter(remote);
  }

  public LogUploadPort uploadPort() {
    return new RoutingLogUploadAdapter(new LocalDirectoryUploadAdapter(), objectStoreUploads);
  }

  public LogStorePort logStore() {
    return new TempFileLogStoreAdapter(config.tempDir().orElse(null));
  }

  public LogAnalyzer analyzer() {
    return new BasicLogAnalyzer();
  }

  /**
   * Builds the per-tick pipeline.
   *
   * @return pipeline wired to this root's adapters
   */
  public LogPipeline logPipeline() {
    LogDispatcher dispatcher = new LogDispatcher(grantPort(), uploadPort(), testRunSignal, new LogDebugPrinter());
    return new LogPipeline(analyzer(), logStore(), dispatcher, clock(), metrics());
  }

  /**
   * Builds the scheduled collection loop; call {@link LogCollectionUseCase#start()} to begin polling.
   *
   * @param source source of newly observed lines
   * @return collection use case
   * @throws IllegalStateException if log collection is disabled in configuration
   */
  public LogCollectionUseCase logCollectionUseCase(LogLineSource source) {
    if (!config.opts().collectLogs()) {
      throw new IllegalStateException("Log collection is disabled for [" + config.server().sectionName() + "]");
    }
    return new LogCollectionUseCase(server, source, logPipeline(), config.opts(), metrics(), config.pollInterval());
  }
}
