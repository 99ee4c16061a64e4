package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.application.port.ClockPort;
import ca.gc.cra.harvest.application.port.LogAnalyzer;
import ca.gc.cra.harvest.application.port.LogAnalyzer.AnalysisResult;
import ca.gc.cra.harvest.application.port.LogStoreException;
import ca.gc.cra.harvest.application.port.LogStorePort;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one tick of log reassembly and dispatch for a server.
 * <p><strong>Why:</strong> Turns fragmented, interleaved log output into byte-addressed batches and hands back
 * exactly the lines the caller has to resubmit, so that transient failures never lose data.</p>
 * <p><strong>Role:</strong> Application service composing stitch, window, join, package, analyze and dispatch.</p>
 * <p><strong>Thread-safety:</strong> Not reentrant; invoke from one thread at a time. Takes no lock on the
 * {@link ServerContext}.</p>
 * <p><strong>Performance:</strong> The packaged store lives only for the duration of one call.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code server} for the call; increments
 * {@code logs.dispatch.<outcome>} and records {@code logs.batch.lines} and {@code logs.batch.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class LogPipeline {
  private static final Logger log = LoggerFactory.getLogger(LogPipeline.class);
  private static final String MDC_SERVER = "server";

  private final LogStitcher stitcher;
  private final ReadinessWindow window;
  private final BackendJoiner joiner;
  private final LogPackager packager;
  private final LogAnalyzer analyzer;
  private final LogStorePort store;
  private final LogDispatcher dispatcher;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a pipeline with the default stages and quiescence window.
   *
   * @param analyzer per-backend classifier
   * @param store packaging store allocator
   * @param dispatcher outcome selector
   * @param clock time source for the quiescence window
   * @param metrics metrics sink
   */
  public LogPipeline(
      LogAnalyzer analyzer, LogStorePort store, LogDispatcher dispatcher, ClockPort clock, MetricsPort metrics) {
    this(new LogStitcher(), new ReadinessWindow(), new BackendJoiner(), new LogPackager(),
        analyzer, store, dispatcher, clock, metrics);
  }

  /**
   * Creates a pipeline with explicit stages.
   *
   * @param stitcher fragment repair stage
   * @param window quiescence window
   * @param joiner continuation joining stage
   * @param packager packaging stage
   * @param analyzer per-backend classifier
   * @param store packaging store allocator
   * @param dispatcher outcome selector
   * @param clock time source for the quiescence window
   * @param metrics metrics sink
   */
  public LogPipeline(
      LogStitcher stitcher,
      ReadinessWindow window,
      BackendJoiner joiner,
      LogPackager packager,
      LogAnalyzer analyzer,
      LogStorePort store,
      LogDispatcher dispatcher,
      ClockPort clock,
      MetricsPort metrics) {
    this.stitcher = Objects.requireNonNull(stitcher, "stitcher");
    this.window = Objects.requireNonNull(window, "window");
    this.joiner = Objects.requireNonNull(joiner, "joiner");
    this.packager = Objects.requireNonNull(packager, "packager");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.store = Objects.requireNonNull(store, "store");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Processes one tick's lines.
   *
   * @param server server the lines were collected from
   * @param logLines backlog from the previous tick followed by newly observed lines
   * @param opts run-mode options
   * @return lines to resubmit next tick and the terminal outcome. Transient failures return {@code logLines}
   *     verbatim; every other outcome returns only the lines still inside the quiescence window
   */
  public PipelineResult process(ServerContext server, List<LogLine> logLines, CollectionOpts opts) {
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(logLines, "logLines");
    Objects.requireNonNull(opts, "opts");
    String previous = MDC.get(MDC_SERVER);
    MDC.put(MDC_SERVER, server.config().sectionName());
    try {
      PipelineResult result = run(server, logLines, opts);
      metrics.increment(result.outcome().metricKey());
      return result;
    } finally {
      if (previous == null) {
        MDC.remove(MDC_SERVER);
      } else {
        MDC.put(MDC_SERVER, previous);
      }
    }
  }

  private PipelineResult run(ServerContext server, List<LogLine> logLines, CollectionOpts opts) {
    long now = clock.nowMillis();
    List<LogLine> stitched = stitcher.stitch(logLines);
    ReadinessWindow.Partition partition = window.partition(stitched, now);
    if (partition.ready().isEmpty()) {
      return new PipelineResult(partition.tooFresh(), DispatchOutcome.NOT_READY);
    }

    List<LogLine> joined = joiner.join(partition.ready());

    LogFile logFile;
    try {
      logFile = store.allocate();
    } catch (LogStoreException ex) {
      log.error("Could not allocate log store; retrying {} line(s) next tick", logLines.size(), ex);
      return new PipelineResult(logLines, DispatchOutcome.STORE_UNAVAILABLE);
    }

    DispatchOutcome outcome;
    try (LogState state = new LogState(Instant.ofEpochMilli(now), logFile)) {
      LogPackager.PackagedBatch packaged = packager.pack(logFile, joined);
      if (packaged.degraded()) {
        log.warn("Packaged {} of {} ready line(s); remaining lines carry no valid byte range",
            packaged.linesWritten(), joined.size());
      }
      metrics.observe("logs.batch.lines", packaged.linesWritten());
      metrics.observe("logs.batch.bytes", packaged.bytesWritten());

      for (List<LogLine> backendLines : BackendJoiner.byBackend(packaged.lines()).values()) {
        AnalysisResult analysis = analyzer.analyze(backendLines);
        logFile.addLines(analysis.lines());
        state.addQuerySamples(analysis.samples());
      }
      outcome = dispatcher.dispatch(server, state, opts);
    }

    log.debug("Log batch finished with {} ({} ready, {} held back)",
        outcome, partition.ready().size(), partition.tooFresh().size());
    List<LogLine> backlog = outcome.fullRetry() ? logLines : partition.tooFresh();
    return new PipelineResult(backlog, outcome);
  }
}
