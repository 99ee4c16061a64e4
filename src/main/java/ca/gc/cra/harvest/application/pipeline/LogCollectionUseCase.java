package ca.gc.cra.harvest.application.pipeline;

import ca.gc.cra.harvest.application.logs.DispatchOutcome;
import ca.gc.cra.harvest.application.logs.LogPipeline;
import ca.gc.cra.harvest.application.logs.PipelineResult;
import ca.gc.cra.harvest.application.port.LogLineSource;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Polls a server's log source on a fixed delay and feeds each tick through the {@link LogPipeline}.
 * <p>The use case owns the backlog between ticks: lines still inside the quiescence window, or a whole batch
 * replayed after a transient failure, are prepended to the next tick's newly observed lines. The backlog lives in
 * memory only and is lost on restart.</p>
 * <p>Ticks run on one dedicated thread (named <code>harvest-logs-&lt;section&gt;</code>) so pipeline invocations
 * for a server never overlap. A tick that fails with an unexpected runtime error keeps its whole input as backlog
 * and the loop continues.</p>
 *
 * @since 0.1.0
 */
public final class LogCollectionUseCase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LogCollectionUseCase.class);
  private static final String MDC_TICK = "tick";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final ServerContext server;
  private final LogLineSource source;
  private final LogPipeline pipeline;
  private final CollectionOpts opts;
  private final MetricsPort metrics;
  private final Duration pollInterval;
  private final AtomicLong tickCounter = new AtomicLong();

  private List<LogLine> backlog = List.of();
  private ScheduledExecutorService scheduler;

  /**
   * Creates the collection loop.
   *
   * @param server server whose logs are collected
   * @param source source of newly observed lines
   * @param pipeline pipeline invoked once per tick
   * @param opts run-mode options
   * @param metrics metrics sink; records {@code logs.backlog.size} after each tick
   * @param pollInterval delay between the end of one tick and the start of the next
   */
  public LogCollectionUseCase(
      ServerContext server,
      LogLineSource source,
      LogPipeline pipeline,
      CollectionOpts opts,
      MetricsPort metrics,
      Duration pollInterval) {
    this.server = Objects.requireNonNull(server, "server");
    this.source = Objects.requireNonNull(source, "source");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.opts = Objects.requireNonNull(opts, "opts");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  /**
   * Starts polling on the collection thread.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("log collection already started for " + server);
    }
    String section = server.config().sectionName();
    scheduler = ExecutorFactories.newCollectionScheduler("harvest-logs-" + section,
        (thread, ex) -> log.error("Log collection thread {} terminated unexpectedly", thread.getName(), ex));
    long delayMillis = pollInterval.toMillis();
    scheduler.scheduleWithFixedDelay(this::tickSafely, delayMillis, delayMillis, TimeUnit.MILLISECONDS);
    log.info("Started log collection for [{}] every {} ms", section, delayMillis);
  }

  /**
   * Runs one collection tick: poll, prepend backlog, process, keep the returned backlog.
   *
   * @return pipeline result of this tick
   * @throws IOException if the source cannot be polled; the backlog is left unchanged
   */
  public synchronized PipelineResult tick() throws IOException {
    long tickId = tickCounter.incrementAndGet();
    MDC.put(MDC_TICK, Long.toString(tickId));
    try {
      List<LogLine> observed = source.poll();
      List<LogLine> pending = new ArrayList<>(backlog.size() + observed.size());
      pending.addAll(backlog);
      pending.addAll(observed);
      // Held until the pipeline returns so a failing tick loses nothing.
      backlog = List.copyOf(pending);

      PipelineResult result = pipeline.process(server, backlog, opts);
      backlog = result.backlog();
      metrics.observe("logs.backlog.size", backlog.size());
      if (result.outcome() == DispatchOutcome.NOT_READY) {
        log.trace("Tick {}: {} line(s) waiting for the quiescence window", tickId, backlog.size());
      } else {
        log.debug("Tick {}: {} with {} line(s) carried over", tickId, result.outcome(), backlog.size());
      }
      return result;
    } finally {
      MDC.remove(MDC_TICK);
    }
  }

  /**
   * Returns the lines that will be resubmitted on the next tick.
   *
   * @return backlog snapshot
   */
  public synchronized List<LogLine> backlog() {
    return backlog;
  }

  @Override
  public void close() {
    ScheduledExecutorService running;
    synchronized (this) {
      running = scheduler;
      scheduler = null;
    }
    if (running == null) {
      return;
    }
    // Not holding the monitor here; an in-flight tick needs it to finish.
    running.shutdown();
    try {
      if (!running.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Log collection for [{}] did not stop within {}", server.config().sectionName(), SHUTDOWN_TIMEOUT);
        running.shutdownNow();
      }
    } catch (InterruptedException ex) {
      running.shutdownNow();
      Thread.currentThread().interrupt();
    }
    List<LogLine> remaining = backlog();
    if (!remaining.isEmpty()) {
      log.info("Stopped log collection for [{}] with {} undelivered line(s)",
          server.config().sectionName(), remaining.size());
    }
  }

  private void tickSafely() {
    try {
      tick();
    } catch (IOException ex) {
      log.error("Failed to read new log lines for [{}]", server.config().sectionName(), ex);
    } catch (RuntimeException ex) {
      log.error("Log collection tick failed for [{}]; keeping {} line(s) for the next tick",
          server.config().sectionName(), backlog().size(), ex);
    }
  }
}
