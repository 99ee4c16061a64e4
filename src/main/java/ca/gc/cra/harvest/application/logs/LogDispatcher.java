package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.application.port.GrantPort;
import ca.gc.cra.harvest.application.port.GrantRequestException;
import ca.gc.cra.harvest.application.port.LogUploadPort;
import ca.gc.cra.harvest.application.port.UploadException;
import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.CollectionOpts;
import ca.gc.cra.harvest.domain.grant.Grant;
import ca.gc.cra.harvest.domain.log.LogClassification;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Chooses the terminal outcome for a packaged batch and performs its side effects.
 * <p><strong>Why:</strong> Each outcome carries its own retry policy; keeping the branch order in one place makes
 * the at-least-once contract auditable.</p>
 * <p><strong>Role:</strong> Final stage of the log pipeline. Branches are checked in this order: nothing to send,
 * debug print, test run, grant request, grant denial, upload.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the collection thread.</p>
 * <p><strong>Observability:</strong> Transient failures log at ERROR with the cause; grant denial logs at DEBUG.</p>
 *
 * @implNote The dispatcher never closes the {@link LogState}; the caller releases it on every path.
 * @since 0.1.0
 */
public final class LogDispatcher {
  private static final Logger log = LoggerFactory.getLogger(LogDispatcher.class);

  private final GrantPort grants;
  private final LogUploadPort uploader;
  private final TestRunSignal testRunSignal;
  private final LogDebugPrinter debugPrinter;

  /**
   * Creates a dispatcher.
   *
   * @param grants grant source consulted once per dispatch attempt
   * @param uploader delivery target for valid grants
   * @param testRunSignal signal raised when a test run finds its identify marker
   * @param debugPrinter printer used in debug mode
   */
  public LogDispatcher(
      GrantPort grants, LogUploadPort uploader, TestRunSignal testRunSignal, LogDebugPrinter debugPrinter) {
    this.grants = Objects.requireNonNull(grants, "grants");
    this.uploader = Objects.requireNonNull(uploader, "uploader");
    this.testRunSignal = Objects.requireNonNull(testRunSignal, "testRunSignal");
    this.debugPrinter = Objects.requireNonNull(debugPrinter, "debugPrinter");
  }

  /**
   * Dispatches one batch.
   *
   * @param server server the batch belongs to
   * @param state packaged and analyzed batch; still open
   * @param opts run-mode options
   * @return terminal outcome; never {@link DispatchOutcome#NOT_READY} or {@link DispatchOutcome#STORE_UNAVAILABLE}
   */
  public DispatchOutcome dispatch(ServerContext server, LogState state, CollectionOpts opts) {
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(opts, "opts");

    if (state.isEmpty()) {
      return DispatchOutcome.NOTHING_TO_SEND;
    }

    if (opts.debugLogs()) {
      try {
        debugPrinter.print(server.config().sectionName(), state);
      } catch (IOException ex) {
        log.error("Could not read back packaged log content for debug output", ex);
      }
      return DispatchOutcome.DEBUG_PRINTED;
    }

    if (opts.testRun()) {
      if (containsIdentifyMarker(state, server.config().sectionName())) {
        if (testRunSignal.offer()) {
          log.info("Found collector identify marker for [{}] in server log", server.config().sectionName());
        } else {
          log.debug("Test run success already signalled; skipping");
        }
      }
      return DispatchOutcome.TEST_RUN;
    }

    Grant grant;
    try {
      grant = grants.fetchLogsGrant(server, opts);
    } catch (GrantRequestException ex) {
      log.error("Could not get log grant", ex);
      return DispatchOutcome.GRANT_FAILED;
    }

    if (!grant.valid()) {
      log.debug("Log collection disabled by the control plane, skipping batch");
      return DispatchOutcome.GRANT_DENIED;
    }

    try {
      uploader.upload(server, grant, state);
    } catch (UploadException ex) {
      log.error("Could not upload log batch", ex);
      return DispatchOutcome.UPLOAD_FAILED;
    }
    return DispatchOutcome.SENT;
  }

  private static boolean containsIdentifyMarker(LogState state, String sectionName) {
    List<LogLine> lines = state.logFile().map(LogFile::lines).orElse(List.of());
    for (LogLine line : lines) {
      if (line.classification() == LogClassification.COLLECTOR_IDENTIFY
          && sectionName.equals(line.details().get(LogLine.CONFIG_SECTION_DETAIL))) {
        return true;
      }
    }
    return false;
  }
}
