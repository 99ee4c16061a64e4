package ca.gc.cra.harvest.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable run-mode options consumed by the log dispatcher.
 * <p><strong>Why:</strong> Selects between debug printing, test runs and normal submission without the pipeline
 * owning any process configuration.</p>
 * <p><strong>Role:</strong> Configuration record supplied by the surrounding process.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @param collectLogs whether log collection runs at all
 * @param collectExplain whether explain plans may be collected for query samples
 * @param submitCollectedData {@code false} keeps data local by granting uploads into {@code localDir}
 * @param testRun test mode: look for the collector identify marker and never upload
 * @param debugLogs debug mode: print the packaged batch instead of sending it
 * @param localDir directory used for local grants when data is not submitted
 * @since 0.1.0
 */
public record CollectionOpts(
    boolean collectLogs,
    boolean collectExplain,
    boolean submitCollectedData,
    boolean testRun,
    boolean debugLogs,
    Path localDir) {

  public CollectionOpts {
    localDir = Objects.requireNonNullElse(localDir, Path.of("."));
  }

  /**
   * Returns the options for a normal submitting run.
   *
   * @return default options
   */
  public static CollectionOpts defaults() {
    return new CollectionOpts(true, false, true, false, false, Path.of("."));
  }

  public CollectionOpts withTestRun(boolean enabled) {
    return new CollectionOpts(collectLogs, collectExplain, submitCollectedData, enabled, debugLogs, localDir);
  }

  public CollectionOpts withDebugLogs(boolean enabled) {
    return new CollectionOpts(collectLogs, collectExplain, submitCollectedData, testRun, enabled, localDir);
  }

  public CollectionOpts withSubmission(boolean submit, Path directory) {
    return new CollectionOpts(collectLogs, collectExplain, submit, testRun, debugLogs, directory);
  }
}
