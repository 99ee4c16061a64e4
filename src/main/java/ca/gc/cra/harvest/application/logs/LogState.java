package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.QuerySample;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Envelope for exactly one dispatch attempt: collection time, the packaged file and extracted query samples.
 * <p>Created fresh per batch and released through try-with-resources so that the packaged file is deleted on
 * every dispatcher outcome.</p>
 *
 * @since 0.1.0
 */
public final class LogState implements AutoCloseable {
  private final Instant collectedAt;
  private final LogFile logFile;
  private final List<QuerySample> querySamples = new ArrayList<>();

  /**
   * Creates an envelope owning {@code logFile}.
   *
   * @param collectedAt batch collection instant
   * @param logFile packaged artifact; may be {@code null} for sample-only batches
   */
  public LogState(Instant collectedAt, LogFile logFile) {
    this.collectedAt = Objects.requireNonNull(collectedAt, "collectedAt");
    this.logFile = logFile;
  }

  public Instant collectedAt() {
    return collectedAt;
  }

  public Optional<LogFile> logFile() {
    return Optional.ofNullable(logFile);
  }

  public void addQuerySamples(Collection<QuerySample> samples) {
    querySamples.addAll(samples);
  }

  public List<QuerySample> querySamples() {
    return List.copyOf(querySamples);
  }

  /**
   * Reports whether analysis produced anything worth sending.
   *
   * @return {@code true} when there are no output lines and no samples
   */
  public boolean isEmpty() {
    boolean noLines = logFile == null || logFile.lines().isEmpty();
    return noLines && querySamples.isEmpty();
  }

  @Override
  public void close() {
    if (logFile != null) {
      logFile.close();
    }
  }
}
