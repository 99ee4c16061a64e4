package ca.gc.cra.harvest.infrastructure.source;

import ca.gc.cra.harvest.application.port.LogLineSource;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory {@link LogLineSource} fed by acquisition threads, embedders and tests.
 *
 * @since 0.1.0
 */
public final class InMemoryLogLineSource implements LogLineSource {
  private final ConcurrentLinkedQueue<LogLine> pending = new ConcurrentLinkedQueue<>();

  /**
   * Queues one observed line.
   *
   * @param line observed line; must not be {@code null}
   */
  public void submit(LogLine line) {
    pending.add(Objects.requireNonNull(line, "line"));
  }

  /**
   * Queues observed lines in order.
   *
   * @param lines observed lines
   */
  public void submitAll(Collection<LogLine> lines) {
    lines.forEach(this::submit);
  }

  @Override
  public List<LogLine> poll() {
    List<LogLine> drained = new ArrayList<>();
    LogLine line;
    while ((line = pending.poll()) != null) {
      drained.add(line);
    }
    return drained;
  }

  /**
   * Returns the number of lines waiting for the next poll.
   *
   * @return pending line count
   */
  public int pendingCount() {
    return pending.size();
  }
}
