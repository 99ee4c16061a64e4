package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits stitched lines into those old enough to finalize and those held for the next tick.
 * <p><strong>Why:</strong> Multi-part messages (an error followed by DETAIL, HINT or STATEMENT lines) may arrive
 * over several ticks; waiting out a quiescence window lets them accumulate before a line is shipped.</p>
 * <p><strong>Role:</strong> Second stage of the log pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @implNote Stitching only sees one tick's batch, so a fragment arriving after its parent was already dispatched
 * can never be attached. The window narrows that gap but does not close it.
 * @since 0.1.0
 */
public final class ReadinessWindow {
  /** Default quiescence window. */
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(3);

  private final long windowMillis;

  public ReadinessWindow() {
    this(DEFAULT_WINDOW);
  }

  public ReadinessWindow(Duration window) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative()) {
      throw new IllegalArgumentException("window must not be negative");
    }
    this.windowMillis = window.toMillis();
  }

  /**
   * Partitions lines by age relative to {@code nowMillis}.
   *
   * @param lines stitched lines in order
   * @param nowMillis current epoch milliseconds
   * @return ready lines (age strictly greater than the window) and too-fresh lines, both order-preserving
   */
  public Partition partition(List<LogLine> lines, long nowMillis) {
    Objects.requireNonNull(lines, "lines");
    List<LogLine> ready = new ArrayList<>();
    List<LogLine> tooFresh = new ArrayList<>();
    for (LogLine line : lines) {
      long age = nowMillis - line.collectedAt().toEpochMilli();
      if (age > windowMillis) {
        ready.add(line);
      } else {
        tooFresh.add(line);
      }
    }
    return new Partition(ready, tooFresh);
  }

  /**
   * Result of {@link #partition(List, long)}.
   *
   * @param ready lines to finalize in this tick
   * @param tooFresh lines to hand back for resubmission, unmodified
   */
  public record Partition(List<LogLine> ready, List<LogLine> tooFresh) {
    public Partition {
      ready = List.copyOf(ready);
      tooFresh = List.copyOf(tooFresh);
    }
  }
}
