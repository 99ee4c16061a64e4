package ca.gc.cra.harvest.application.logs;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One-shot notification raised when a test run sees its own collector identify marker in the server log.
 * <p>Backed by a capacity-one queue. {@link #offer()} never blocks: once a signal is pending, further offers are
 * discarded until an observer consumes it.</p>
 *
 * @since 0.1.0
 */
public final class TestRunSignal {
  private final BlockingQueue<Boolean> slot = new ArrayBlockingQueue<>(1);

  /**
   * Raises the signal without waiting for a receiver.
   *
   * @return {@code true} if the signal was stored, {@code false} if one was already pending
   */
  public boolean offer() {
    return slot.offer(Boolean.TRUE);
  }

  /**
   * Consumes a pending signal if present.
   *
   * @return {@code true} if a signal was pending
   */
  public boolean poll() {
    return slot.poll() != null;
  }

  /**
   * Waits up to {@code timeout} for the signal.
   *
   * @param timeout maximum wait
   * @return {@code true} if the signal arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return slot.poll(timeout.toMillis(), TimeUnit.MILLISECONDS) != null;
  }
}
