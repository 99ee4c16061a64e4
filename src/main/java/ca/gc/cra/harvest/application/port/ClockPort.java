package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the log pipeline.
 * <p><strong>Why:</strong> The quiescence window compares line observation times against "now"; tests inject a
 * fixed clock to make readiness deterministic.</p>
 * <p><strong>Role:</strong> Domain port consumed by application use cases.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.harvest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
