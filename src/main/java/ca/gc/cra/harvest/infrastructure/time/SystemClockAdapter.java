package ca.gc.cra.harvest.infrastructure.time;

import ca.gc.cra.harvest.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, the system UTC clock by default.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter reading from {@code clock}; fixed or offset clocks are useful in tests.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
