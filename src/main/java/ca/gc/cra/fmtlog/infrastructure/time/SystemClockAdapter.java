package ca.gc.cra.fmtlog.infrastructure.time;

import ca.gc.cra.fmtlog.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link java.time.Clock}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates an adapter over the UTC system clock.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over {@code clock}.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current instant.
   *
   * @return current instant with the resolution of the underlying clock
   */
  @Override
  public Instant now() {
    return clock.instant();
  }
}
