package ca.gc.cra.fmtlog.application.port;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Port supplying the wall-clock timestamp stamped on each rendered log line.
 * <p><strong>Why:</strong> Lets tests pin {@code {%time}} output to a deterministic instant.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every logging thread reads the
 * clock.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.fmtlog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock time; subject to system clock adjustments
   */
  Instant now();

  /**
   * Default {@link ClockPort} backed by {@link Instant#now()}.
   */
  ClockPort SYSTEM = Instant::now;

  /**
   * Returns a clock frozen at {@code instant}.
   *
   * @param instant instant every call returns
   * @return fixed clock
   */
  static ClockPort fixed(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    return () -> instant;
  }
}
