package ca.gc.cra.fmtlog.application.port;

import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import java.io.IOException;

/**
 * <strong>What:</strong> Destination capability receiving rendered log lines.
 * <p><strong>Role:</strong> Port implemented by console adapters; selected when a logger is configured, never
 * dispatched per call.</p>
 * <p><strong>Thread-safety:</strong> A sink may be shared by several loggers and must serialize its own
 * writes: each {@link #write(RenderedLine)} lands as one uninterleaved line.</p>
 * <p><strong>Failure policy:</strong> Sinks never retry. A failed write throws and the line is lost for this
 * sink only.</p>
 *
 * @since 0.1.0
 */
public interface SinkPort {
  /**
   * Writes one line followed by the sink's line terminator.
   *
   * @param line rendered line with optional color hint
   * @throws IOException when the destination rejects the bytes
   */
  void write(RenderedLine line) throws IOException;

  /**
   * Forces buffered bytes to the destination.
   *
   * @throws IOException when the destination rejects the bytes
   */
  void flush() throws IOException;

  /**
   * Indicates whether the sink emits color escape sequences. Fixed for the sink's lifetime.
   *
   * @return {@code true} when color hints are honored
   */
  default boolean supportsColor() {
    return false;
  }

  /**
   * Returns a short description used to identify the sink in dispatch reports.
   *
   * @return description, e.g. {@code stdout}
   */
  default String describe() {
    return getClass().getSimpleName();
  }
}
