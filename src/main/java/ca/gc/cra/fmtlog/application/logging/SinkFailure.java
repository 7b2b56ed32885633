package ca.gc.cra.fmtlog.application.logging;

import java.util.Objects;

/**
 * A sink that rejected a write or flush.
 *
 * @param sink sink description, see {@link ca.gc.cra.fmtlog.application.port.SinkPort#describe()}
 * @param cause failure raised by the sink
 * @since 0.1.0
 */
public record SinkFailure(String sink, Exception cause) {

  public SinkFailure {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(cause, "cause");
  }
}
