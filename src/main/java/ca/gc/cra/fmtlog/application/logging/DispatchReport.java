package ca.gc.cra.fmtlog.application.logging;

import java.util.List;

/**
 * Outcome of one logging call.
 *
 * <p>Sink failures never propagate out of {@link Logger#log}; callers that care inspect the report.</p>
 *
 * @param dispatched {@code false} when the severity filter dropped the message
 * @param sinkCount number of sinks the line was offered to
 * @param failures sinks that rejected the line, in dispatch order
 * @since 0.1.0
 */
public record DispatchReport(boolean dispatched, int sinkCount, List<SinkFailure> failures) {
  private static final DispatchReport FILTERED = new DispatchReport(false, 0, List.of());

  public DispatchReport {
    failures = List.copyOf(failures);
  }

  /**
   * Report for a message below the logger threshold.
   *
   * @return shared filtered report
   */
  public static DispatchReport filtered() {
    return FILTERED;
  }

  /**
   * Number of sinks that accepted the line.
   *
   * @return successful writes
   */
  public int delivered() {
    return sinkCount - failures.size();
  }

  /**
   * Indicates a dispatched message that every sink accepted.
   *
   * @return {@code true} when dispatched without failures
   */
  public boolean allSucceeded() {
    return dispatched && failures.isEmpty();
  }
}
