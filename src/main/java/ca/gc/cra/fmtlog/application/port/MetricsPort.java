package ca.gc.cra.fmtlog.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the formatting and logging facility.
 * <p><strong>Why:</strong> Lets the engine and loggers expose instrumentation hooks (render calls, filtered
 * messages, sink failures) without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from every logging
 * thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the logging hot path and must be non-blocking.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier, e.g. {@code format.render.calls}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, units defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
