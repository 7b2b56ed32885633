/**
 * <strong>Purpose:</strong> Ports connecting the logging core to clocks, sinks, and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.fmtlog.application.port.MetricsPort} carries every
 * instrumentation hook of the facility.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.application.port;
