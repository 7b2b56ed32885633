/**
 * Adapters implementing the application ports: console sinks, terminal detection, clocks, and
 * OpenTelemetry metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.infrastructure;
