/**
 * OpenTelemetry implementation of {@link ca.gc.cra.fmtlog.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.infrastructure.metrics;
