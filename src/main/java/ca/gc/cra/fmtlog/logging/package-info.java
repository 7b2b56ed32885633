/**
 * Diagnostic logging of the facility itself, routed through SLF4J and Logback.
 *
 * <p>These logs describe configuration and pattern problems; they never carry application log lines, which
 * go through {@link ca.gc.cra.fmtlog.application.port.SinkPort} sinks.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.logging;
