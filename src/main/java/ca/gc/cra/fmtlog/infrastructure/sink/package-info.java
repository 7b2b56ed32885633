/**
 * Console sinks. Sinks sharing a writer serialize on it, so concurrent loggers never interleave within a
 * line.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.infrastructure.sink;
