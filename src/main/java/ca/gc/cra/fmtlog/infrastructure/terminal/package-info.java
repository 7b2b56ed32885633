/**
 * Terminal capability detection for color output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.infrastructure.terminal;
