/**
 * Terminal colors, emphasis, and ANSI escape handling used by styled arguments and colorized sinks.
 */
package ca.gc.cra.fmtlog.domain.style;
