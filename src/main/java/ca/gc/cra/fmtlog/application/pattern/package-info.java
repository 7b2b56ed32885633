/**
 * Log line patterns: validation at configuration time, line composition, and level coloring.
 *
 * <p>Patterns reference only the reserved fields {@code {%time}}, {@code {%level}}, {@code {%name}},
 * {@code {%message}} and {@code {%source}}; every field accepts the usual format specifiers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.application.pattern;
