/**
 * CLI entry points: the {@code fmtlog} dispatcher and its {@code demo}, {@code basic}, and {@code render}
 * subcommands.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures diagnostics, wires the facility
 * through {@link ca.gc.cra.fmtlog.config.CompositionRoot}, and maps failures to {@link ca.gc.cra.fmtlog.api.ExitCode}.</p>
 */
package ca.gc.cra.fmtlog.api;
