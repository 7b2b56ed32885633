/**
 * Format engine rendering {@link ca.gc.cra.fmtlog.domain.format.FormatTemplate templates} against tagged
 * arguments.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.application.format;
