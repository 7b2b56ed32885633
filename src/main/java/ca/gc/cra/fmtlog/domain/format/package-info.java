/**
 * <strong>Purpose:</strong> Format template model: parsed templates, specifiers, tagged arguments, and the
 * per-value rendering rules.
 * <p><strong>Concurrency:</strong> All types are immutable or stateless.</p>
 * <p><strong>Errors:</strong> Every failure surfaces as {@link ca.gc.cra.fmtlog.domain.format.FormatException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.domain.format;
