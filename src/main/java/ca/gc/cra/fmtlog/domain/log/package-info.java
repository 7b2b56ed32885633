/**
 * <strong>Purpose:</strong> Log record vocabulary: severities, call-site locations, and rendered lines with their
 * color hints.
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.domain.log;
