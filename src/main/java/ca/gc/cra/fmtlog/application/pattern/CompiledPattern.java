package ca.gc.cra.fmtlog.application.pattern;

import ca.gc.cra.fmtlog.domain.format.FormatTemplate;

/**
 * A log line pattern that passed configuration-time validation.
 *
 * <p>Only {@link PatternRenderer#compile(String)} creates instances, so holding one proves the pattern renders.</p>
 *
 * @param source pattern text as configured
 * @param template parsed template
 * @param usesSource whether the pattern renders the call-site location
 * @since 0.1.0
 */
public record CompiledPattern(String source, FormatTemplate template, boolean usesSource) {

  @Override
  public String toString() {
    return source;
  }
}
