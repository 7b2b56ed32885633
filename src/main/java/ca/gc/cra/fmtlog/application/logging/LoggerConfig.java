package ca.gc.cra.fmtlog.application.logging;

import ca.gc.cra.fmtlog.application.pattern.PatternRenderer;
import ca.gc.cra.fmtlog.application.port.SinkPort;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.validation.Strings;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a logger: name, threshold, line pattern, and ordered sinks.
 *
 * @param name registry key; letters, digits, dot, underscore, or hyphen
 * @param threshold minimum level dispatched
 * @param pattern line pattern; {@code null} selects {@link PatternRenderer#DEFAULT_PATTERN}
 * @param sinks destinations in dispatch order; may be empty
 * @since 0.1.0
 */
public record LoggerConfig(String name, SeverityLevel threshold, String pattern, List<SinkPort> sinks) {

  /**
   * Validates the name and copies the sink list.
   */
  public LoggerConfig {
    name = Strings.sanitizeLoggerName(name);
    Objects.requireNonNull(threshold, "threshold");
    pattern = pattern == null ? PatternRenderer.DEFAULT_PATTERN : pattern;
    sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
  }

  /**
   * Creates a config at {@link SeverityLevel#INFO} with the default pattern.
   *
   * @param name logger name
   * @param sinks destinations in dispatch order
   * @return config
   */
  public static LoggerConfig of(String name, SinkPort... sinks) {
    return new LoggerConfig(name, SeverityLevel.INFO, null, List.of(sinks));
  }

  public LoggerConfig withThreshold(SeverityLevel newThreshold) {
    return new LoggerConfig(name, newThreshold, pattern, sinks);
  }

  public LoggerConfig withPattern(String newPattern) {
    return new LoggerConfig(name, threshold, newPattern, sinks);
  }

  public LoggerConfig withSinks(List<SinkPort> newSinks) {
    return new LoggerConfig(name, threshold, pattern, newSinks);
  }
}
