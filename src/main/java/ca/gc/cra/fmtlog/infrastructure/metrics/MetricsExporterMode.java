package ca.gc.cra.fmtlog.infrastructure.metrics;

import java.util.Locale;

/**
 * Metric export destinations selectable through {@code metrics.exporter}.
 *
 * @since 0.1.0
 */
public enum MetricsExporterMode {
  /** Metrics are discarded. */
  NONE,
  /** Metrics are periodically written through the OpenTelemetry logging exporter. */
  LOGGING;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code none} or {@code logging}, case-insensitive; blank selects {@link #NONE}
   * @return exporter mode
   * @throws IllegalArgumentException for any other value
   */
  public static MetricsExporterMode from(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> NONE;
      case "logging" -> LOGGING;
      default -> throw new IllegalArgumentException("unknown metrics exporter: " + raw);
    };
  }
}
