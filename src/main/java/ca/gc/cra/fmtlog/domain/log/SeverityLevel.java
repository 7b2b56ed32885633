package ca.gc.cra.fmtlog.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Totally ordered log severities, {@link #TRACE} lowest and {@link #OFF} highest.
 * <p><strong>Role:</strong> Severity filter shared by loggers and configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SeverityLevel {
  TRACE("TRACE"),
  DEBUG("DEBUG"),
  INFO("INFO"),
  WARN("WARN"),
  ERROR("ERROR"),
  CRITICAL("CRIT"),
  /** Threshold that suppresses everything; never used as the level of a message. */
  OFF("OFF");

  /** Width of {@link #paddedCode()}. */
  public static final int CODE_WIDTH = 5;

  private final String shortCode;
  private final String paddedCode;

  SeverityLevel(String shortCode) {
    this.shortCode = shortCode;
    this.paddedCode = shortCode + " ".repeat(CODE_WIDTH - shortCode.length());
  }

  /**
   * Severity filter: a message at {@code level} passes a logger thresholded at {@code threshold} iff
   * {@code level >= threshold}.
   *
   * @param level severity of the message
   * @param threshold minimum severity the logger dispatches
   * @return {@code true} when the message must be rendered and dispatched
   */
  public static boolean passes(SeverityLevel level, SeverityLevel threshold) {
    return level.compareTo(threshold) >= 0;
  }

  /**
   * Returns the upper-case short code, e.g. {@code WARN} or {@code CRIT}.
   *
   * @return short code
   */
  public String shortCode() {
    return shortCode;
  }

  /**
   * Returns the short code right-padded to {@link #CODE_WIDTH} characters.
   *
   * @return fixed-width code
   */
  public String paddedCode() {
    return paddedCode;
  }

  /**
   * Parses a level name case-insensitively; accepts {@code warning}, {@code err}, {@code crit} and
   * {@code fatal} as aliases.
   *
   * @param raw level name
   * @return matching level
   * @throws IllegalArgumentException when {@code raw} names no level
   */
  public static SeverityLevel parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "trace" -> TRACE;
      case "debug" -> DEBUG;
      case "info" -> INFO;
      case "warn", "warning" -> WARN;
      case "error", "err" -> ERROR;
      case "critical", "crit", "fatal" -> CRITICAL;
      case "off" -> OFF;
      default -> throw new IllegalArgumentException("unknown level: " + raw);
    };
  }
}
