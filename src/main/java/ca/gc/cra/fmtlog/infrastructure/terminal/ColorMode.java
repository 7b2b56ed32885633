package ca.gc.cra.fmtlog.infrastructure.terminal;

import java.util.Locale;

/**
 * Color policy of the color console sinks.
 *
 * @since 0.1.0
 */
public enum ColorMode {
  /** Color when {@link TerminalColorDetector} reports a capable terminal. */
  AUTO,
  /** Always emit escape sequences. */
  ALWAYS,
  /** Never emit escape sequences. */
  NEVER;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code auto}, {@code always} or {@code never}, case-insensitive; blank selects {@link #AUTO}
   * @return color mode
   * @throws IllegalArgumentException for any other value
   */
  public static ColorMode from(String raw) {
    if (raw == null || raw.isBlank()) {
      return AUTO;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "auto" -> AUTO;
      case "always", "true" -> ALWAYS;
      case "never", "false" -> NEVER;
      default -> throw new IllegalArgumentException("unknown color mode: " + raw);
    };
  }

  /**
   * Decides whether color is enabled.
   *
   * @param detector terminal probe consulted in {@link #AUTO} mode
   * @return {@code true} when sinks should emit escape sequences
   */
  public boolean enabled(TerminalColorDetector detector) {
    return switch (this) {
      case ALWAYS -> true;
      case NEVER -> false;
      case AUTO -> detector.supportsColor();
    };
  }
}
