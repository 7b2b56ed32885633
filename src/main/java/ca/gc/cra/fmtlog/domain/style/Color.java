package ca.gc.cra.fmtlog.domain.style;

/**
 * Terminal palette colors with their SGR foreground codes.
 *
 * @since 0.1.0
 */
public enum Color {
  BLACK(30),
  RED(31),
  GREEN(32),
  YELLOW(33),
  BLUE(34),
  MAGENTA(35),
  CYAN(36),
  WHITE(37),
  BRIGHT_BLACK(90),
  BRIGHT_RED(91),
  BRIGHT_GREEN(92),
  BRIGHT_YELLOW(93),
  BRIGHT_BLUE(94),
  BRIGHT_MAGENTA(95),
  BRIGHT_CYAN(96),
  BRIGHT_WHITE(97);

  private final int foregroundCode;

  Color(int foregroundCode) {
    this.foregroundCode = foregroundCode;
  }

  /**
   * Returns the SGR parameter selecting this color as foreground.
   *
   * @return SGR foreground code
   */
  public int foregroundCode() {
    return foregroundCode;
  }

  /**
   * Returns the SGR parameter selecting this color as background.
   *
   * @return SGR background code (foreground code + 10)
   */
  public int backgroundCode() {
    return foregroundCode + 10;
  }
}
