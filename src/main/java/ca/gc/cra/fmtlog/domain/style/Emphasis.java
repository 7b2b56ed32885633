package ca.gc.cra.fmtlog.domain.style;

/**
 * Text emphasis attributes with their SGR codes.
 *
 * @since 0.1.0
 */
public enum Emphasis {
  BOLD(1),
  FAINT(2),
  ITALIC(3),
  UNDERLINE(4),
  BLINK(5),
  REVERSE(7),
  STRIKETHROUGH(9);

  private final int code;

  Emphasis(int code) {
    this.code = code;
  }

  /**
   * Returns the SGR parameter for this attribute.
   *
   * @return SGR code
   */
  public int code() {
    return code;
  }
}
