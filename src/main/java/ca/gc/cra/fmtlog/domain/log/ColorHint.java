package ca.gc.cra.fmtlog.domain.log;

import ca.gc.cra.fmtlog.domain.style.TextStyle;

/**
 * Range of a rendered line that a color-capable sink wraps with {@link #style()}.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 * @param style style to apply
 * @since 0.1.0
 */
public record ColorHint(int start, int end, TextStyle style) {
  /** Hint that colors nothing. */
  public static final ColorHint NONE = new ColorHint(0, 0, TextStyle.NONE);

  /**
   * Validates the range.
   */
  public ColorHint {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("invalid color range [" + start + ", " + end + ")");
    }
    style = style == null ? TextStyle.NONE : style;
  }

  /**
   * Indicates whether applying the hint changes anything.
   *
   * @return {@code true} for an empty range or plain style
   */
  public boolean isEmpty() {
    return start == end || style.isPlain();
  }
}
