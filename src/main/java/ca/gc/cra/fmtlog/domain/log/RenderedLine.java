package ca.gc.cra.fmtlog.domain.log;

import ca.gc.cra.fmtlog.domain.style.AnsiEscapes;
import java.util.Objects;

/**
 * A fully rendered log line, without terminator, plus the color hint produced by the pattern renderer.
 *
 * @param text line content
 * @param colorHint range to colorize on capable sinks
 * @since 0.1.0
 */
public record RenderedLine(String text, ColorHint colorHint) {

  /**
   * Validates that the hint lies within the text.
   */
  public RenderedLine {
    Objects.requireNonNull(text, "text");
    colorHint = colorHint == null ? ColorHint.NONE : colorHint;
    if (colorHint.end() > text.length()) {
      throw new IllegalArgumentException("color range exceeds line length");
    }
  }

  /**
   * Creates a line without color hint.
   *
   * @param text line content
   * @return rendered line
   */
  public static RenderedLine plain(String text) {
    return new RenderedLine(text, ColorHint.NONE);
  }

  /**
   * Returns the text with the hinted range wrapped in its style's escape sequences.
   *
   * @return colorized text
   */
  public String colorized() {
    if (colorHint.isEmpty()) {
      return text;
    }
    return text.substring(0, colorHint.start())
        + colorHint.style().wrap(text.substring(colorHint.start(), colorHint.end()))
        + text.substring(colorHint.end());
  }

  /**
   * Returns the text with every embedded escape sequence removed.
   *
   * @return visible text only
   */
  public String stripped() {
    return AnsiEscapes.strip(text);
  }
}
