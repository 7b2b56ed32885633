package ca.gc.cra.fmtlog.domain.style;

import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Helpers for ANSI escape sequences embedded in rendered text.
 * <p><strong>Why:</strong> Colorized content must degrade to the exact same visible text on destinations without
 * color support.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class AnsiEscapes {
  /** Escape character introducing every control sequence. */
  public static final char ESC = '\u001B';
  /** Sequence resetting all attributes. */
  public static final String RESET = ESC + "[0m";

  // CSI sequences (ESC [ params intermediates final) plus two-byte ESC sequences.
  private static final Pattern SEQUENCE =
      Pattern.compile("\u001B(?:\\[[0-?]*[ -/]*[@-~]|[@-Z\\\\-_])");

  private AnsiEscapes() {
    // Utility
  }

  /**
   * Removes every ANSI escape sequence from {@code text}.
   *
   * @param text candidate text; {@code null} yields {@code null}
   * @return text with escape sequences removed; the input instance when none are present
   */
  public static String strip(String text) {
    if (text == null || text.indexOf(ESC) < 0) {
      return text;
    }
    return SEQUENCE.matcher(text).replaceAll("");
  }

  /**
   * Indicates whether {@code text} contains an escape character.
   *
   * @param text candidate text; may be {@code null}
   * @return {@code true} when at least one escape character is present
   */
  public static boolean containsEscape(String text) {
    return text != null && text.indexOf(ESC) >= 0;
  }
}
