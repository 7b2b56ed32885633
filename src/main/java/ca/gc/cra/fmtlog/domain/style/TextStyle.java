package ca.gc.cra.fmtlog.domain.style;

import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Color and emphasis selection applied to already-rendered text.
 *
 * <p>Wrapping is a pure text transform: the visible characters are never altered, only surrounded by an SGR
 * sequence and a reset. Destinations without color support strip the sequences again through
 * {@link AnsiEscapes#strip(String)}.</p>
 *
 * @param foreground foreground color; {@code null} keeps the terminal default
 * @param background background color; {@code null} keeps the terminal default
 * @param emphasis emphasis attributes; never {@code null}
 * @since 0.1.0
 */
public record TextStyle(Color foreground, Color background, Set<Emphasis> emphasis) {
  /** Style that leaves text untouched. */
  public static final TextStyle NONE = new TextStyle(null, null, Set.of());

  /**
   * Normalizes the emphasis set into an immutable copy.
   */
  public TextStyle {
    emphasis = emphasis == null || emphasis.isEmpty() ? Set.of() : Set.copyOf(emphasis);
  }

  /**
   * Creates a style with only a foreground color.
   *
   * @param color foreground color
   * @return new style
   */
  public static TextStyle fg(Color color) {
    return new TextStyle(color, null, Set.of());
  }

  /**
   * Creates a style with only a background color.
   *
   * @param color background color
   * @return new style
   */
  public static TextStyle bg(Color color) {
    return new TextStyle(null, color, Set.of());
  }

  /**
   * Creates a style carrying only emphasis attributes.
   *
   * @param first first attribute
   * @param rest additional attributes
   * @return new style
   */
  public static TextStyle of(Emphasis first, Emphasis... rest) {
    return new TextStyle(null, null, EnumSet.of(first, rest));
  }

  /**
   * Returns a copy with the given foreground color.
   *
   * @param color foreground color
   * @return new style
   */
  public TextStyle withForeground(Color color) {
    return new TextStyle(color, background, emphasis);
  }

  /**
   * Returns a copy with the given background color.
   *
   * @param color background color
   * @return new style
   */
  public TextStyle withBackground(Color color) {
    return new TextStyle(foreground, color, emphasis);
  }

  /**
   * Returns a copy with an additional emphasis attribute, mirroring {@code fg(red) | bold}.
   *
   * @param attribute attribute to add
   * @return new style
   */
  public TextStyle with(Emphasis attribute) {
    Set<Emphasis> merged = emphasis.isEmpty() ? EnumSet.noneOf(Emphasis.class) : EnumSet.copyOf(emphasis);
    merged.add(attribute);
    return new TextStyle(foreground, background, merged);
  }

  /**
   * Indicates whether the style changes nothing.
   *
   * @return {@code true} when no color or emphasis is selected
   */
  public boolean isPlain() {
    return foreground == null && background == null && emphasis.isEmpty();
  }

  /**
   * Returns the SGR sequence that switches this style on.
   *
   * @return opening escape sequence; empty for a plain style
   */
  public String openSequence() {
    if (isPlain()) {
      return "";
    }
    StringJoiner codes = new StringJoiner(";", AnsiEscapes.ESC + "[", "m");
    for (Emphasis attribute : Emphasis.values()) {
      if (emphasis.contains(attribute)) {
        codes.add(Integer.toString(attribute.code()));
      }
    }
    if (foreground != null) {
      codes.add(Integer.toString(foreground.foregroundCode()));
    }
    if (background != null) {
      codes.add(Integer.toString(background.backgroundCode()));
    }
    return codes.toString();
  }

  /**
   * Surrounds {@code text} with this style's opening sequence and a reset.
   *
   * @param text already-rendered text
   * @return wrapped text, or {@code text} unchanged for a plain style
   */
  public String wrap(String text) {
    if (isPlain()) {
      return text;
    }
    return openSequence() + text + AnsiEscapes.RESET;
  }
}
