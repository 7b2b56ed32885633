package ca.gc.cra.fmtlog.application.pattern;

import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.domain.style.Color;
import ca.gc.cra.fmtlog.domain.style.Emphasis;
import ca.gc.cra.fmtlog.domain.style.TextStyle;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Level-to-style mapping used to color the {@code {%level}} field on capable sinks.
 *
 * @since 0.1.0
 */
public final class LevelColorPolicy {
  private final Map<SeverityLevel, TextStyle> styles;

  private LevelColorPolicy(Map<SeverityLevel, TextStyle> styles) {
    this.styles = styles;
  }

  /**
   * Returns the console palette: trace white, debug cyan, info green, warn bold yellow, error bold red,
   * critical bold white on red.
   *
   * @return default policy
   */
  public static LevelColorPolicy defaults() {
    Map<SeverityLevel, TextStyle> styles = new EnumMap<>(SeverityLevel.class);
    styles.put(SeverityLevel.TRACE, TextStyle.fg(Color.WHITE));
    styles.put(SeverityLevel.DEBUG, TextStyle.fg(Color.CYAN));
    styles.put(SeverityLevel.INFO, TextStyle.fg(Color.GREEN));
    styles.put(SeverityLevel.WARN, TextStyle.fg(Color.YELLOW).with(Emphasis.BOLD));
    styles.put(SeverityLevel.ERROR, TextStyle.fg(Color.RED).with(Emphasis.BOLD));
    styles.put(SeverityLevel.CRITICAL,
        TextStyle.fg(Color.WHITE).withBackground(Color.RED).with(Emphasis.BOLD));
    styles.put(SeverityLevel.OFF, TextStyle.NONE);
    return new LevelColorPolicy(styles);
  }

  /**
   * Returns a copy assigning {@code style} to {@code level}.
   *
   * @param level level to restyle
   * @param style new style
   * @return updated policy
   */
  public LevelColorPolicy with(SeverityLevel level, TextStyle style) {
    Map<SeverityLevel, TextStyle> copy = new EnumMap<>(styles);
    copy.put(Objects.requireNonNull(level, "level"), Objects.requireNonNull(style, "style"));
    return new LevelColorPolicy(copy);
  }

  /**
   * Returns the style for {@code level}.
   *
   * @param level message level
   * @return style, {@link TextStyle#NONE} when unmapped
   */
  public TextStyle styleFor(SeverityLevel level) {
    return styles.getOrDefault(level, TextStyle.NONE);
  }
}
