package ca.gc.cra.fmtlog.domain.format;

/**
 * Parsed placeholder specifier: {@code [[fill]align][sign]['#']['0'][width]['.' precision][type]}, or a
 * strftime sub-pattern starting with {@code %} for timestamp arguments.
 *
 * @param fill padding character
 * @param align requested alignment; {@link Align#DEFAULT} lets the argument kind decide
 * @param sign sign policy for numbers
 * @param alternate {@code #} flag requesting a base prefix
 * @param zeroPad {@code 0} flag padding numbers with zeros after sign and prefix
 * @param width minimum width in characters; {@code 0} when absent
 * @param precision precision for floats or truncation length for strings; {@code -1} when absent
 * @param type presentation type character; {@link #NO_TYPE} when absent
 * @param timePattern strftime sub-pattern; {@code null} unless the specifier started with {@code %}
 * @since 0.1.0
 */
public record FormatSpec(
    char fill,
    Align align,
    Sign sign,
    boolean alternate,
    boolean zeroPad,
    int width,
    int precision,
    char type,
    String timePattern) {

  /** Marker for an absent presentation type. */
  public static final char NO_TYPE = '\0';
  /** Upper bound for width and precision values. */
  public static final int MAX_WIDTH = 4096;
  /** Specifier of a bare placeholder. */
  public static final FormatSpec EMPTY =
      new FormatSpec(' ', Align.DEFAULT, Sign.MINUS, false, false, 0, -1, NO_TYPE, null);

  private static final String TYPES = "dxXbBoceEfFgGs";

  /** Alignment inside the padded field. */
  public enum Align {
    DEFAULT,
    LEFT,
    RIGHT,
    CENTER
  }

  /** Sign policy for numeric values. */
  public enum Sign {
    /** Only negative values carry a sign. */
    MINUS,
    /** Non-negative values carry {@code +}. */
    PLUS,
    /** Non-negative values carry a leading space. */
    SPACE
  }

  /**
   * Parses the text following {@code :} inside a placeholder.
   *
   * @param raw specifier text; {@code null} or empty yields {@link #EMPTY}
   * @return parsed specifier
   * @throws FormatException with {@link FormatException.Kind#MALFORMED_SPECIFIER} on invalid syntax
   */
  public static FormatSpec parse(String raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    if (raw.charAt(0) == '%') {
      Strftime.validate(raw);
      return new FormatSpec(' ', Align.DEFAULT, Sign.MINUS, false, false, 0, -1, NO_TYPE, raw);
    }

    int n = raw.length();
    int i = 0;
    char fill = ' ';
    Align align = Align.DEFAULT;
    if (n >= 2 && alignOf(raw.charAt(1)) != null) {
      fill = raw.charAt(0);
      align = alignOf(raw.charAt(1));
      i = 2;
    } else if (alignOf(raw.charAt(0)) != null) {
      align = alignOf(raw.charAt(0));
      i = 1;
    }

    Sign sign = Sign.MINUS;
    if (i < n && (raw.charAt(i) == '+' || raw.charAt(i) == '-' || raw.charAt(i) == ' ')) {
      sign = raw.charAt(i) == '+' ? Sign.PLUS : raw.charAt(i) == ' ' ? Sign.SPACE : Sign.MINUS;
      i++;
    }
    boolean alternate = false;
    if (i < n && raw.charAt(i) == '#') {
      alternate = true;
      i++;
    }
    boolean zeroPad = false;
    if (i < n && raw.charAt(i) == '0') {
      zeroPad = true;
      i++;
    }

    int start = i;
    while (i < n && Character.isDigit(raw.charAt(i))) {
      i++;
    }
    int width = start == i ? 0 : boundedNumber(raw, start, i, "width");

    int precision = -1;
    if (i < n && raw.charAt(i) == '.') {
      i++;
      start = i;
      while (i < n && Character.isDigit(raw.charAt(i))) {
        i++;
      }
      if (start == i) {
        throw malformed(raw, "precision expected after '.'");
      }
      precision = boundedNumber(raw, start, i, "precision");
    }

    char type = NO_TYPE;
    if (i < n) {
      char candidate = raw.charAt(i);
      if (i != n - 1 || TYPES.indexOf(candidate) < 0) {
        throw malformed(raw, "unexpected '" + raw.substring(i) + "'");
      }
      type = candidate;
    }
    return new FormatSpec(fill, align, sign, alternate, zeroPad, width, precision, type, null);
  }

  /**
   * Indicates whether the specifier carries a strftime sub-pattern.
   *
   * @return {@code true} for {@code {:%H:%M}} style specifiers
   */
  public boolean isTimePattern() {
    return timePattern != null;
  }

  /**
   * Indicates whether the specifier uses any numeric-only feature.
   *
   * @return {@code true} when a sign, {@code #} or {@code 0} flag is present
   */
  public boolean hasNumericFlags() {
    return sign != Sign.MINUS || alternate || zeroPad;
  }

  private static Align alignOf(char c) {
    return switch (c) {
      case '<' -> Align.LEFT;
      case '>' -> Align.RIGHT;
      case '^' -> Align.CENTER;
      default -> null;
    };
  }

  private static int boundedNumber(String raw, int from, int to, String label) {
    if (to - from > 4) {
      throw malformed(raw, label + " exceeds " + MAX_WIDTH);
    }
    int value = Integer.parseInt(raw.substring(from, to));
    if (value > MAX_WIDTH) {
      throw malformed(raw, label + " exceeds " + MAX_WIDTH);
    }
    return value;
  }

  private static FormatException malformed(String raw, String detail) {
    return new FormatException(
        FormatException.Kind.MALFORMED_SPECIFIER, "invalid format specifier '" + raw + "': " + detail);
  }
}
