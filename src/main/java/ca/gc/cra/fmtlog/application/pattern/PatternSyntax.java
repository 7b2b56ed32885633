package ca.gc.cra.fmtlog.application.pattern;

import ca.gc.cra.fmtlog.domain.format.FormatException;

/**
 * Translates classic {@code %}-flag log patterns, such as {@code [%H:%M:%S.%e] [%l] %v}, into placeholder
 * patterns understood by {@link PatternRenderer}.
 *
 * <p>Supported flags: {@code %v} message, {@code %n} logger name, {@code %l} level, {@code %L} one-letter level,
 * {@code %@} source location, {@code %%} percent sign, and the date/time flags
 * {@code %a %A %b %B %c %C %Y %D %m %d %H %I %M %S %e %f %p %r %R %T %y %z %E}. The color range markers
 * {@code %^} and {@code %$} are accepted and ignored because the level field is always the colored range.
 * Consecutive time flags joined by {@code :-./} or spaces collapse into one {@code {%time:...}} field.</p>
 *
 * @since 0.1.0
 */
public final class PatternSyntax {
  private static final String TIME_FLAGS = "aAbBcCYDmdHIMSefprRTyzE";
  private static final String TIME_SEPARATORS = ":-./ ";

  private PatternSyntax() {
    // Utility
  }

  /**
   * Translates a {@code %}-flag pattern.
   *
   * @param legacy pattern using {@code %} flags
   * @return equivalent placeholder pattern
   * @throws FormatException with {@link FormatException.Kind#MALFORMED_SPECIFIER} on a dangling {@code %} or
   *     an unsupported flag
   */
  public static String fromSpdlog(String legacy) {
    if (legacy == null) {
      throw new IllegalArgumentException("pattern must not be null");
    }
    StringBuilder out = new StringBuilder(legacy.length() + 16);
    int n = legacy.length();
    int i = 0;
    while (i < n) {
      char c = legacy.charAt(i);
      if (c != '%') {
        appendLiteral(out, c);
        i++;
        continue;
      }
      char flag = flagAt(legacy, i);
      if (TIME_FLAGS.indexOf(flag) >= 0) {
        i = appendTimeRun(out, legacy, i);
        continue;
      }
      switch (flag) {
        case 'v' -> out.append("{%message}");
        case 'n' -> out.append("{%name}");
        case 'l' -> out.append("{%level}");
        case 'L' -> out.append("{%level:.1}");
        case '@' -> out.append("{%source}");
        case '%' -> out.append('%');
        case '^', '$' -> {
          // color range markers carry no text
        }
        default -> throw new FormatException(FormatException.Kind.MALFORMED_SPECIFIER,
            "unsupported pattern flag '%" + flag + "' in '" + legacy + "'");
      }
      i += 2;
    }
    return out.toString();
  }

  private static int appendTimeRun(StringBuilder out, String legacy, int start) {
    StringBuilder time = new StringBuilder();
    int i = start;
    int committed = start;
    int committedLength = 0;
    int n = legacy.length();
    while (i < n) {
      char c = legacy.charAt(i);
      if (c == '%' && i + 1 < n && TIME_FLAGS.indexOf(legacy.charAt(i + 1)) >= 0) {
        char flag = legacy.charAt(i + 1);
        time.append('%').append(flag == 'E' ? 's' : flag);
        i += 2;
        committed = i;
        committedLength = time.length();
      } else if (TIME_SEPARATORS.indexOf(c) >= 0) {
        time.append(c);
        i++;
      } else {
        break;
      }
    }
    out.append("{%time:").append(time, 0, committedLength).append('}');
    return committed;
  }

  private static char flagAt(String legacy, int percent) {
    if (percent + 1 >= legacy.length()) {
      throw new FormatException(FormatException.Kind.MALFORMED_SPECIFIER,
          "dangling '%' at end of '" + legacy + "'");
    }
    return legacy.charAt(percent + 1);
  }

  private static void appendLiteral(StringBuilder out, char c) {
    if (c == '{' || c == '}') {
      out.append(c);
    }
    out.append(c);
  }
}
