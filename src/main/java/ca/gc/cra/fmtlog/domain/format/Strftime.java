package ca.gc.cra.fmtlog.domain.format;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Expands strftime-like sub-patterns against a zoned calendar value.
 *
 * <p>Supported conversions: {@code %Y %y %C %m %d %e %f %H %I %M %S %p %j %a %A %b %h %B %u %w %z %Z %s
 * %F %T %D %R %r %c %n %t %%}. {@code %e} is milliseconds and {@code %f} microseconds, matching the log
 * pattern conventions rather than C's day-of-month meaning.</p>
 *
 * @since 0.1.0
 */
public final class Strftime {
  private static final ZonedDateTime SAMPLE = Instant.EPOCH.atZone(ZoneOffset.UTC);
  private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("zzz", Locale.ROOT);
  private static final DateTimeFormatter OFFSET = DateTimeFormatter.ofPattern("xx", Locale.ROOT);

  private Strftime() {
    // Utility
  }

  /**
   * Checks that every conversion in {@code pattern} is supported.
   *
   * @param pattern sub-pattern to check
   * @throws FormatException with {@link FormatException.Kind#MALFORMED_SPECIFIER} on unknown conversions
   */
  public static void validate(String pattern) {
    format(pattern, SAMPLE);
  }

  /**
   * Expands {@code pattern} against {@code time}.
   *
   * @param pattern strftime sub-pattern
   * @param time calendar value
   * @return expanded text
   * @throws FormatException with {@link FormatException.Kind#MALFORMED_SPECIFIER} on unknown conversions
   */
  public static String format(String pattern, ZonedDateTime time) {
    StringBuilder out = new StringBuilder(pattern.length() + 16);
    int n = pattern.length();
    for (int i = 0; i < n; i++) {
      char c = pattern.charAt(i);
      if (c != '%') {
        out.append(c);
        continue;
      }
      if (++i >= n) {
        throw malformed(pattern, "dangling '%'");
      }
      expand(pattern, pattern.charAt(i), time, out);
    }
    return out.toString();
  }

  private static void expand(String pattern, char conversion, ZonedDateTime t, StringBuilder out) {
    switch (conversion) {
      case 'Y' -> pad(out, t.getYear(), 4);
      case 'y' -> pad(out, Math.floorMod(t.getYear(), 100), 2);
      case 'C' -> pad(out, Math.floorDiv(t.getYear(), 100), 2);
      case 'm' -> pad(out, t.getMonthValue(), 2);
      case 'd' -> pad(out, t.getDayOfMonth(), 2);
      case 'e' -> pad(out, t.getNano() / 1_000_000, 3);
      case 'f' -> pad(out, t.getNano() / 1_000, 6);
      case 'H' -> pad(out, t.getHour(), 2);
      case 'I' -> pad(out, t.getHour() % 12 == 0 ? 12 : t.getHour() % 12, 2);
      case 'M' -> pad(out, t.getMinute(), 2);
      case 'S' -> pad(out, t.getSecond(), 2);
      case 'p' -> out.append(t.getHour() < 12 ? "AM" : "PM");
      case 'j' -> pad(out, t.getDayOfYear(), 3);
      case 'a' -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
      case 'A' -> out.append(t.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
      case 'b', 'h' -> out.append(t.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
      case 'B' -> out.append(t.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
      case 'u' -> out.append(t.getDayOfWeek().getValue());
      case 'w' -> out.append(t.getDayOfWeek().getValue() % 7);
      case 'z' -> out.append(OFFSET.format(t));
      case 'Z' -> out.append(ZONE_NAME.format(t));
      case 's' -> out.append(t.toEpochSecond());
      case 'F' -> out.append(format("%Y-%m-%d", t));
      case 'T' -> out.append(format("%H:%M:%S", t));
      case 'D' -> out.append(format("%m/%d/%y", t));
      case 'R' -> out.append(format("%H:%M", t));
      case 'r' -> out.append(format("%I:%M:%S %p", t));
      case 'c' -> out.append(format("%a %b %d %H:%M:%S %Y", t));
      case 'n' -> out.append('\n');
      case 't' -> out.append('\t');
      case '%' -> out.append('%');
      default -> throw malformed(pattern, "unsupported conversion '%" + conversion + "'");
    }
  }

  private static void pad(StringBuilder out, long value, int digits) {
    String text = Long.toString(Math.abs(value));
    if (value < 0) {
      out.append('-');
    }
    for (int i = text.length(); i < digits; i++) {
      out.append('0');
    }
    out.append(text);
  }

  private static FormatException malformed(String pattern, String detail) {
    return new FormatException(
        FormatException.Kind.MALFORMED_SPECIFIER, "invalid time pattern '" + pattern + "': " + detail);
  }
}
