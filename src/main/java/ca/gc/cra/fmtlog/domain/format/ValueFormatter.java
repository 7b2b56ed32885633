package ca.gc.cra.fmtlog.domain.format;

import ca.gc.cra.fmtlog.domain.format.FormatSpec.Align;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Applies a {@link FormatSpec} to a single {@link Argument}.
 *
 * <p>Integers, floats and timestamps-with-width are right or left aligned per kind; the argument's style hint is
 * wrapped around the padded text so escape sequences never count towards the width.</p>
 *
 * @since 0.1.0
 */
public final class ValueFormatter {
  /** Pattern used for timestamps rendered without a time specifier. */
  public static final String DEFAULT_TIME_PATTERN = "%Y-%m-%d %H:%M:%S";
  /** Fixed-point precision used when a float specifier has none. */
  public static final int DEFAULT_FLOAT_PRECISION = 6;

  private ValueFormatter() {
    // Utility
  }

  /**
   * Renders one argument.
   *
   * @param argument value to render
   * @param spec parsed specifier of the placeholder
   * @param zone zone used to express timestamps
   * @return rendered text including any style wrapping
   * @throws FormatException with {@link FormatException.Kind#TYPE_MISMATCH} when the specifier does not apply
   */
  public static String format(Argument argument, FormatSpec spec, ZoneId zone) {
    String rendered = switch (argument.kind()) {
      case INTEGER -> formatInteger((Long) argument.value(), spec);
      case FLOAT -> formatFloat((Double) argument.value(), spec);
      case STRING -> formatText((String) argument.value(), spec, "string");
      case BOOLEAN -> formatBoolean((Boolean) argument.value(), spec);
      case TIMESTAMP -> formatTimestamp(((Instant) argument.value()).atZone(zone), spec);
    };
    return argument.style().wrap(rendered);
  }

  private static String formatInteger(long value, FormatSpec spec) {
    if (spec.isTimePattern()) {
      throw mismatch("time pattern", "integer");
    }
    if (spec.precision() >= 0) {
      throw mismatch("precision", "integer");
    }
    if (spec.type() == 'c') {
      if (spec.hasNumericFlags()) {
        throw mismatch("sign, '#' or '0' flag", "character");
      }
      if (value < 0 || value > Character.MAX_CODE_POINT) {
        throw mismatch("value " + value, "character");
      }
      return pad(new String(Character.toChars((int) value)), spec, Align.LEFT);
    }
    int radix;
    String prefix;
    switch (spec.type()) {
      case FormatSpec.NO_TYPE, 'd' -> {
        radix = 10;
        prefix = "";
      }
      case 'x', 'X' -> {
        radix = 16;
        prefix = spec.type() == 'x' ? "0x" : "0X";
      }
      case 'b', 'B' -> {
        radix = 2;
        prefix = spec.type() == 'b' ? "0b" : "0B";
      }
      case 'o' -> {
        radix = 8;
        prefix = "0";
      }
      default -> throw mismatch("type '" + spec.type() + "'", "integer");
    }
    boolean negative = value < 0;
    // -Long.MIN_VALUE overflows back to itself, which the unsigned conversion reads correctly.
    String digits = Long.toUnsignedString(negative ? -value : value, radix);
    if (spec.type() == 'X') {
      digits = digits.toUpperCase(Locale.ROOT);
    }
    if (!spec.alternate() || (radix == 8 && "0".equals(digits))) {
      prefix = "";
    }
    return numeric(sign(negative, spec), prefix, digits, spec);
  }

  private static String formatFloat(double value, FormatSpec spec) {
    if (spec.isTimePattern()) {
      throw mismatch("time pattern", "float");
    }
    int precision = spec.precision() < 0 ? DEFAULT_FLOAT_PRECISION : spec.precision();
    boolean negative = !Double.isNaN(value) && Double.doubleToRawLongBits(value) < 0;
    double magnitude = Math.abs(value);
    String body;
    if (Double.isNaN(value)) {
      body = "nan";
    } else if (Double.isInfinite(value)) {
      body = "inf";
    } else {
      body = switch (spec.type()) {
        case FormatSpec.NO_TYPE, 'f', 'F' -> String.format(Locale.ROOT, "%." + precision + "f", magnitude);
        case 'e', 'E' -> String.format(Locale.ROOT, "%." + precision + "e", magnitude);
        case 'g', 'G' -> general(magnitude, precision, spec.alternate());
        default -> throw mismatch("type '" + spec.type() + "'", "float");
      };
    }
    if (Character.isUpperCase(spec.type())) {
      body = body.toUpperCase(Locale.ROOT);
    }
    return numeric(sign(negative, spec), "", body, spec);
  }

  /**
   * General format: exponent notation when the decimal exponent is below -4 or at least the precision,
   * fixed notation otherwise. Trailing zeros and a trailing point are dropped unless {@code alternate}.
   */
  private static String general(double magnitude, int precision, boolean alternate) {
    int significant = precision == 0 ? 1 : precision;
    String scientific = String.format(Locale.ROOT, "%." + (significant - 1) + "e", magnitude);
    int e = scientific.indexOf('e');
    int exponent = Integer.parseInt(scientific.substring(e + 1));
    String mantissa;
    String suffix;
    if (exponent < -4 || exponent >= significant) {
      mantissa = scientific.substring(0, e);
      suffix = scientific.substring(e);
    } else {
      mantissa = String.format(Locale.ROOT, "%." + (significant - 1 - exponent) + "f", magnitude);
      suffix = "";
    }
    if (!alternate && mantissa.indexOf('.') >= 0) {
      int end = mantissa.length();
      while (mantissa.charAt(end - 1) == '0') {
        end--;
      }
      if (mantissa.charAt(end - 1) == '.') {
        end--;
      }
      mantissa = mantissa.substring(0, end);
    }
    return mantissa + suffix;
  }

  private static String formatBoolean(boolean value, FormatSpec spec) {
    if (spec.type() != FormatSpec.NO_TYPE && "dxXbBo".indexOf(spec.type()) >= 0) {
      return formatInteger(value ? 1 : 0, spec);
    }
    return formatText(Boolean.toString(value), spec, "boolean");
  }

  private static String formatText(String text, FormatSpec spec, String kind) {
    if (spec.isTimePattern()) {
      throw mismatch("time pattern", kind);
    }
    if (spec.type() != FormatSpec.NO_TYPE && spec.type() != 's') {
      throw mismatch("type '" + spec.type() + "'", kind);
    }
    if (spec.hasNumericFlags()) {
      throw mismatch("sign, '#' or '0' flag", kind);
    }
    String value = text;
    if (spec.precision() >= 0 && value.codePointCount(0, value.length()) > spec.precision()) {
      value = value.substring(0, value.offsetByCodePoints(0, spec.precision()));
    }
    return pad(value, spec, Align.LEFT);
  }

  private static String formatTimestamp(ZonedDateTime time, FormatSpec spec) {
    if (spec.isTimePattern()) {
      return Strftime.format(spec.timePattern(), time);
    }
    if (spec.type() != FormatSpec.NO_TYPE || spec.precision() >= 0 || spec.hasNumericFlags()) {
      throw mismatch("numeric specifier", "timestamp");
    }
    return pad(Strftime.format(DEFAULT_TIME_PATTERN, time), spec, Align.LEFT);
  }

  private static String sign(boolean negative, FormatSpec spec) {
    if (negative) {
      return "-";
    }
    return switch (spec.sign()) {
      case PLUS -> "+";
      case SPACE -> " ";
      case MINUS -> "";
    };
  }

  private static String numeric(String sign, String prefix, String digits, FormatSpec spec) {
    if (spec.zeroPad() && spec.align() == Align.DEFAULT) {
      int padding = spec.width() - (sign.length() + prefix.length() + digits.length());
      return sign + prefix + "0".repeat(Math.max(0, padding)) + digits;
    }
    return pad(sign + prefix + digits, spec, Align.RIGHT);
  }

  private static String pad(String text, FormatSpec spec, Align defaultAlign) {
    int padding = spec.width() - text.codePointCount(0, text.length());
    if (padding <= 0) {
      return text;
    }
    String fill = String.valueOf(spec.fill());
    Align align = spec.align() == Align.DEFAULT ? defaultAlign : spec.align();
    return switch (align) {
      case LEFT, DEFAULT -> text + fill.repeat(padding);
      case RIGHT -> fill.repeat(padding) + text;
      case CENTER -> fill.repeat(padding / 2) + text + fill.repeat(padding - padding / 2);
    };
  }

  private static FormatException mismatch(String feature, String kind) {
    return new FormatException(
        FormatException.Kind.TYPE_MISMATCH, feature + " is not valid for a " + kind + " argument");
  }
}
