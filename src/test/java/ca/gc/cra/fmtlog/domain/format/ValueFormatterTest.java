package ca.gc.cra.fmtlog.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.fmtlog.domain.style.Color;
import ca.gc.cra.fmtlog.domain.style.TextStyle;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ValueFormatterTest {
  private static final ZoneId UTC = ZoneOffset.UTC;

  private static String fmt(Argument argument, String spec) {
    return ValueFormatter.format(argument, FormatSpec.parse(spec), UTC);
  }

  @Test
  void integersHonourRadixAndAlternateForm() {
    assertEquals("42", fmt(Argument.of(42L), ""));
    assertEquals("0xff", fmt(Argument.of(255L), "#x"));
    assertEquals("0XFF", fmt(Argument.of(255L), "#X"));
    assertEquals("ff", fmt(Argument.of(255L), "x"));
    assertEquals("0b101010", fmt(Argument.of(42L), "#b"));
    assertEquals("010", fmt(Argument.of(8L), "#o"));
    assertEquals("0", fmt(Argument.of(0L), "#o"));
    assertEquals("-9223372036854775808", fmt(Argument.of(Long.MIN_VALUE), ""));
  }

  @Test
  void integersAlignRightAndZeroPadAfterSign() {
    assertEquals("        42", fmt(Argument.of(42L), "10"));
    assertEquals("42        ", fmt(Argument.of(42L), "<10"));
    assertEquals("-0042", fmt(Argument.of(-42L), "05d"));
    assertEquals("0x00ff", fmt(Argument.of(255L), "#06x"));
    assertEquals("+5", fmt(Argument.of(5L), "+d"));
    assertEquals(" 5", fmt(Argument.of(5L), " d"));
  }

  @Test
  void floatsDefaultToSixDecimals() {
    assertEquals("1.500000", fmt(Argument.of(1.5), ""));
    assertEquals("3.14", fmt(Argument.of(3.14159), ".2f"));
    assertEquals("      3.14", fmt(Argument.of(3.14159), ">10.2f"));
    assertEquals("-003.142", fmt(Argument.of(-3.14159), "08.3f"));
    assertEquals("1.234568e+04", fmt(Argument.of(12345.678), "e"));
    assertEquals("1.23E+04", fmt(Argument.of(12345.678), ".2E"));
  }

  @Test
  void generalFormatDropsTrailingZeros() {
    assertEquals("3.14", fmt(Argument.of(3.14), "g"));
    assertEquals("0.0001", fmt(Argument.of(0.0001), "g"));
    assertEquals("1e-05", fmt(Argument.of(0.00001), "g"));
    assertEquals("1e+20", fmt(Argument.of(1e20), "g"));
    assertEquals("123457", fmt(Argument.of(123456.7), "g"));
    assertEquals("1.23457e+06", fmt(Argument.of(1234567.0), "g"));
    assertEquals("0", fmt(Argument.of(0.0), "g"));
    assertEquals("-2.5", fmt(Argument.of(-2.5), "g"));
    assertEquals("1E+20", fmt(Argument.of(1e20), "G"));
    assertEquals("3.1", fmt(Argument.of(3.14159), ".2g"));
    assertEquals("3.14000", fmt(Argument.of(3.14), "#g"));
    assertEquals("  3.14", fmt(Argument.of(3.14), ">6g"));
  }

  @Test
  void characterTypeRendersCodePoint() {
    assertEquals("A", fmt(Argument.of(65L), "c"));
    assertEquals("A  ", fmt(Argument.of(65L), "3c"));
    assertEquals("\u00e9", fmt(Argument.of(0xe9L), "c"));
    assertMismatch(Argument.of(-1L), "c");
    assertMismatch(Argument.of(65L), "+c");
    assertMismatch(Argument.of("A"), "c");
  }

  @Test
  void nonFiniteFloats() {
    assertEquals("nan", fmt(Argument.of(Double.NaN), ""));
    assertEquals("-inf", fmt(Argument.of(Double.NEGATIVE_INFINITY), ""));
    assertEquals("INF", fmt(Argument.of(Double.POSITIVE_INFINITY), "F"));
  }

  @Test
  void stringsAlignLeftAndTruncate() {
    assertEquals("ab   ", fmt(Argument.of("ab"), "5"));
    assertEquals("   ab", fmt(Argument.of("ab"), ">5"));
    assertEquals(" ab  ", fmt(Argument.of("ab"), "^5"));
    assertEquals("***abc***", fmt(Argument.of("abc"), "*^9"));
    assertEquals("abc", fmt(Argument.of("abcdef"), ".3"));
    assertEquals("toolong", fmt(Argument.of("toolong"), "3"));
  }

  @Test
  void booleansRenderAsWordsOrDigits() {
    assertEquals("true", fmt(Argument.of(true), ""));
    assertEquals("1", fmt(Argument.of(true), "d"));
    assertEquals("false", fmt(Argument.of(false), "s"));
  }

  @Test
  void timestampsUsePatternOrDefault() {
    Argument stamp = Argument.of(Instant.parse("2024-03-05T07:08:09.123Z"));

    assertEquals("2024-03-05 07:08:09", fmt(stamp, ""));
    assertEquals("07:08:09.123", fmt(stamp, "%H:%M:%S.%e"));
    assertEquals("2024-03-05 09:08:09",
        ValueFormatter.format(stamp, FormatSpec.EMPTY, ZoneOffset.ofHours(2)));
  }

  @Test
  void styledArgumentsAreWrappedAfterPadding() {
    Argument ok = Argument.styled("ok", TextStyle.fg(Color.GREEN));

    assertEquals("\u001B[32m    ok\u001B[0m", fmt(ok, ">6"));
  }

  @Test
  void incompatibleSpecifiersAreTypeMismatches() {
    assertMismatch(Argument.of("text"), "d");
    assertMismatch(Argument.of("text"), "+");
    assertMismatch(Argument.of(5L), ".2");
    assertMismatch(Argument.of(5L), "%H");
    assertMismatch(Argument.of(5L), "f");
    assertMismatch(Argument.of(1.5), "x");
    assertMismatch(Argument.of(Instant.EPOCH), "d");
  }

  private static void assertMismatch(Argument argument, String spec) {
    FormatException ex = assertThrows(FormatException.class, () -> fmt(argument, spec), spec);
    assertEquals(FormatException.Kind.TYPE_MISMATCH, ex.kind(), spec);
  }
}
