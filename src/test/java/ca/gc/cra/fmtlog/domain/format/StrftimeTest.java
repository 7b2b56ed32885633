package ca.gc.cra.fmtlog.domain.format;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class StrftimeTest {
  private static final ZonedDateTime MORNING =
      ZonedDateTime.of(2024, 3, 5, 7, 8, 9, 123_456_789, ZoneOffset.UTC);

  @Test
  void expandsDateAndTimeFields() {
    assertEquals("2024-03-05 07:08:09", Strftime.format("%Y-%m-%d %H:%M:%S", MORNING));
    assertEquals("2024-03-05", Strftime.format("%F", MORNING));
    assertEquals("07:08:09", Strftime.format("%T", MORNING));
    assertEquals("03/05/24", Strftime.format("%D", MORNING));
    assertEquals("065", Strftime.format("%j", MORNING));
  }

  @Test
  void subSecondFieldsUseMillisAndMicros() {
    assertEquals("07:08:09.123", Strftime.format("%H:%M:%S.%e", MORNING));
    assertEquals("123456", Strftime.format("%f", MORNING));
  }

  @Test
  void namesAndTwelveHourClock() {
    assertEquals("Tue March", Strftime.format("%a %B", MORNING));
    assertEquals("07:08:09 AM", Strftime.format("%r", MORNING));
    assertEquals("07 PM", Strftime.format("%I %p", MORNING.withHour(19)));
    assertEquals("12 AM", Strftime.format("%I %p", MORNING.withHour(0)));
  }

  @Test
  void offsetAndEpochSeconds() {
    assertEquals("+0000", Strftime.format("%z", MORNING));
    assertEquals(Long.toString(MORNING.toEpochSecond()), Strftime.format("%s", MORNING));
    assertEquals("100%", Strftime.format("100%%", MORNING));
  }

  @Test
  void rejectsUnknownAndDanglingConversions() {
    FormatException unknown = assertThrows(FormatException.class, () -> Strftime.format("%Q", MORNING));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, unknown.kind());
    FormatException dangling = assertThrows(FormatException.class, () -> Strftime.validate("%H:%"));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, dangling.kind());
    assertDoesNotThrow(() -> Strftime.validate("%c"));
  }
}
