package ca.gc.cra.fmtlog.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.domain.format.FormatSpec.Align;
import ca.gc.cra.fmtlog.domain.format.FormatSpec.Sign;
import org.junit.jupiter.api.Test;

class FormatSpecTest {

  @Test
  void emptySpecifierIsShared() {
    assertSame(FormatSpec.EMPTY, FormatSpec.parse(""));
    assertSame(FormatSpec.EMPTY, FormatSpec.parse(null));
  }

  @Test
  void parsesWidthPrecisionAndType() {
    FormatSpec spec = FormatSpec.parse(">10.2f");

    assertEquals(Align.RIGHT, spec.align());
    assertEquals(10, spec.width());
    assertEquals(2, spec.precision());
    assertEquals('f', spec.type());
    assertFalse(spec.hasNumericFlags());
  }

  @Test
  void parsesFillAndCenter() {
    FormatSpec spec = FormatSpec.parse("*^7");

    assertEquals('*', spec.fill());
    assertEquals(Align.CENTER, spec.align());
    assertEquals(7, spec.width());
    assertEquals(FormatSpec.NO_TYPE, spec.type());
  }

  @Test
  void parsesNumericFlags() {
    FormatSpec spec = FormatSpec.parse("+#010x");

    assertEquals(Sign.PLUS, spec.sign());
    assertTrue(spec.alternate());
    assertTrue(spec.zeroPad());
    assertEquals(10, spec.width());
    assertEquals('x', spec.type());
    assertTrue(spec.hasNumericFlags());
  }

  @Test
  void percentPrefixSelectsTimePattern() {
    FormatSpec spec = FormatSpec.parse("%Y-%m-%d %H:%M:%S");

    assertTrue(spec.isTimePattern());
    assertEquals("%Y-%m-%d %H:%M:%S", spec.timePattern());
  }

  @Test
  void rejectsMalformedSpecifiers() {
    for (String raw : new String[] {"10q", ".f", "%Q", ">>>", "99999", "d5"}) {
      FormatException ex = assertThrows(FormatException.class, () -> FormatSpec.parse(raw), raw);
      assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, ex.kind(), raw);
    }
  }
}
