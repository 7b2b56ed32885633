package ca.gc.cra.fmtlog.application.pattern;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import org.junit.jupiter.api.Test;

class PatternSyntaxTest {

  @Test
  void convertsTheDemoPattern() {
    assertEquals("[{%time:%H:%M:%S.%e}] [{%level}] [{%name}] {%message}",
        PatternSyntax.fromSpdlog("[%H:%M:%S.%e] [%^%l%$] [%n] %v"));
  }

  @Test
  void trailingSeparatorsStayLiteral() {
    assertEquals("{%time:%H:%M} {%message}", PatternSyntax.fromSpdlog("%H:%M %v"));
    assertEquals("{%time:%Y-%m-%d}-{%name}", PatternSyntax.fromSpdlog("%Y-%m-%d-%n"));
  }

  @Test
  void mapsShortLevelSourceAndEpoch() {
    assertEquals("{%level:.1} {%source} {%time:%s}", PatternSyntax.fromSpdlog("%L %@ %E"));
  }

  @Test
  void escapesBracesAndPercent() {
    assertEquals("{{{%message}}} 100%", PatternSyntax.fromSpdlog("{%v} 100%%"));
  }

  @Test
  void rejectsUnknownOrDanglingFlags() {
    FormatException unknown = assertThrows(FormatException.class, () -> PatternSyntax.fromSpdlog("%Q"));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, unknown.kind());
    FormatException dangling = assertThrows(FormatException.class, () -> PatternSyntax.fromSpdlog("abc%"));
    assertEquals(FormatException.Kind.MALFORMED_SPECIFIER, dangling.kind());
    assertThrows(IllegalArgumentException.class, () -> PatternSyntax.fromSpdlog(null));
  }

  @Test
  void convertedPatternsCompile() {
    PatternRenderer renderer = new PatternRenderer(new FormatEngine());

    assertDoesNotThrow(() -> renderer.compile(PatternSyntax.fromSpdlog("[%H:%M:%S.%e] [%^%l%$] [%n] %v")));
    CompiledPattern full = renderer.compile(PatternSyntax.fromSpdlog("%c %z %L %@ %v"));
    assertEquals("{%time:%c %z} {%level:.1} {%source} {%message}", full.source());
  }
}
