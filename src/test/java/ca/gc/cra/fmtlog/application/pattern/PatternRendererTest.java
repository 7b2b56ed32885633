package ca.gc.cra.fmtlog.application.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.application.port.MetricsPort;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.log.ColorHint;
import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.domain.log.SourceLocation;
import ca.gc.cra.fmtlog.domain.style.Color;
import ca.gc.cra.fmtlog.domain.style.Emphasis;
import ca.gc.cra.fmtlog.domain.style.TextStyle;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PatternRendererTest {
  private static final Instant NOW = Instant.parse("2024-01-02T03:04:05.678Z");

  private final PatternRenderer renderer =
      new PatternRenderer(new FormatEngine(ZoneOffset.UTC, MetricsPort.NO_OP));

  @Test
  void defaultPatternRendersTimeLevelAndMessage() {
    CompiledPattern pattern = renderer.compile(PatternRenderer.DEFAULT_PATTERN);

    RenderedLine line = renderer.renderLine(pattern, SeverityLevel.INFO, "app", "hello", NOW);

    assertEquals("[2024-01-02 03:04:05.678] [INFO ] hello", line.text());
  }

  @Test
  void messageOnlyPatternReturnsTheMessage() {
    CompiledPattern pattern = renderer.compile("{%message}");

    RenderedLine line = renderer.renderLine(pattern, SeverityLevel.ERROR, "app", "as is {}", NOW);

    assertEquals("as is {}", line.text());
  }

  @Test
  void levelSpanCarriesTheLevelStyle() {
    CompiledPattern pattern = renderer.compile("[{%level}] {%name}: {%message}");

    RenderedLine line = renderer.renderLine(pattern, SeverityLevel.WARN, "app", "disk low", NOW);

    assertEquals("[WARN ] app: disk low", line.text());
    ColorHint hint = line.colorHint();
    assertEquals(1, hint.start());
    assertEquals(6, hint.end());
    assertEquals(TextStyle.fg(Color.YELLOW).with(Emphasis.BOLD), hint.style());
    assertEquals("[\u001B[1;33mWARN \u001B[0m] app: disk low", line.colorized());
  }

  @Test
  void patternWithoutLevelHasNoHint() {
    RenderedLine line = renderer.renderLine(renderer.compile("{%name} {%message}"),
        SeverityLevel.ERROR, "svc", "x", NOW);

    assertTrue(line.colorHint().isEmpty());
  }

  @Test
  void levelPrecisionShortensTheCode() {
    RenderedLine line = renderer.renderLine(renderer.compile("{%level:.1}|{%message}"),
        SeverityLevel.CRITICAL, "svc", "boom", NOW);

    assertEquals("C|boom", line.text());
    assertEquals(0, line.colorHint().start());
    assertEquals(1, line.colorHint().end());
  }

  @Test
  void sourceFieldRendersCallSite() {
    CompiledPattern pattern = renderer.compile("{%message} ({%source})");

    RenderedLine line = renderer.renderLine(pattern, SeverityLevel.INFO, "app", "hi", NOW,
        new SourceLocation("App.java", 7, "main"));

    assertTrue(pattern.usesSource());
    assertEquals("hi (App.java:7 main)", line.text());
    assertEquals("hi ()", renderer.renderLine(pattern, SeverityLevel.INFO, "app", "hi", NOW).text());
  }

  @Test
  void callSiteIsIgnoredWithoutSourceField() {
    CompiledPattern pattern = renderer.compile("{%name}: {%message}");

    RenderedLine line = renderer.renderLine(pattern, SeverityLevel.INFO, "app", "hi", NOW,
        new SourceLocation("App.java", 7, "main"));

    assertFalse(pattern.usesSource());
    assertEquals("app: hi", line.text());
  }

  @Test
  void compileRejectsUnnamedAndUnknownFields() {
    assertKind(FormatException.Kind.MALFORMED_SPECIFIER, "{} {%message}");
    assertKind(FormatException.Kind.MALFORMED_SPECIFIER, "{0}");
    assertKind(FormatException.Kind.UNRESOLVED_PLACEHOLDER, "{%bogus} {%message}");
    assertKind(FormatException.Kind.MALFORMED_SPECIFIER, "{%time:%Q}");
    assertKind(FormatException.Kind.TYPE_MISMATCH, "{%message:d}");
  }

  @Test
  void compileKeepsSource() {
    CompiledPattern pattern = renderer.compile("{%name}");

    assertEquals("{%name}", pattern.toString());
    assertFalse(pattern.usesSource());
  }

  @Test
  void customColorPolicyOverridesDefaults() {
    LevelColorPolicy policy = LevelColorPolicy.defaults().with(SeverityLevel.INFO, TextStyle.fg(Color.BLUE));
    PatternRenderer custom = new PatternRenderer(new FormatEngine(ZoneOffset.UTC, MetricsPort.NO_OP), policy);

    RenderedLine line = custom.renderLine(custom.compile("{%level}"), SeverityLevel.INFO, "a", "b", NOW);

    assertEquals(TextStyle.fg(Color.BLUE), line.colorHint().style());
    assertEquals(TextStyle.fg(Color.GREEN), LevelColorPolicy.defaults().styleFor(SeverityLevel.INFO));
  }

  private void assertKind(FormatException.Kind kind, String pattern) {
    FormatException ex = assertThrows(FormatException.class, () -> renderer.compile(pattern), pattern);
    assertEquals(kind, ex.kind(), pattern);
  }
}
