package ca.gc.cra.fmtlog.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.domain.log.ColorHint;
import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import ca.gc.cra.fmtlog.domain.style.Color;
import ca.gc.cra.fmtlog.domain.style.Emphasis;
import ca.gc.cra.fmtlog.domain.style.TextStyle;
import java.io.IOException;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ColorConsoleSinkTest {
  private static final RenderedLine ERROR_LINE = new RenderedLine(
      "[ERROR] \u001B[32mok\u001B[0m failed",
      new ColorHint(1, 6, TextStyle.fg(Color.RED).with(Emphasis.BOLD)));

  @Test
  void colorSinkWrapsHintedRange() throws IOException {
    StringWriter out = new StringWriter();
    ColorConsoleSink sink = new ColorConsoleSink(out, "stdout_color", true, true);

    sink.write(ERROR_LINE);

    assertTrue(sink.supportsColor());
    assertEquals("[\u001B[1;31mERROR\u001B[0m] \u001B[32mok\u001B[0m failed\n", out.toString());
  }

  @Test
  void colorDisabledStripsEveryEscape() throws IOException {
    StringWriter out = new StringWriter();
    ColorConsoleSink sink = new ColorConsoleSink(out, "stdout_color", false, true);

    sink.write(ERROR_LINE);

    assertFalse(sink.supportsColor());
    assertEquals("[ERROR] ok failed\n", out.toString());
  }
}
