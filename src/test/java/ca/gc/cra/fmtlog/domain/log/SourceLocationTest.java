package ca.gc.cra.fmtlog.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SourceLocationTest {

  @Test
  void hereCapturesTheCallingFrame() {
    SourceLocation location = SourceLocation.here();

    assertEquals("SourceLocationTest.java", location.file());
    assertEquals("hereCapturesTheCallingFrame", location.function());
    assertTrue(location.line() > 0);
    assertFalse(location.isUnknown());
  }

  @Test
  void renderJoinsFileLineAndFunction() {
    assertEquals("Main.java:42 run", new SourceLocation("Main.java", 42, "run").render());
    assertEquals("Main.java", new SourceLocation("Main.java", 0, null).render());
    assertEquals("", SourceLocation.UNKNOWN.render());
  }
}
