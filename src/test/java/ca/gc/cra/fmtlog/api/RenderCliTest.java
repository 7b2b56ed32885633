package ca.gc.cra.fmtlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.ArgumentKind;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RenderCliTest {
  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(RenderCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void restoreOutput() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void rendersPositionalArguments() {
    ExitCode code = RenderCli.run(new String[] {"template={:>8.3f} | {}", "args=3.14159,done"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("   3.142 | done\n", buffer.toString());
  }

  @Test
  void rendersNamedArguments() {
    ExitCode code = RenderCli.run(new String[] {
        "template={who} is {age:>3} years old", "named.who=Ann", "named.age=7"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("Ann is   7 years old\n", buffer.toString());
  }

  @Test
  void formatsTimestampsInRequestedZone() {
    ExitCode code = RenderCli.run(new String[] {
        "template={:%H:%M}", "args=2024-01-01T12:00:00Z", "zone=America/Toronto"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("07:00\n", buffer.toString());
  }

  @Test
  void missingTemplateIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, RenderCli.run(new String[] {"args=1"}));
    assertTrue(buffer.toString().contains("usage: render"));
    assertTrue(hasLog(Level.ERROR, "Missing required argument"));
  }

  @Test
  void malformedArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, RenderCli.run(new String[] {"template"}));
  }

  @Test
  void unknownZoneIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, RenderCli.run(new String[] {"template={}", "args=1", "zone=Mars/Base"}));
  }

  @Test
  void templateErrorsReportFormatFailure() {
    assertEquals(ExitCode.FORMAT_ERROR, RenderCli.run(new String[] {"template={} {}", "args=1"}));
    assertEquals(ExitCode.FORMAT_ERROR, RenderCli.run(new String[] {"template={:d}", "args=text"}));
    assertEquals("", buffer.toString());
    assertTrue(hasLog(Level.ERROR, "ARGUMENT_INDEX_OUT_OF_RANGE"));
    assertTrue(hasLog(Level.ERROR, "TYPE_MISMATCH"));
  }

  @Test
  void infersArgumentTypes() {
    assertEquals(ArgumentKind.INTEGER, RenderCli.infer("42").kind());
    assertEquals(ArgumentKind.INTEGER, RenderCli.infer(" -7 ").kind());
    assertEquals(ArgumentKind.FLOAT, RenderCli.infer("3.5").kind());
    assertEquals(ArgumentKind.FLOAT, RenderCli.infer("1e3").kind());
    assertEquals(ArgumentKind.BOOLEAN, RenderCli.infer("TRUE").kind());
    assertEquals(ArgumentKind.TIMESTAMP, RenderCli.infer("2024-01-01T00:00:00Z").kind());
    assertEquals(ArgumentKind.STRING, RenderCli.infer("2024-13-01T00:00:00Z").kind());
    assertEquals(ArgumentKind.STRING, RenderCli.infer("99999999999999999999").kind());
    assertEquals(ArgumentKind.STRING, RenderCli.infer("hello").kind());
  }

  @Test
  void inferredValuesKeepTheirContent() {
    assertEquals(Argument.of(42L), RenderCli.infer("42"));
    assertEquals(Argument.of(Instant.parse("2024-01-01T00:00:00Z")), RenderCli.infer("2024-01-01T00:00:00Z"));
    assertEquals(Argument.of(" padded "), RenderCli.infer(" padded "));
  }

  private boolean hasLog(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
