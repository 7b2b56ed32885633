package ca.gc.cra.fmtlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.application.logging.LoggerConfig;
import ca.gc.cra.fmtlog.application.port.SinkKind;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.infrastructure.metrics.MetricsExporterMode;
import ca.gc.cra.fmtlog.infrastructure.terminal.ColorMode;
import ca.gc.cra.fmtlog.testutil.MemorySink;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FacilityConfigTest {

  @Test
  void defaultsAreInfoAutoColorAndNoLoggers() {
    FacilityConfig config = FacilityConfig.defaults();

    assertEquals(SeverityLevel.INFO, config.defaultLevel());
    assertNull(config.defaultPattern());
    assertEquals(ColorMode.AUTO, config.color());
    assertFalse(config.strict());
    assertEquals(MetricsExporterMode.NONE, config.metricsExporter());
    assertTrue(config.loggers().isEmpty());
  }

  @Test
  void readsDefaultsAndLoggers() {
    FacilityConfig config = FacilityConfig.fromMap(Map.of(
        "defaults.level", "warn",
        "defaults.pattern", "{%name} {%message}",
        "defaults.color", "never",
        "defaults.timeZone", "America/Toronto",
        "defaults.strict", "yes",
        "metrics.exporter", "logging",
        "loggers.net.http.level", "debug",
        "loggers.net.http.sinks", "stdout, stderr_color",
        "loggers.db.pattern", "{%message}"));

    assertEquals(SeverityLevel.WARN, config.defaultLevel());
    assertEquals(ColorMode.NEVER, config.color());
    assertEquals(ZoneId.of("America/Toronto"), config.timeZone());
    assertTrue(config.strict());
    assertEquals(MetricsExporterMode.LOGGING, config.metricsExporter());

    FacilityConfig.LoggerSettings http = config.loggers().get("net.http");
    assertEquals(SeverityLevel.DEBUG, http.level());
    assertEquals("{%name} {%message}", http.pattern());
    assertEquals(List.of(SinkKind.STDOUT, SinkKind.STDERR_COLOR), http.sinks());

    FacilityConfig.LoggerSettings db = config.loggers().get("db");
    assertEquals(SeverityLevel.WARN, db.level());
    assertEquals("{%message}", db.pattern());
    assertEquals(List.of(SinkKind.STDOUT), db.sinks());
  }

  @Test
  void loggerSettingsResolveSinksThroughFactory() {
    MemorySink memory = new MemorySink();
    FacilityConfig.LoggerSettings settings =
        new FacilityConfig.LoggerSettings("app", SeverityLevel.ERROR, null, List.of(SinkKind.STDERR));

    LoggerConfig config = settings.toLoggerConfig(kind -> memory);

    assertEquals("app", config.name());
    assertEquals(SeverityLevel.ERROR, config.threshold());
    assertEquals(List.of(memory), config.sinks());
  }

  @Test
  void rejectsInvalidEntries() {
    assertInvalid(Map.of("defaults.colour", "auto"));
    assertInvalid(Map.of("loggers.app", "x"));
    assertInvalid(Map.of("loggers.app.colour", "red"));
    assertInvalid(Map.of("loggers.app.sinks", "stdout,file"));
    assertInvalid(Map.of("loggers.app.sinks", " , "));
    assertInvalid(Map.of("loggers.bad name.level", "info"));
    assertInvalid(Map.of("defaults.level", "loud"));
    assertInvalid(Map.of("defaults.timeZone", "Mars/Base"));
    assertInvalid(Map.of("defaults.strict", "maybe"));
    assertInvalid(Map.of("metrics.exporter", "otlp"));
  }

  private static void assertInvalid(Map<String, String> values) {
    assertThrows(IllegalArgumentException.class, () -> FacilityConfig.fromMap(values), values.toString());
  }
}
