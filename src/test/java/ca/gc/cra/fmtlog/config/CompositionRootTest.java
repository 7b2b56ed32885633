package ca.gc.cra.fmtlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.application.logging.Logger;
import ca.gc.cra.fmtlog.application.logging.LoggerRegistry;
import ca.gc.cra.fmtlog.application.port.ClockPort;
import ca.gc.cra.fmtlog.application.port.SinkKind;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.testutil.MemorySink;
import ca.gc.cra.fmtlog.testutil.RecordingMetricsPort;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final Instant NOW = Instant.parse("2024-07-01T16:00:00Z");

  private final Map<SinkKind, MemorySink> sinks = new EnumMap<>(SinkKind.class);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private CompositionRoot root(String yaml) {
    FacilityConfig config = FacilityConfig.fromMap(YamlConfigLoader.parse(yaml));
    return new CompositionRoot(config, ClockPort.fixed(NOW), metrics,
        kind -> sinks.computeIfAbsent(kind, k -> new MemorySink()));
  }

  @Test
  void registersConfiguredLoggers() {
    try (CompositionRoot root = root("""
        defaults:
          timeZone: America/Toronto
        loggers:
          audit:
            level: warn
            pattern: "{%time:%H:%M} {%name} {%level} {%message}"
            sinks: stderr
        """)) {
      LoggerRegistry registry = root.registry();
      Logger audit = registry.lookup("audit");

      audit.info("hidden");
      audit.warn("user {} locked", Argument.of("bob"));

      assertEquals(SeverityLevel.WARN, audit.level());
      assertEquals(List.of("12:00 audit WARN  user bob locked"), sinks.get(SinkKind.STDERR).texts());
      assertTrue(metrics.count(FormatEngine.RENDER_METRIC) > 0);
    }
  }

  @Test
  void registryIsBuiltOnce() {
    try (CompositionRoot root = root("")) {
      assertSame(root.registry(), root.registry());
      assertTrue(root.registry().names().isEmpty());
    }
  }

  @Test
  void closeFlushesEverySink() {
    CompositionRoot root = root("""
        loggers:
          a:
            sinks: stdout
          b:
            sinks: stdout, stderr
        """);
    root.registry();

    root.close();

    assertEquals(2, sinks.get(SinkKind.STDOUT).flushes());
    assertEquals(1, sinks.get(SinkKind.STDERR).flushes());
  }

  @Test
  void productionWiringStartsWithoutExporter() {
    try (CompositionRoot root = new CompositionRoot(FacilityConfig.defaults())) {
      assertTrue(root.registry().find("missing").isEmpty());
      assertEquals(FacilityConfig.defaults().metricsExporter(), root.config().metricsExporter());
    }
  }
}
