package ca.gc.cra.fmtlog.application.logging;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.application.pattern.PatternRenderer;
import ca.gc.cra.fmtlog.application.port.ClockPort;
import ca.gc.cra.fmtlog.application.port.MetricsPort;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Collaborators shared by every logger of a registry.
 *
 * @param engine message body formatter
 * @param renderer line composer; must wrap {@code engine}
 * @param clock timestamp source
 * @param metrics instrumentation hook
 * @since 0.1.0
 */
public record LoggerRuntime(FormatEngine engine, PatternRenderer renderer, ClockPort clock, MetricsPort metrics) {

  public LoggerRuntime {
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(renderer, "renderer");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a runtime from its primitive settings.
   *
   * @param zone zone for rendered timestamps
   * @param clock timestamp source
   * @param metrics instrumentation hook
   * @return runtime
   */
  public static LoggerRuntime of(ZoneId zone, ClockPort clock, MetricsPort metrics) {
    FormatEngine engine = new FormatEngine(zone, metrics);
    return new LoggerRuntime(engine, new PatternRenderer(engine), clock, metrics);
  }

  /**
   * Returns a runtime using the system zone and clock and no metrics.
   *
   * @return default runtime
   */
  public static LoggerRuntime defaults() {
    return of(ZoneId.systemDefault(), ClockPort.SYSTEM, MetricsPort.NO_OP);
  }
}
