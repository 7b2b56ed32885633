package ca.gc.cra.fmtlog.config;

import ca.gc.cra.fmtlog.application.logging.LoggerRegistry;
import ca.gc.cra.fmtlog.application.logging.LoggerRuntime;
import ca.gc.cra.fmtlog.application.logging.RegistrationMode;
import ca.gc.cra.fmtlog.application.port.ClockPort;
import ca.gc.cra.fmtlog.application.port.MetricsPort;
import ca.gc.cra.fmtlog.application.port.SinkFactory;
import ca.gc.cra.fmtlog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.fmtlog.infrastructure.sink.ConsoleSinkFactory;
import ca.gc.cra.fmtlog.infrastructure.terminal.TerminalColorDetector;
import ca.gc.cra.fmtlog.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link LoggerRegistry} from a {@link FacilityConfig}.
 * <p><strong>Why:</strong> Single place translating configuration into clocks, sinks, metrics, and
 * registered loggers.</p>
 * <p><strong>Role:</strong> Composition root used by the CLI and by {@link DefaultRegistry}.</p>
 * <p><strong>Thread-safety:</strong> Intended for startup; {@link #registry()} builds once and caches.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and closes it in {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final FacilityConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SinkFactory sinkFactory;
  private LoggerRegistry registry;

  /**
   * Creates a root over the process console, the system clock, and the configured metrics exporter.
   *
   * @param config facility configuration
   */
  public CompositionRoot(FacilityConfig config) {
    this(config,
        new SystemClockAdapter(),
        new OpenTelemetryMetricsAdapter(config.metricsExporter()),
        new ConsoleSinkFactory(config.color().enabled(TerminalColorDetector.system())));
  }

  /**
   * Creates a root over explicit collaborators.
   *
   * @param config facility configuration
   * @param clock timestamp source
   * @param metrics instrumentation hook
   * @param sinkFactory sink resolver
   */
  public CompositionRoot(FacilityConfig config, ClockPort clock, MetricsPort metrics, SinkFactory sinkFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
  }

  /**
   * Returns the registry, building it on first call with every configured logger registered.
   *
   * @return registry
   * @throws ca.gc.cra.fmtlog.domain.format.FormatException when a configured pattern is invalid
   */
  public synchronized LoggerRegistry registry() {
    if (registry == null) {
      LoggerRegistry created = new LoggerRegistry(
          LoggerRuntime.of(config.timeZone(), clock, metrics), sinkFactory);
      RegistrationMode mode = config.strict() ? RegistrationMode.STRICT : RegistrationMode.REPLACE;
      for (FacilityConfig.LoggerSettings settings : config.loggers().values()) {
        created.register(settings.toLoggerConfig(sinkFactory), mode);
      }
      log.debug("Registry wired with {} configured logger(s)", config.loggers().size());
      registry = created;
    }
    return registry;
  }

  public FacilityConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SinkFactory sinkFactory() {
    return sinkFactory;
  }

  /**
   * Flushes every logger and releases the metrics exporter.
   */
  @Override
  public synchronized void close() {
    if (registry != null) {
      registry.flushAll();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
