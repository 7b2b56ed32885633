package ca.gc.cra.fmtlog.infrastructure.metrics;

import ca.gc.cra.fmtlog.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter forwarding facility counters (render calls, filtered and dispatched messages, sink failures)
 * to OpenTelemetry instruments, one instrument per metric key.
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("fmtlog.metric.key");
  private static final String METRIC_PREFIX = "fmtlog.";

  private final MetricsPort delegate;
  private final OpenTelemetryBootstrap.MeterHandle bootstrap;

  /**
   * Creates an adapter exporting through {@code mode}.
   *
   * @param mode exporter selection
   */
  public OpenTelemetryMetricsAdapter(MetricsExporterMode mode) {
    this(OpenTelemetryBootstrap.initialize(mode));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = MetricsPort.NO_OP;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes pending exports and shuts the meter provider down.
   */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  static String instrumentName(String key) {
    return METRIC_PREFIX + key;
  }

  private static final class OtelDelegate implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      CounterInstrument instrument =
          counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      HistogramInstrument instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      LongCounter counter = meter
          .counterBuilder(instrumentName(key))
          .setUnit("1")
          .setDescription("fmtlog counter for " + key)
          .build();
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      LongHistogram histogram = meter
          .histogramBuilder(instrumentName(key))
          .ofLongs()
          .setDescription("fmtlog observation for " + key)
          .build();
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
