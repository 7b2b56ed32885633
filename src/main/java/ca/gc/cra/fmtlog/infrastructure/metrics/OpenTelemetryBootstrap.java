package ca.gc.cra.fmtlog.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.logging.LoggingMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter behind {@link OpenTelemetryMetricsAdapter}.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.fmtlog";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(60);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility
  }

  /**
   * Creates the meter for an exporter mode. Any SDK failure degrades to a noop meter.
   *
   * @param mode exporter selection
   * @return meter handle; noop for {@link MetricsExporterMode#NONE}
   */
  static MeterHandle initialize(MetricsExporterMode mode) {
    Objects.requireNonNull(mode, "mode");
    if (mode == MetricsExporterMode.NONE) {
      log.debug("Metrics export disabled");
      return MeterHandle.noop();
    }
    try {
      MeterHandle handle = build(PeriodicMetricReader.builder(LoggingMetricExporter.create())
          .setInterval(EXPORT_INTERVAL)
          .build());
      log.info("Metrics export enabled ({}, every {}s)", mode, EXPORT_INTERVAL.toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Cannot start metrics export; metrics are discarded", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static MeterHandle build(MetricReader reader) {
    String version = implementationVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), "fmtlog",
        AttributeKey.stringKey("service.version"), version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String implementationVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  private static void await(CompletableResultCode result, String action) {
    result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      log.warn("Metrics {} did not complete within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
    }
  }

  /**
   * Meter plus the SDK provider that owns it; {@code provider} is {@code null} for the noop meter.
   */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    MeterHandle {
      Objects.requireNonNull(meter, "meter");
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(SCOPE), null);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("Meter provider shutdown failed", ex);
      }
    }
  }
}
