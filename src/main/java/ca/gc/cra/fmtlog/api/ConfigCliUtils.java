package ca.gc.cra.fmtlog.api;

import ca.gc.cra.fmtlog.config.CompositionRoot;
import ca.gc.cra.fmtlog.config.FacilityConfig;
import ca.gc.cra.fmtlog.config.YamlConfigLoader;
import ca.gc.cra.fmtlog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.fmtlog.infrastructure.sink.ConsoleSinkFactory;
import ca.gc.cra.fmtlog.infrastructure.terminal.TerminalColorDetector;
import ca.gc.cra.fmtlog.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for loading configuration and wiring the facility from CLI arguments.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads the facility configuration.
   *
   * @param configPath YAML path, or {@code null} for defaults
   * @return configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the file is missing or invalid
   */
  static FacilityConfig loadConfig(String configPath) throws IOException {
    if (configPath == null) {
      return FacilityConfig.defaults();
    }
    Path path = Path.of(configPath);
    Map<String, String> values = YamlConfigLoader.load(path)
        .orElseThrow(() -> new IllegalArgumentException("Configuration file does not exist: " + path));
    return FacilityConfig.fromMap(values);
  }

  /**
   * Wires a composition root whose console sinks share the CLI writer.
   *
   * @param config facility configuration
   * @param noColor whether color is forced off
   * @return composition root; the caller closes it
   */
  static CompositionRoot consoleRoot(FacilityConfig config, boolean noColor) {
    boolean color = !noColor && colorEnabled(config);
    return new CompositionRoot(
        config,
        new SystemClockAdapter(),
        new OpenTelemetryMetricsAdapter(config.metricsExporter()),
        new ConsoleSinkFactory(CliPrinter.writer(), CliPrinter.writer(), color));
  }

  static boolean colorEnabled(FacilityConfig config) {
    return config.color().enabled(TerminalColorDetector.system());
  }

  static long parseLong(Map<String, String> map, String key, long defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      if (parsed < 0) {
        throw new IllegalArgumentException(key + " must not be negative");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer: " + value, ex);
    }
  }
}
