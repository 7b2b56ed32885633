package ca.gc.cra.fmtlog.config;

import ca.gc.cra.fmtlog.application.logging.LoggerConfig;
import ca.gc.cra.fmtlog.application.port.SinkFactory;
import ca.gc.cra.fmtlog.application.port.SinkKind;
import ca.gc.cra.fmtlog.application.port.SinkPort;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.infrastructure.metrics.MetricsExporterMode;
import ca.gc.cra.fmtlog.infrastructure.terminal.ColorMode;
import ca.gc.cra.fmtlog.validation.Strings;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed facility configuration: defaults applied to every configured logger, the metrics
 * exporter, and the per-logger settings.
 * <p><strong>Why:</strong> Separates parsing of the flat YAML keys from wiring in {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param defaultLevel threshold for loggers that set none
 * @param defaultPattern pattern for loggers that set none; {@code null} selects the built-in pattern
 * @param color color policy of the color sinks
 * @param timeZone zone used to render {@code {%time}} and timestamp arguments
 * @param strict whether configured loggers are registered strictly
 * @param metricsExporter metrics export destination
 * @param loggers per-logger settings in document order
 * @since 0.1.0
 */
public record FacilityConfig(
    SeverityLevel defaultLevel,
    String defaultPattern,
    ColorMode color,
    ZoneId timeZone,
    boolean strict,
    MetricsExporterMode metricsExporter,
    Map<String, LoggerSettings> loggers) {

  private static final String LOGGERS_PREFIX = "loggers.";

  public FacilityConfig {
    Objects.requireNonNull(defaultLevel, "defaultLevel");
    Objects.requireNonNull(color, "color");
    Objects.requireNonNull(timeZone, "timeZone");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    loggers = Collections.unmodifiableMap(new LinkedHashMap<>(loggers));
  }

  /**
   * Returns the configuration used when no file is supplied.
   *
   * @return INFO threshold, built-in pattern, automatic color, system zone, no metrics, no loggers
   */
  public static FacilityConfig defaults() {
    return new FacilityConfig(SeverityLevel.INFO, null, ColorMode.AUTO, ZoneId.systemDefault(), false,
        MetricsExporterMode.NONE, Map.of());
  }

  /**
   * Builds a configuration from flattened YAML keys.
   *
   * @param values flat map produced by {@link YamlConfigLoader}
   * @return configuration
   * @throws IllegalArgumentException for unknown keys or invalid values
   */
  public static FacilityConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    FacilityConfig base = defaults();
    SeverityLevel level = base.defaultLevel();
    String pattern = null;
    ColorMode color = base.color();
    ZoneId zone = base.timeZone();
    boolean strict = false;
    MetricsExporterMode exporter = base.metricsExporter();
    Map<String, Map<String, String>> loggerKeys = new LinkedHashMap<>();

    for (Map.Entry<String, String> entry : values.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue().trim();
      switch (key) {
        case "defaults.level" -> level = SeverityLevel.parse(value);
        case "defaults.pattern" -> pattern = value.isEmpty() ? null : value;
        case "defaults.color" -> color = ColorMode.from(value);
        case "defaults.timeZone" -> zone = parseZone(value);
        case "defaults.strict" -> strict = parseBoolean(key, value);
        case "metrics.exporter" -> exporter = MetricsExporterMode.from(value);
        default -> {
          if (!key.startsWith(LOGGERS_PREFIX) || key.lastIndexOf('.') <= LOGGERS_PREFIX.length()) {
            throw new IllegalArgumentException("unknown configuration key: " + key);
          }
          int split = key.lastIndexOf('.');
          String name = Strings.sanitizeLoggerName(key.substring(LOGGERS_PREFIX.length(), split));
          loggerKeys.computeIfAbsent(name, ignored -> new LinkedHashMap<>())
              .put(key.substring(split + 1), value);
        }
      }
    }

    Map<String, LoggerSettings> loggers = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, String>> entry : loggerKeys.entrySet()) {
      loggers.put(entry.getKey(), LoggerSettings.from(entry.getKey(), entry.getValue(), level, pattern));
    }
    return new FacilityConfig(level, pattern, color, zone, strict, exporter, loggers);
  }

  private static ZoneId parseZone(String value) {
    if (value.isEmpty()) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(value);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("invalid timeZone: " + value, ex);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off", "" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false: " + value);
    };
  }

  /**
   * Settings of one configured logger, with defaults already applied.
   *
   * @param name logger name
   * @param level threshold
   * @param pattern pattern, {@code null} for the built-in one
   * @param sinks sink kinds in dispatch order
   */
  public record LoggerSettings(String name, SeverityLevel level, String pattern, List<SinkKind> sinks) {

    public LoggerSettings {
      name = Strings.sanitizeLoggerName(name);
      Objects.requireNonNull(level, "level");
      sinks = List.copyOf(sinks);
    }

    static LoggerSettings from(
        String name, Map<String, String> keys, SeverityLevel defaultLevel, String defaultPattern) {
      SeverityLevel level = defaultLevel;
      String pattern = defaultPattern;
      List<SinkKind> sinks = List.of(SinkKind.STDOUT);
      for (Map.Entry<String, String> entry : keys.entrySet()) {
        String value = entry.getValue();
        switch (entry.getKey()) {
          case "level" -> level = SeverityLevel.parse(value);
          case "pattern" -> pattern = value.isEmpty() ? defaultPattern : value;
          case "sinks" -> sinks = parseSinks(name, value);
          default -> throw new IllegalArgumentException(
              "unknown setting '" + entry.getKey() + "' for logger " + name);
        }
      }
      return new LoggerSettings(name, level, pattern, sinks);
    }

    private static List<SinkKind> parseSinks(String name, String value) {
      List<SinkKind> kinds = new ArrayList<>();
      for (String token : value.split(",")) {
        if (!token.isBlank()) {
          kinds.add(SinkKind.fromId(token));
        }
      }
      if (kinds.isEmpty()) {
        throw new IllegalArgumentException("logger " + name + " must name at least one sink");
      }
      return kinds;
    }

    /**
     * Resolves sink kinds and returns the logger configuration.
     *
     * @param factory sink resolver
     * @return logger configuration
     */
    public LoggerConfig toLoggerConfig(SinkFactory factory) {
      List<SinkPort> resolved = new ArrayList<>(sinks.size());
      for (SinkKind kind : sinks) {
        resolved.add(factory.sink(kind));
      }
      return new LoggerConfig(name, level, pattern, resolved);
    }
  }
}
