package ca.gc.cra.fmtlog.api;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.application.port.MetricsPort;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.logging.LoggingConfigurator;
import ca.gc.cra.fmtlog.logging.Logs;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a single template from the command line.
 *
 * @since 0.1.0
 */
public final class RenderCli {
  private static final Logger log = LoggerFactory.getLogger(RenderCli.class);
  private static final String NAMED_PREFIX = "named.";
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(\\.\\d*)?[eE][+-]?\\d+)");
  private static final String SUMMARY_USAGE =
      "usage: render template=TEXT [args=A,B,...] [named.KEY=VALUE ...] [zone=ZONE]";
  private static final String HELP_TEXT = """
      fmtlog render

      Usage:
        render template="{:>8.3f} | {}" args=3.14159,done

      Required:
        template=TEXT      Template with {}, {0} or {name} placeholders

      Optional:
        args=A,B,...       Positional arguments, comma separated
        named.KEY=VALUE    Named argument KEY
        zone=ZONE          Time zone for timestamp arguments (default system zone)
        --help             Show this message

      Values are typed by inference: integers, decimals, true/false, ISO-8601 instants, otherwise text.
      """;

  private RenderCli() {}

  /**
   * Renders the template and prints the result.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    ZoneId zone;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      zone = kv.containsKey("zone") ? ZoneId.of(kv.get("zone").trim()) : ZoneId.systemDefault();
    } catch (IllegalArgumentException | DateTimeException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String template = kv.get("template");
    if (template == null) {
      log.error("Missing required argument: template");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<Argument> arguments = new ArrayList<>();
    if (kv.containsKey("args")) {
      for (String token : kv.get("args").split(",", -1)) {
        arguments.add(infer(token));
      }
    }
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      if (entry.getKey().startsWith(NAMED_PREFIX) && entry.getKey().length() > NAMED_PREFIX.length()) {
        String name = entry.getKey().substring(NAMED_PREFIX.length());
        arguments.add(Argument.named(name, infer(entry.getValue())));
      }
    }

    try {
      FormatEngine engine = new FormatEngine(zone, MetricsPort.NO_OP);
      CliPrinter.println(engine.render(template, arguments.toArray(Argument[]::new)));
      return ExitCode.SUCCESS;
    } catch (FormatException ex) {
      log.error("Cannot render '{}' ({}): {}", Logs.truncate(template, 80), ex.kind(), ex.getMessage());
      return ExitCode.FORMAT_ERROR;
    }
  }

  /**
   * Types a command-line value.
   *
   * @param raw value text
   * @return integer, float, boolean, timestamp, or string argument
   */
  static Argument infer(String raw) {
    String value = raw.trim();
    if (INTEGER.matcher(value).matches()) {
      try {
        return Argument.of(Long.parseLong(value));
      } catch (NumberFormatException ex) {
        // beyond the long range; kept as text
        return Argument.of(raw);
      }
    }
    if (FLOAT.matcher(value).matches()) {
      return Argument.of(Double.parseDouble(value));
    }
    if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
      return Argument.of(Boolean.parseBoolean(value));
    }
    if (value.length() > 10 && value.charAt(4) == '-' && value.indexOf('T') == 10) {
      try {
        return Argument.of(Instant.parse(value));
      } catch (DateTimeParseException ex) {
        log.debug("Value {} looks like an instant but does not parse; keeping text", value);
      }
    }
    return Argument.of(raw);
  }
}
