package ca.gc.cra.fmtlog.api;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.application.logging.Logger;
import ca.gc.cra.fmtlog.application.logging.LoggerRegistry;
import ca.gc.cra.fmtlog.application.pattern.PatternSyntax;
import ca.gc.cra.fmtlog.config.CompositionRoot;
import ca.gc.cra.fmtlog.config.FacilityConfig;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.domain.log.SourceLocation;
import ca.gc.cra.fmtlog.domain.style.AnsiEscapes;
import ca.gc.cra.fmtlog.domain.style.Color;
import ca.gc.cra.fmtlog.domain.style.Emphasis;
import ca.gc.cra.fmtlog.domain.style.TextStyle;
import ca.gc.cra.fmtlog.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Walkthrough of the format engine and the logger registry: positional and named arguments, number
 * formatting, styled text, time formatting, default and named loggers, level changes, custom patterns,
 * source location, and a simulated task run.
 *
 * @since 0.1.0
 */
public final class DemoCli {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(DemoCli.class);
  private static final String SUMMARY_USAGE = "usage: demo [config=PATH] [delayMs=N] [--no-color]";
  private static final String HELP_TEXT = """
      fmtlog demo

      Usage:
        demo [options]

      Optional:
        config=PATH   YAML facility configuration
        delayMs=N     Pause between simulated tasks in milliseconds (default 200)
        --no-color    Disable escape sequences regardless of terminal detection
        --verbose     Enable DEBUG diagnostics of the facility
        --help        Show this message
      """;
  private static final long DEFAULT_DELAY_MS = 200;
  private static final String CONSOLE_PATTERN = "[%H:%M:%S.%e] [%^%l%$] [%n] %v";
  private static final List<String> TASKS = List.of("Loading config", "Connecting", "Processing", "Saving");

  private DemoCli() {}

  /**
   * Runs the demo.
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
    long delayMs;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      delayMs = ConfigCliUtils.parseLong(kv, "delayMs", DEFAULT_DELAY_MS);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    FacilityConfig config;
    try {
      config = ConfigCliUtils.loadConfig(ConfigCliUtils.extractConfigPath(kv));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    boolean noColor = input.hasFlag("--no-color");
    try (CompositionRoot root = ConfigCliUtils.consoleRoot(config, noColor)) {
      boolean color = !noColor && ConfigCliUtils.colorEnabled(config);
      showFormatting(new FormatEngine(config.timeZone(), root.metrics()), color);
      showLogging(root.registry(), delayMs);
      return ExitCode.SUCCESS;
    } catch (FormatException ex) {
      log.error("Demo template failed ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.FORMAT_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Demo interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in demo", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void showFormatting(FormatEngine engine, boolean color) {
    CliPrinter.println("=== Formatting ===");
    CliPrinter.println();
    CliPrinter.println(engine.render("Hello, {}!", Argument.of("World")));
    CliPrinter.println(engine.render("{1} comes before {0}", Argument.of("second"), Argument.of("first")));
    CliPrinter.println(engine.render("Name: {name}, Age: {age}",
        Argument.named("name", Argument.of("Alice")),
        Argument.named("age", Argument.of(30))));

    CliPrinter.println(engine.render("Integer: {:>10d}", Argument.of(42)));
    CliPrinter.println(engine.render("Float:   {:>10.2f}", Argument.of(3.14159)));
    CliPrinter.println(engine.render("Hex:     {:#x}", Argument.of(255)));
    CliPrinter.println(engine.render("Binary:  {:#b}", Argument.of(42)));

    printStyled(engine.render("{}", Argument.styled("This is green!", TextStyle.fg(Color.GREEN))), color);
    printStyled(engine.render("{}",
        Argument.styled("This is bold red!", TextStyle.fg(Color.RED).with(Emphasis.BOLD))), color);

    CliPrinter.println(engine.render("Current time: {:%Y-%m-%d %H:%M:%S}", Argument.of(Instant.now())));
    CliPrinter.println();
  }

  static void showLogging(LoggerRegistry registry, long delayMs) throws InterruptedException {
    CliPrinter.println("=== Logging ===");
    CliPrinter.println();

    Logger logger = registry.getOrCreateDefault();
    logger.info("Welcome to fmtlog!");
    logger.warn("This is a warning message");
    logger.error("This is an error message");

    logger.info("Formatted: {} + {} = {}", Argument.of(1), Argument.of(2), Argument.of(3));
    logger.info("Float value: {:.4f}", Argument.of(3.14159265359));

    registry.setLevel(SeverityLevel.DEBUG);
    logger.debug("This debug message is now visible!");
    logger.trace("But trace is still hidden");

    Logger console = registry.find("console").orElseGet(() -> registry.colorConsole("console"));
    console.info("This is from a named logger");
    console.setPattern(PatternSyntax.fromSpdlog(CONSOLE_PATTERN));
    console.info("With custom pattern!");

    logger.log(SeverityLevel.INFO, SourceLocation.here(), "Logging with its call-site location");

    CliPrinter.println();
    CliPrinter.println("=== Simulated processing ===");
    CliPrinter.println();
    for (int i = 0; i < TASKS.size(); i++) {
      logger.info("[{}/{}] {}...", Argument.of(i + 1), Argument.of(TASKS.size()), Argument.of(TASKS.get(i)));
      if (delayMs > 0) {
        Thread.sleep(delayMs);
      }
    }
    logger.info("All tasks completed!");
  }

  private static void printStyled(String text, boolean color) {
    CliPrinter.println(color ? text : AnsiEscapes.strip(text));
  }
}
