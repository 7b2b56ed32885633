package ca.gc.cra.fmtlog.api;

import ca.gc.cra.fmtlog.application.logging.Logger;
import ca.gc.cra.fmtlog.config.CompositionRoot;
import ca.gc.cra.fmtlog.config.FacilityConfig;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.logging.LoggingConfigurator;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Minimal application start-up: a greeting through the engine, two log lines, the application descriptor
 * as JSON, and the start-up confirmation.
 *
 * @since 0.1.0
 */
public final class BasicCli {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(BasicCli.class);
  private static final String SUMMARY_USAGE = "usage: basic [config=PATH] [name=NAME] [version=VERSION]";
  private static final String HELP_TEXT = """
      fmtlog basic

      Usage:
        basic [options]

      Optional:
        config=PATH       YAML facility configuration
        name=NAME         Application name (default my_app)
        version=VERSION   Application version (default 1.0.0)
        --verbose         Enable DEBUG diagnostics of the facility
        --help            Show this message
      """;
  private static final List<String> FEATURES = List.of("logging", "json", "formatting");

  private BasicCli() {}

  /**
   * Runs the basic start-up sequence.
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
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String name = kv.getOrDefault("name", "my_app").trim();
    String version = kv.getOrDefault("version", "1.0.0").trim();

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

    try (CompositionRoot root = ConfigCliUtils.consoleRoot(config, input.hasFlag("--no-color"))) {
      CliPrinter.println("Hello from the format engine!");
      Logger logger = root.registry().getOrCreateDefault();
      logger.info("Hello from the logger!");
      logger.warn("This is a warning");

      CliPrinter.println("Config: " + describe(name, version, FEATURES));

      logger.info("Application {} v{} started successfully", Argument.of(name), Argument.of(version));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to serialize application descriptor", ex);
      return ExitCode.IO_ERROR;
    } catch (FormatException ex) {
      log.error("Template failed ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.FORMAT_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }

  /**
   * Serializes the application descriptor as indented JSON.
   *
   * @param name application name
   * @param version application version
   * @param features feature names
   * @return pretty-printed JSON object
   * @throws IOException when the generator fails
   */
  static String describe(String name, String version, List<String> features) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = new JsonFactory().createGenerator(out)) {
      generator.useDefaultPrettyPrinter();
      generator.writeStartObject();
      generator.writeArrayFieldStart("features");
      for (String feature : features) {
        generator.writeString(feature);
      }
      generator.writeEndArray();
      generator.writeStringField("name", name);
      generator.writeStringField("version", version);
      generator.writeEndObject();
    }
    return out.toString();
  }
}
