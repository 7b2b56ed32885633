package ca.gc.cra.fmtlog.application.pattern;

import ca.gc.cra.fmtlog.application.format.FormatEngine;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Binding;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Placeholder;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Segment;
import ca.gc.cra.fmtlog.domain.log.ColorHint;
import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import ca.gc.cra.fmtlog.domain.log.SeverityLevel;
import ca.gc.cra.fmtlog.domain.log.SourceLocation;
import ca.gc.cra.fmtlog.logging.Logs;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composes complete log lines from a pattern and the reserved fields
 * {@code {%time}}, {@code {%level}}, {@code {%name}}, {@code {%message}} and {@code {%source}}.
 * <p><strong>Why:</strong> Keeps line layout separate from message formatting while reusing the same engine,
 * so pattern fields accept ordinary specifiers such as {@code {%time:%H:%M:%S}} or {@code {%name:>12}}.</p>
 * <p><strong>Role:</strong> Application service between loggers and sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate patterns once, at configuration time, through {@link #compile(String)}.</li>
 *   <li>Render the {@code {%level}} field as a fixed-width short code and mark its range for coloring.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see PatternSyntax
 */
public final class PatternRenderer {
  private static final Logger log = LoggerFactory.getLogger(PatternRenderer.class);

  /** Timestamp of the logging call. */
  public static final String TIME = "%time";
  /** Fixed-width short level code. */
  public static final String LEVEL = "%level";
  /** Logger name. */
  public static final String NAME = "%name";
  /** Formatted message body. */
  public static final String MESSAGE = "%message";
  /** Call-site location, empty when the call supplied none. */
  public static final String SOURCE = "%source";
  /** Field names a pattern may reference. */
  public static final Set<String> RESERVED = Set.of(TIME, LEVEL, NAME, MESSAGE, SOURCE);
  /** Pattern used when a logger configures none. */
  public static final String DEFAULT_PATTERN = "[{%time:%Y-%m-%d %H:%M:%S.%e}] [{%level}] {%message}";

  private static final int LEVEL_ARGUMENT = 1;
  private static final SourceLocation SAMPLE_SOURCE = new SourceLocation("Sample.java", 1, "sample");

  private final FormatEngine engine;
  private final LevelColorPolicy colors;

  /**
   * Creates a renderer with the default level palette.
   *
   * @param engine engine used for every line
   */
  public PatternRenderer(FormatEngine engine) {
    this(engine, LevelColorPolicy.defaults());
  }

  /**
   * Creates a renderer.
   *
   * @param engine engine used for every line
   * @param colors level-to-style policy
   */
  public PatternRenderer(FormatEngine engine, LevelColorPolicy colors) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.colors = Objects.requireNonNull(colors, "colors");
  }

  /**
   * Validates a pattern and returns its compiled form.
   *
   * @param pattern pattern text
   * @return compiled pattern
   * @throws FormatException when the pattern is malformed, references a non-reserved field, uses automatic or
   *     positional placeholders, or fails a trial render
   */
  public CompiledPattern compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    try {
      FormatTemplate template = FormatTemplate.parse(pattern);
      for (Segment segment : template.segments()) {
        if (!(segment instanceof Placeholder placeholder)) {
          continue;
        }
        if (placeholder.binding() != Binding.NAMED) {
          throw new FormatException(FormatException.Kind.MALFORMED_SPECIFIER,
              "pattern placeholders must name a field such as {%message}: '" + pattern + "'");
        }
        if (!RESERVED.contains(placeholder.name())) {
          throw new FormatException(FormatException.Kind.UNRESOLVED_PLACEHOLDER,
              "unknown pattern field {" + placeholder.name() + "} in '" + pattern + "'");
        }
      }
      engine.render(template,
          fields(Instant.EPOCH, SeverityLevel.INFO, "sample", "sample", SAMPLE_SOURCE.render()));
      return new CompiledPattern(pattern, template, template.placeholderNames().contains(SOURCE));
    } catch (FormatException ex) {
      log.debug("Rejected log pattern '{}': {}", Logs.truncate(pattern, 120), ex.getMessage());
      throw ex;
    }
  }

  /**
   * Renders a line without call-site location.
   *
   * @param pattern compiled pattern
   * @param level message level
   * @param loggerName logger name
   * @param message formatted message body
   * @param now timestamp of the call
   * @return rendered line, without terminator
   */
  public RenderedLine renderLine(
      CompiledPattern pattern, SeverityLevel level, String loggerName, String message, Instant now) {
    return renderLine(pattern, level, loggerName, message, now, SourceLocation.UNKNOWN);
  }

  /**
   * Renders a line.
   *
   * @param pattern compiled pattern
   * @param level message level
   * @param loggerName logger name
   * @param message formatted message body
   * @param now timestamp of the call
   * @param source call-site location; rendered only when the pattern includes {@code {%source}}
   * @return rendered line, without terminator, with the level range as color hint
   */
  public RenderedLine renderLine(
      CompiledPattern pattern,
      SeverityLevel level,
      String loggerName,
      String message,
      Instant now,
      SourceLocation source) {
    FormatEngine.Rendering rendering =
        engine.renderTracked(pattern.template(), fields(now, level, loggerName, message,
            pattern.usesSource() && source != null ? source.render() : ""));
    ColorHint hint = rendering.spanOf(LEVEL_ARGUMENT)
        .map(span -> new ColorHint(span.start(), span.end(), colors.styleFor(level)))
        .orElse(ColorHint.NONE);
    return new RenderedLine(rendering.text(), hint);
  }

  private static List<Argument> fields(
      Instant now, SeverityLevel level, String loggerName, String message, String sourceText) {
    return List.of(
        Argument.of(now).withName(TIME),
        Argument.of(level.paddedCode()).withName(LEVEL),
        Argument.of(loggerName).withName(NAME),
        Argument.of(message).withName(MESSAGE),
        Argument.of(sourceText).withName(SOURCE));
  }
}
