package ca.gc.cra.fmtlog.application.format;

import ca.gc.cra.fmtlog.application.port.MetricsPort;
import ca.gc.cra.fmtlog.domain.format.Argument;
import ca.gc.cra.fmtlog.domain.format.FormatException;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Literal;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Placeholder;
import ca.gc.cra.fmtlog.domain.format.FormatTemplate.Segment;
import ca.gc.cra.fmtlog.domain.format.ValueFormatter;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Renders format templates against tagged argument lists.
 * <p><strong>Why:</strong> Single rendering path shared by message bodies and log line patterns.</p>
 * <p><strong>Role:</strong> Application service with no dependency on loggers or sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve each placeholder by explicit index, explicit name, or the next automatic slot.</li>
 *   <li>Apply specifiers through {@link ValueFormatter}.</li>
 *   <li>Count every invocation under {@link #RENDER_METRIC}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 * <p><strong>Failure atomicity:</strong> Output is assembled in a private buffer and only returned on success;
 * a {@link FormatException} never leaves partial text behind.</p>
 *
 * @since 0.1.0
 */
public final class FormatEngine {
  /** Counter incremented once per render call. */
  public static final String RENDER_METRIC = "format.render.calls";

  private final ZoneId zone;
  private final MetricsPort metrics;

  /**
   * Creates an engine using the system time zone and no metrics.
   */
  public FormatEngine() {
    this(ZoneId.systemDefault(), MetricsPort.NO_OP);
  }

  /**
   * Creates an engine.
   *
   * @param zone zone used for every timestamp this engine renders
   * @param metrics instrumentation hook; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public FormatEngine(ZoneId zone, MetricsPort metrics) {
    this.zone = Objects.requireNonNull(zone, "zone");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Parses and renders {@code template}.
   *
   * @param template template text
   * @param args arguments in positional order
   * @return rendered text
   * @throws FormatException when the template is malformed or cannot be resolved against {@code args}
   */
  public String render(String template, Argument... args) {
    return render(FormatTemplate.parse(template), List.of(args));
  }

  /**
   * Renders a parsed template.
   *
   * @param template parsed template
   * @param args arguments in positional order
   * @return rendered text
   * @throws FormatException when a placeholder cannot be resolved or its specifier does not apply
   */
  public String render(FormatTemplate template, List<Argument> args) {
    return renderTracked(template, args).text();
  }

  /**
   * Renders a parsed template and reports where each placeholder landed in the output.
   *
   * @param template parsed template
   * @param args arguments in positional order
   * @return rendered text with placeholder spans
   * @throws FormatException when a placeholder cannot be resolved or its specifier does not apply
   */
  public Rendering renderTracked(FormatTemplate template, List<Argument> args) {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(args, "args");
    metrics.increment(RENDER_METRIC);

    StringBuilder out = new StringBuilder(template.source().length() + 16 * args.size());
    List<Span> spans = new ArrayList<>();
    for (Segment segment : template.segments()) {
      if (segment instanceof Literal literal) {
        out.append(literal.text());
      } else if (segment instanceof Placeholder placeholder) {
        int argumentIndex = resolve(template, placeholder, args);
        int start = out.length();
        out.append(ValueFormatter.format(args.get(argumentIndex), placeholder.spec(), zone));
        spans.add(new Span(argumentIndex, start, out.length()));
      }
    }
    return new Rendering(out.toString(), List.copyOf(spans));
  }

  /**
   * Returns the zone used for timestamps.
   *
   * @return configured zone
   */
  public ZoneId zone() {
    return zone;
  }

  private static int resolve(FormatTemplate template, Placeholder placeholder, List<Argument> args) {
    switch (placeholder.binding()) {
      case AUTOMATIC, POSITIONAL -> {
        if (placeholder.index() >= args.size()) {
          throw new FormatException(
              FormatException.Kind.ARGUMENT_INDEX_OUT_OF_RANGE,
              "argument index " + placeholder.index() + " out of range (" + args.size()
                  + " supplied) in '" + template.source() + "'");
        }
        return placeholder.index();
      }
      case NAMED -> {
        for (int i = 0; i < args.size(); i++) {
          if (args.get(i).isNamed() && placeholder.name().equals(args.get(i).name())) {
            return i;
          }
        }
        throw new FormatException(
            FormatException.Kind.UNRESOLVED_PLACEHOLDER,
            "no argument named '" + placeholder.name() + "' for '" + template.source() + "'");
      }
      default -> throw new IllegalStateException("unexpected binding " + placeholder.binding());
    }
  }

  /**
   * Output range produced by one placeholder.
   *
   * @param argumentIndex index of the argument rendered
   * @param start inclusive start offset in the output
   * @param end exclusive end offset in the output
   */
  public record Span(int argumentIndex, int start, int end) {}

  /**
   * Rendered text plus the span of every placeholder in template order.
   *
   * @param text rendered text
   * @param spans placeholder spans
   */
  public record Rendering(String text, List<Span> spans) {
    /**
     * Returns the first span that rendered the given argument.
     *
     * @param argumentIndex argument index
     * @return matching span, if the argument was used
     */
    public Optional<Span> spanOf(int argumentIndex) {
      for (Span span : spans) {
        if (span.argumentIndex() == argumentIndex) {
          return Optional.of(span);
        }
      }
      return Optional.empty();
    }
  }
}
