package ca.gc.cra.fmtlog.infrastructure.sink;

import ca.gc.cra.fmtlog.application.port.SinkFactory;
import ca.gc.cra.fmtlog.application.port.SinkKind;
import ca.gc.cra.fmtlog.application.port.SinkPort;
import java.io.Writer;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SinkFactory} over the process console, caching one sink per {@link SinkKind}.
 *
 * @since 0.1.0
 */
public final class ConsoleSinkFactory implements SinkFactory {
  private final Writer out;
  private final Writer err;
  private final boolean color;
  private final Map<SinkKind, SinkPort> sinks = new EnumMap<>(SinkKind.class);

  /**
   * Creates a factory over the process standard streams.
   *
   * @param color whether color sinks emit escape sequences
   */
  public ConsoleSinkFactory(boolean color) {
    this(ConsoleSink.Streams.stdout(), ConsoleSink.Streams.stderr(), color);
  }

  /**
   * Creates a factory over explicit writers.
   *
   * @param out writer behind {@code stdout} kinds
   * @param err writer behind {@code stderr} kinds
   * @param color whether color sinks emit escape sequences
   */
  public ConsoleSinkFactory(Writer out, Writer err, boolean color) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
    this.color = color;
  }

  @Override
  public synchronized SinkPort sink(SinkKind kind) {
    Objects.requireNonNull(kind, "kind");
    return sinks.computeIfAbsent(kind, this::create);
  }

  private SinkPort create(SinkKind kind) {
    return switch (kind) {
      case STDOUT -> new ConsoleSink(out, kind.id(), true);
      case STDERR -> new ConsoleSink(err, kind.id(), true);
      case STDOUT_COLOR -> new ColorConsoleSink(out, kind.id(), color, true);
      case STDERR_COLOR -> new ColorConsoleSink(err, kind.id(), color, true);
    };
  }
}
