package ca.gc.cra.fmtlog.infrastructure.sink;

import ca.gc.cra.fmtlog.application.port.SinkPort;
import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * <strong>What:</strong> Base for sinks writing lines to a {@link Writer}.
 * <p><strong>Thread-safety:</strong> Writes synchronize on the writer, so every sink sharing one writer
 * (plain and color sinks over stdout, for instance) emits whole lines.</p>
 * <p><strong>Failure policy:</strong> {@link IOException}s propagate to the logger; nothing is retried.</p>
 *
 * @since 0.1.0
 */
public abstract class WriterSink implements SinkPort {
  /** Terminator appended to every line. */
  public static final String LINE_TERMINATOR = "\n";

  private final Writer out;
  private final String description;
  private final boolean flushEachLine;

  /**
   * Creates a sink.
   *
   * @param out destination; closed by the caller, never by the sink
   * @param description label used in dispatch reports
   * @param flushEachLine whether to flush after every line
   */
  protected WriterSink(Writer out, String description, boolean flushEachLine) {
    this.out = Objects.requireNonNull(out, "out");
    this.description = Objects.requireNonNull(description, "description");
    this.flushEachLine = flushEachLine;
  }

  /**
   * Returns the text written for {@code line}, without terminator.
   *
   * @param line rendered line
   * @return bytes to emit
   */
  protected abstract String textOf(RenderedLine line);

  @Override
  public final void write(RenderedLine line) throws IOException {
    String text = textOf(Objects.requireNonNull(line, "line"));
    synchronized (out) {
      out.write(text);
      out.write(LINE_TERMINATOR);
      if (flushEachLine) {
        out.flush();
      }
    }
  }

  @Override
  public final void flush() throws IOException {
    synchronized (out) {
      out.flush();
    }
  }

  @Override
  public String describe() {
    return description;
  }
}
