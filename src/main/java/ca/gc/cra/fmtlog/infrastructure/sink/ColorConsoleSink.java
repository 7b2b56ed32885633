package ca.gc.cra.fmtlog.infrastructure.sink;

import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import java.io.Writer;

/**
 * Sink honoring color hints.
 *
 * <p>Color capability is decided once, at construction. When enabled, the hinted range is wrapped in its
 * style's escape sequences; when disabled, every escape sequence is stripped, including those embedded by
 * styled arguments.</p>
 *
 * @since 0.1.0
 */
public final class ColorConsoleSink extends WriterSink {
  private final boolean color;

  /**
   * Creates a sink over {@code out}.
   *
   * @param out destination writer
   * @param description label used in dispatch reports
   * @param color whether escape sequences are emitted
   * @param flushEachLine whether to flush after every line
   */
  public ColorConsoleSink(Writer out, String description, boolean color, boolean flushEachLine) {
    super(out, description, flushEachLine);
    this.color = color;
  }

  @Override
  public boolean supportsColor() {
    return color;
  }

  @Override
  protected String textOf(RenderedLine line) {
    return color ? line.colorized() : line.stripped();
  }
}
