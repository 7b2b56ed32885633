package ca.gc.cra.fmtlog.infrastructure.sink;

import ca.gc.cra.fmtlog.domain.log.RenderedLine;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Plain text sink. Color hints are ignored and escape sequences carried by styled arguments are stripped,
 * since the sink declares no color support.
 *
 * @since 0.1.0
 */
public final class ConsoleSink extends WriterSink {

  /**
   * Creates a sink over {@code out}.
   *
   * @param out destination writer
   * @param description label used in dispatch reports
   * @param flushEachLine whether to flush after every line
   */
  public ConsoleSink(Writer out, String description, boolean flushEachLine) {
    super(out, description, flushEachLine);
  }

  @Override
  protected String textOf(RenderedLine line) {
    return line.stripped();
  }

  static final class Streams {
    private static final Writer STDOUT =
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8);
    private static final Writer STDERR =
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8);

    private Streams() {
      // Utility
    }

    static Writer stdout() {
      return STDOUT;
    }

    static Writer stderr() {
      return STDERR;
    }
  }
}
