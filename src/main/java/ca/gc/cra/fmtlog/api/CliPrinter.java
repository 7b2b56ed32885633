package ca.gc.cra.fmtlog.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper shared by CLI text and the console sinks the CLI wires.
 *
 * <p>Writes to the native stdout descriptor rather than {@code System.out}; tests substitute a writer.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout, terminated by {@code \n} like the console sinks.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    synchronized (writer) {
      writer.print(message);
      writer.print('\n');
      writer.flush();
    }
  }

  /**
   * Prints an empty line.
   */
  public static void println() {
    println("");
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  /**
   * Resolves the active writer, preferring a test override.
   *
   * @return writer used for CLI output
   */
  static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
