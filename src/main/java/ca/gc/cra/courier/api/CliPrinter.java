package ca.gc.cra.courier.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Console output helper for CLI results.
 *
 * <p>Writes to the stdout file descriptor so results stay separate from log output, which goes to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a formatted line using {@link Locale#ROOT}, so decimal separators do not depend on the host.
   *
   * @param format format string
   * @param args format arguments
   */
  public static void printf(String format, Object... args) {
    writer().println(String.format(Locale.ROOT, format, args));
  }

  /**
   * Prints lines in order.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(List<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
