package ca.gc.cra.stepfrag.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Stdout writer for CLI output: usage text, profile reports and the conversion result line.
 *
 * <p>Writes straight to the stdout file descriptor so that nothing but CLI output reaches stdout; log output is
 * routed to stderr by {@code logback.xml}.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line and flushes.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints lines in order and flushes once.
   *
   * @param lines lines to emit; {@code null} is ignored
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
