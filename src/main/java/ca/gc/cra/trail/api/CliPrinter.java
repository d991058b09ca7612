package ca.gc.cra.trail.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Writes command output to stdout, separate from the SLF4J log stream.
 *
 * <p>Tests swap the writer with {@link #setWriterForTesting(PrintWriter)} to capture output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a formatted line.
   *
   * @param format {@link String#format} pattern
   * @param args pattern arguments
   */
  public static void printf(String format, Object... args) {
    writer().println(String.format(Locale.ROOT, format, args));
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter writer = override;
    return writer != null ? writer : STDOUT;
  }
}
