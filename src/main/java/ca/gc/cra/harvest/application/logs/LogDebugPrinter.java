package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints a packaged batch for manual inspection instead of sending it.
 *
 * @since 0.1.0
 */
public final class LogDebugPrinter {
  private final PrintWriter out;

  /** Prints to standard output. */
  public LogDebugPrinter() {
    this(new PrintWriter(new OutputStreamWriter(
        new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true));
  }

  public LogDebugPrinter(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * Prints every output line sliced from the packaged content, followed by line metadata and samples.
   *
   * @param sectionName server the batch belongs to
   * @param state batch envelope
   * @throws IOException if the packaged content cannot be read back
   */
  public void print(String sectionName, LogState state) throws IOException {
    out.println("Would have sent log state for [" + sectionName + "] collected at " + state.collectedAt());
    if (state.logFile().isPresent()) {
      LogFile logFile = state.logFile().get();
      byte[] content = logFile.readContent();
      for (LogLine line : logFile.lines()) {
        out.printf(Locale.ROOT, "  [pid %d] %s %s (%s) bytes %d-%d: %s%n",
            line.backendPid(), line.collectedAt(), line.level(), line.classification(),
            line.byteStart(), line.byteEnd(), slice(content, line));
        if (!line.details().isEmpty()) {
          out.println("    details " + line.details());
        }
      }
    }
    for (QuerySample sample : state.querySamples()) {
      out.printf(Locale.ROOT, "  sample %s %s@%s %.3f ms: %s%n",
          sample.occurredAt(), sample.username(), sample.database(), sample.runtimeMs(), sample.query());
    }
    out.flush();
  }

  private static String slice(byte[] content, LogLine line) {
    if (!line.hasByteRange()) {
      return "<unwritten>";
    }
    long start = line.byteStart();
    long end = line.byteEnd();
    if (end == start - 1) {
      return "";
    }
    if (end < start || end >= content.length) {
      return "<unwritten>";
    }
    return new String(Arrays.copyOfRange(content, (int) start, (int) end + 1), StandardCharsets.UTF_8);
  }
}
