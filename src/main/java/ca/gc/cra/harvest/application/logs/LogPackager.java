package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes joined line content into one packaged store and stamps each line's byte range.
 * <p><strong>Why:</strong> The backend receives one concatenated buffer per batch and slices every line out of it
 * by offset.</p>
 * <p><strong>Role:</strong> Packaging stage of the log pipeline, run once per batch before analysis.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote A write failure stops further writes but not the batch. Lines not reached carry
 * {@link LogLine#NO_OFFSET} in every range field and {@link PackagedBatch#degraded()} flags the batch.
 * @since 0.1.0
 */
public final class LogPackager {
  private static final Logger log = LoggerFactory.getLogger(LogPackager.class);

  /**
   * Writes every line, in the given order, to {@code logFile}.
   *
   * @param logFile store allocated for this batch
   * @param lines joined lines in arrival order
   * @return lines with byte ranges assigned, plus write statistics
   */
  public PackagedBatch pack(LogFile logFile, List<LogLine> lines) {
    Objects.requireNonNull(logFile, "logFile");
    Objects.requireNonNull(lines, "lines");
    List<LogLine> packaged = new ArrayList<>(lines.size());
    long offset = logFile.size();
    long startOffset = offset;
    int written = 0;
    IOException failure = null;
    for (LogLine line : lines) {
      if (failure != null) {
        packaged.add(line.withoutByteRange());
        continue;
      }
      try {
        int length = logFile.append(line.content());
        packaged.add(line.withByteRange(offset, offset, offset + length - 1));
        offset += length;
        written++;
      } catch (IOException ex) {
        failure = ex;
        log.error("Failed to write log content to {}; {} line(s) already written, continuing without the rest",
            logFile.uuid(), written, ex);
        packaged.add(line.withoutByteRange());
      }
    }
    return new PackagedBatch(List.copyOf(packaged), written, offset - startOffset, failure);
  }

  /**
   * Outcome of {@link #pack(LogFile, List)}.
   *
   * @param lines lines in write order; unwritten ones carry no byte range
   * @param linesWritten number of lines whose content reached the store
   * @param bytesWritten number of bytes appended
   * @param failure write failure that stopped packaging; {@code null} when every line was written
   */
  public record PackagedBatch(List<LogLine> lines, int linesWritten, long bytesWritten, IOException failure) {

    public Optional<IOException> writeFailure() {
      return Optional.ofNullable(failure);
    }

    public boolean degraded() {
      return failure != null;
    }
  }
}
