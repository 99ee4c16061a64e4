package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Repairs log lines whose origin markers could not be parsed.
 * <p><strong>Why:</strong> Some log sources (notably the server's own logging collector writing to files) emit
 * continuation text without level or backend id; such fragments belong to the line before them.</p>
 * <p><strong>Role:</strong> First stage of the log pipeline; runs before any time or backend based logic.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class LogStitcher {
  private static final Logger log = LoggerFactory.getLogger(LogStitcher.class);

  /**
   * Appends each fragment, separated by one space, to the most recently accepted non-fragment line.
   *
   * @param lines lines of one tick in observation order
   * @return non-fragment lines, possibly lengthened; fragments with no preceding line are dropped
   */
  public List<LogLine> stitch(List<LogLine> lines) {
    Objects.requireNonNull(lines, "lines");
    List<LogLine> stitched = new ArrayList<>(lines.size());
    for (LogLine line : lines) {
      if (!line.isFragment()) {
        stitched.add(line);
      } else if (!stitched.isEmpty()) {
        int last = stitched.size() - 1;
        LogLine parent = stitched.get(last);
        stitched.set(last, parent.withContent(parent.content() + " " + line.content()));
      } else {
        log.debug("Dropped log fragment without a preceding line: {}", Logs.preview(line.content()));
      }
    }
    return stitched;
  }
}
