package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Re-joins messages split across physical lines of the same backend process.
 * <p><strong>Why:</strong> Concurrent sessions interleave in the raw log, so message boundaries are only meaningful
 * within one backend. Long statements are often written as several physical lines that share the backend id
 * but carry no level of their own.</p>
 * <p><strong>Role:</strong> Third stage of the log pipeline; feeds the packager and, per backend, the analyzer.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class BackendJoiner {
  private static final Logger log = LoggerFactory.getLogger(BackendJoiner.class);

  /**
   * Joins continuation lines into the nearest preceding classified line of the same backend.
   *
   * <p>A line with {@link LogLevel#UNKNOWN} is appended, without separator, to that backend's most recent
   * classified line. Until a backend has a classified line its UNKNOWN lines are dropped. Lines are never merged
   * across backends. Byte ranges are left to the packager.</p>
   *
   * @param ready ready lines in arrival order
   * @return joined lines in the arrival order of their first physical line
   */
  public List<LogLine> join(List<LogLine> ready) {
    Objects.requireNonNull(ready, "ready");
    List<LogLine> joined = new ArrayList<>(ready.size());
    Map<Integer, Integer> lastIndexByPid = new HashMap<>();
    for (LogLine line : ready) {
      Integer parentIndex = lastIndexByPid.get(line.backendPid());
      if (line.level() != LogLevel.UNKNOWN) {
        lastIndexByPid.put(line.backendPid(), joined.size());
        joined.add(line);
      } else if (parentIndex != null) {
        LogLine parent = joined.get(parentIndex);
        joined.set(parentIndex, parent.withContent(parent.content() + line.content()));
      } else {
        log.debug("Dropped continuation for backend {} without a classified line: {}",
            line.backendPid(), Logs.preview(line.content()));
      }
    }
    return List.copyOf(joined);
  }

  /**
   * Splits lines into per-backend sequences.
   *
   * @param lines lines in arrival order
   * @return backend pid to its lines; backends ordered by first appearance, lines by arrival
   */
  public static Map<Integer, List<LogLine>> byBackend(List<LogLine> lines) {
    Objects.requireNonNull(lines, "lines");
    Map<Integer, List<LogLine>> groups = new LinkedHashMap<>();
    for (LogLine line : lines) {
      groups.computeIfAbsent(line.backendPid(), pid -> new ArrayList<>()).add(line);
    }
    Map<Integer, List<LogLine>> copy = new LinkedHashMap<>();
    groups.forEach((pid, group) -> copy.put(pid, List.copyOf(group)));
    return Collections.unmodifiableMap(copy);
  }
}
