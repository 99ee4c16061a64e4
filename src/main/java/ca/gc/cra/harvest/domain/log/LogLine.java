package ca.gc.cra.harvest.domain.log;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable record of one database server log line as it moves through the log pipeline.
 * <p><strong>Why:</strong> Carries the raw text together with the metadata needed to reassemble multi-line
 * messages, window them by age and address them inside the packaged artifact.</p>
 * <p><strong>Role:</strong> Domain value shared by stitching, windowing, joining, packaging and analysis stages.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the details map is an unmodifiable copy.</p>
 * <p><strong>Performance:</strong> {@code with*} methods allocate a new record; content is never copied.</p>
 *
 * @param content raw log text; never {@code null}
 * @param level severity parsed from the line prefix; {@code null} normalizes to {@link LogLevel#UNKNOWN}
 * @param backendPid database backend process identifier; {@code 0} when unknown
 * @param collectedAt instant the line was first observed by the agent
 * @param byteStart inclusive start offset inside the packaged artifact
 * @param byteContentStart inclusive start offset of the message content inside the packaged artifact
 * @param byteEnd inclusive end offset inside the packaged artifact
 * @param classification analyzer classification; {@code null} normalizes to {@link LogClassification#UNKNOWN}
 * @param details analyzer-extracted key/value attributes; {@code null} normalizes to an empty map
 * @implNote Offsets count UTF-8 bytes, matching the encoding used by the packager.
 * @since 0.1.0
 */
public record LogLine(
    String content,
    LogLevel level,
    int backendPid,
    Instant collectedAt,
    long byteStart,
    long byteContentStart,
    long byteEnd,
    LogClassification classification,
    Map<String, String> details) {

  /** Offset carried by every byte range field of a line whose content never reached the packaged artifact. */
  public static final long NO_OFFSET = -1L;

  /** Detail key carrying the configuration section announced by a collector identify marker. */
  public static final String CONFIG_SECTION_DETAIL = "config_section";

  /**
   * Normalizes optional attributes and copies the details map.
   */
  public LogLine {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(collectedAt, "collectedAt");
    level = Objects.requireNonNullElse(level, LogLevel.UNKNOWN);
    classification = Objects.requireNonNullElse(classification, LogClassification.UNKNOWN);
    details = details == null || details.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Creates a freshly observed line with no byte range and no classification.
   *
   * @param content raw log text
   * @param level parsed severity
   * @param backendPid backend process identifier, {@code 0} when unknown
   * @param collectedAt observation instant
   * @return new log line
   */
  public static LogLine observed(String content, LogLevel level, int backendPid, Instant collectedAt) {
    return new LogLine(content, level, backendPid, collectedAt, 0L, 0L, 0L, LogClassification.UNKNOWN, Map.of());
  }

  /**
   * Reports whether the line lacks both a parseable level and a backend identifier.
   *
   * @return {@code true} when the line can only be a continuation of the preceding line
   */
  public boolean isFragment() {
    return level == LogLevel.UNKNOWN && backendPid == 0;
  }

  /**
   * Returns the UTF-8 encoded length of the content.
   *
   * @return content length in bytes
   */
  public int contentLength() {
    return content.getBytes(StandardCharsets.UTF_8).length;
  }

  public LogLine withContent(String newContent) {
    return new LogLine(newContent, level, backendPid, collectedAt,
        byteStart, byteContentStart, byteEnd, classification, details);
  }

  public LogLine withByteRange(long start, long contentStart, long end) {
    return new LogLine(content, level, backendPid, collectedAt,
        start, contentStart, end, classification, details);
  }

  public LogLine withoutByteRange() {
    return withByteRange(NO_OFFSET, NO_OFFSET, NO_OFFSET);
  }

  /**
   * Reports whether the line was written to a packaged artifact.
   *
   * @return {@code false} for lines carrying {@link #NO_OFFSET}
   */
  public boolean hasByteRange() {
    return byteStart >= 0;
  }

  public LogLine withClassification(LogClassification newClassification, Map<String, String> newDetails) {
    return new LogLine(content, level, backendPid, collectedAt,
        byteStart, byteContentStart, byteEnd, newClassification, newDetails);
  }
}
