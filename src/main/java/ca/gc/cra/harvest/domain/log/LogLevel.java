package ca.gc.cra.harvest.domain.log;

import java.util.Locale;

/**
 * Severity reported by the database server for a single log line.
 * <p>{@link #UNKNOWN} marks lines whose level prefix could not be parsed, typically continuation
 * text of a longer message.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  UNKNOWN,
  DEBUG,
  INFO,
  NOTICE,
  WARNING,
  ERROR,
  LOG,
  FATAL,
  PANIC,
  DETAIL,
  HINT,
  CONTEXT,
  STATEMENT,
  QUERY;

  /**
   * Resolves a level from the textual prefix emitted by the server (e.g. {@code "ERROR"}).
   *
   * @param raw level token; {@code null} or unrecognized values map to {@link #UNKNOWN}
   * @return matching level
   */
  public static LogLevel fromToken(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith("DEBUG")) {
      return DEBUG;
    }
    for (LogLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    return UNKNOWN;
  }
}
