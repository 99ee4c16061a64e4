package ca.gc.cra.harvest.domain.log;

/**
 * Semantic classification assigned to a log line by a {@code LogAnalyzer}.
 *
 * @since 0.1.0
 */
public enum LogClassification {
  /** No analyzer rule matched. */
  UNKNOWN,
  /** Marker statement emitted by the collector to prove it can read the server log. */
  COLLECTOR_IDENTIFY,
  /** Statement duration report produced by {@code log_min_duration_statement}. */
  STATEMENT_DURATION,
  /** Statement rejected by the parser. */
  SYNTAX_ERROR,
  /** Connection or authentication lifecycle event. */
  CONNECTION_EVENT
}
