package ca.gc.cra.harvest.domain.log;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Structured description of one executed statement extracted from log content.
 *
 * @param occurredAt instant the statement finished, taken from the source log line
 * @param username role that executed the statement; empty when not logged
 * @param database database the statement ran in; empty when not logged
 * @param query statement text
 * @param runtimeMs reported runtime in milliseconds
 * @param parameters bind parameter values in positional order
 * @since 0.1.0
 */
public record QuerySample(
    Instant occurredAt,
    String username,
    String database,
    String query,
    double runtimeMs,
    List<String> parameters) {

  public QuerySample {
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(query, "query");
    username = Objects.requireNonNullElse(username, "");
    database = Objects.requireNonNullElse(database, "");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    if (runtimeMs < 0) {
      throw new IllegalArgumentException("runtimeMs must not be negative");
    }
  }
}
