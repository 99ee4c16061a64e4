package ca.gc.cra.harvest.application.logs;

import ca.gc.cra.harvest.domain.log.LogLine;
import java.util.List;
import java.util.Objects;

/**
 * Result of one log pipeline invocation.
 *
 * @param backlog lines the caller must resubmit on the next tick, in order
 * @param outcome terminal dispatch outcome
 * @since 0.1.0
 */
public record PipelineResult(List<LogLine> backlog, DispatchOutcome outcome) {
  public PipelineResult {
    backlog = List.copyOf(backlog);
    Objects.requireNonNull(outcome, "outcome");
  }
}
