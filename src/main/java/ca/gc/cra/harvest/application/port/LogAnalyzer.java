package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import java.util.List;

/**
 * <strong>What:</strong> Port classifying the joined log lines of one backend process.
 * <p><strong>Why:</strong> Structural analysis of server log messages evolves independently of the ingestion
 * pipeline; the pipeline only consumes the identify-marker classification and the
 * {@link LogLine#CONFIG_SECTION_DETAIL} detail key.</p>
 * <p><strong>Role:</strong> Domain port invoked once per backend group per batch.</p>
 * <p><strong>Thread-safety:</strong> Called from the single collection thread.</p>
 *
 * @since 0.1.0
 */
public interface LogAnalyzer {
  /**
   * Classifies one backend's lines and extracts query samples.
   *
   * @param backendLines lines from a single backend in arrival order, with continuations already joined
   * @return classified output lines and extracted samples; never {@code null}
   */
  AnalysisResult analyze(List<LogLine> backendLines);

  /**
   * Output of {@link LogAnalyzer#analyze(List)}.
   *
   * @param lines classified lines to ship
   * @param samples query samples extracted from the lines
   */
  record AnalysisResult(List<LogLine> lines, List<QuerySample> samples) {
    public AnalysisResult {
      lines = lines == null ? List.of() : List.copyOf(lines);
      samples = samples == null ? List.of() : List.copyOf(samples);
    }
  }
}
