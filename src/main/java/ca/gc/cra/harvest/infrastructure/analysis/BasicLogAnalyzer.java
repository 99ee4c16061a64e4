package ca.gc.cra.harvest.infrastructure.analysis;

import ca.gc.cra.harvest.application.port.LogAnalyzer;
import ca.gc.cra.harvest.domain.log.LogClassification;
import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import ca.gc.cra.harvest.domain.log.QuerySample;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Default {@link LogAnalyzer} recognizing the handful of messages the collector relies on.
 * <p><strong>Why:</strong> Test runs need the collector identify marker classified, and slow statement reports
 * are the cheapest source of query samples. Everything else passes through unclassified.</p>
 * <p><strong>Role:</strong> Adapter used when no richer analyzer is plugged in.</p>
 * <p><strong>Thread-safety:</strong> Stateless; patterns are compiled once.</p>
 *
 * @since 0.1.0
 */
public final class BasicLogAnalyzer implements LogAnalyzer {
  /** Marker the collector emits through the server to identify its configuration section. */
  public static final String IDENTIFY_MARKER = "harvest-collector-identify:";

  private static final Pattern IDENTIFY = Pattern.compile(Pattern.quote(IDENTIFY_MARKER) + "\\s*([A-Za-z0-9._-]+)");
  private static final Pattern DURATION = Pattern.compile(
      "duration: ([0-9]+(?:\\.[0-9]+)?) ms\\s+(?:statement|execute [^:]*): (.*)", Pattern.DOTALL);
  private static final Pattern CONNECTION = Pattern.compile(
      "^(?:connection received|connection authorized|disconnection|replication connection authorized):");

  @Override
  public AnalysisResult analyze(List<LogLine> backendLines) {
    Objects.requireNonNull(backendLines, "backendLines");
    List<LogLine> out = new ArrayList<>(backendLines.size());
    List<QuerySample> samples = new ArrayList<>();
    for (LogLine line : backendLines) {
      String content = line.content();
      Matcher identify = IDENTIFY.matcher(content);
      if (identify.find()) {
        out.add(line.withClassification(LogClassification.COLLECTOR_IDENTIFY,
            Map.of(LogLine.CONFIG_SECTION_DETAIL, identify.group(1))));
        continue;
      }
      Matcher duration = DURATION.matcher(content);
      if (duration.find()) {
        double runtimeMs = Double.parseDouble(duration.group(1));
        String query = duration.group(2).trim();
        out.add(line.withClassification(LogClassification.STATEMENT_DURATION,
            Map.of("duration_ms", duration.group(1))));
        samples.add(new QuerySample(line.collectedAt(), "", "", query, runtimeMs, List.of()));
        continue;
      }
      if (line.level() == LogLevel.ERROR && content.startsWith("syntax error")) {
        out.add(line.withClassification(LogClassification.SYNTAX_ERROR, Map.of()));
        continue;
      }
      if (CONNECTION.matcher(content).find()) {
        out.add(line.withClassification(LogClassification.CONNECTION_EVENT, Map.of()));
        continue;
      }
      out.add(line);
    }
    return new AnalysisResult(out, samples);
  }
}
