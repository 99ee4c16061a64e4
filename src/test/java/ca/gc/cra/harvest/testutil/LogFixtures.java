package ca.gc.cra.harvest.testutil;

import ca.gc.cra.harvest.application.server.ServerContext;
import ca.gc.cra.harvest.config.ServerConfig;
import ca.gc.cra.harvest.domain.log.LogLevel;
import ca.gc.cra.harvest.domain.log.LogLine;
import java.time.Duration;
import java.time.Instant;

/** Shared builders for log pipeline tests. */
public final class LogFixtures {
  /** Reference "now" used by {@link MutableClock} and the line builders. */
  public static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private LogFixtures() {}

  /** Line observed {@code age} before {@link #NOW}. */
  public static LogLine line(String content, LogLevel level, int pid, Duration age) {
    return LogLine.observed(content, level, pid, NOW.minus(age));
  }

  /** Line observed four seconds ago; ready under the default window. */
  public static LogLine ready(String content, LogLevel level, int pid) {
    return line(content, level, pid, Duration.ofSeconds(4));
  }

  /** Line observed one second ago; too fresh under the default window. */
  public static LogLine fresh(String content, LogLevel level, int pid) {
    return line(content, level, pid, Duration.ofSeconds(1));
  }

  /** Fragment (no level, no backend) observed four seconds ago. */
  public static LogLine fragment(String content) {
    return ready(content, LogLevel.UNKNOWN, 0);
  }

  public static ServerContext server(String section) {
    return new ServerContext(new ServerConfig(section, "https://api.example.test", "test-key"));
  }
}
