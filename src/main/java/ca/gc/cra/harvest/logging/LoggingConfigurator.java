package ca.gc.cra.harvest.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts collector logging at startup from configuration.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code verbose: true} in the collector YAML instead of
 * editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single startup thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Sets the root logger, and with it the grant and dispatch diagnostics, to DEBUG.
   *
   * @return {@code true} if the level could be changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      root.setLevel(Level.DEBUG);
      log.debug("Verbose logging enabled");
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
