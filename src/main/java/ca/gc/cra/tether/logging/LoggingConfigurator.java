package ca.gc.cra.tether.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime for CLI flags. Other SLF4J backends keep their configuration and get a
 * warning.
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of one logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level level name such as {@code INFO}; unknown names map to DEBUG
   */
  public static void setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      target.setLevel(Level.toLevel(level, Level.DEBUG));
      return;
    }
    log.warn("Cannot change level of {}: backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
  }
}
