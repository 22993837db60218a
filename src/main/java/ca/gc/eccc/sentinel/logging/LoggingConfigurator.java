package ca.gc.eccc.sentinel.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime.
 *
 * <p>Used by the CLI when {@code --verbose} is given. Falls back to a warning when SLF4J is bound to a
 * backend other than Logback.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level new level
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
