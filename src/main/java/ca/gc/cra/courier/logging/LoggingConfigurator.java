package ca.gc.cra.courier.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures COURIER runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Lets operators raise verbosity for a single run without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setRootLevel(Level.DEBUG);
  }

  /**
   * Restores the root logger to INFO, the level shipped in {@code logback.xml}.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean resetLogging() {
    return setRootLevel(Level.INFO);
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
