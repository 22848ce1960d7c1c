package ca.gc.cra.stepfrag.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts STEPFRAG runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Lets operators see per-chunk reader activity and header previews with {@code --verbose}
 * without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges CLI flags to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend does not support dynamic levels.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the root logger threshold to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level when the backend is Logback.
   *
   * @param level new root level; must not be {@code null}
   * @return {@code true} when the level was applied
   */
  static boolean setRootLevel(Level level) {
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
