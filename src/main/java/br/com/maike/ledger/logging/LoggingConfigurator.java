package br.com.maike.ledger.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures ledger runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Lets operators raise verbosity while chasing a reconciliation problem without editing
 * {@code logback.xml}.
 * <p><strong>Role:</strong> Adapter-side utility that bridges CLI flags to the logging backend.
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String LEDGER_LOGGER = "br.com.maike.ledger";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root and ledger logger levels to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      context.getLogger(LEDGER_LOGGER).setLevel(level);
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
