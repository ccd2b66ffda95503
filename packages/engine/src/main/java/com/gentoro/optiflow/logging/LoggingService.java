package com.gentoro.optiflow.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>All classes obtain their SLF4J logger through {@link #getLogger(Class)}. Levels can be tuned
 * at startup from the application configuration using keys of the form {@code
 * logging.level.<logger-name>} (use {@code logging.level.root} for the root logger), for example:
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.optiflow.engine: DEBUG
 * }</pre>
 */
public final class LoggingService {

  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels from configuration. Unknown level names fall back to {@code INFO}; when the
   * SLF4J binding is not Logback the call is a no-op.
   *
   * @return number of loggers that were reconfigured.
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return 0;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return 0;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    int applied = 0;
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String raw = levels.getString(name);
      if (raw == null || raw.isBlank()) {
        continue;
      }
      // hierarchical keys escape the dots of a logger name as ".."
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      context.getLogger(loggerName).setLevel(Level.toLevel(raw.trim(), Level.INFO));
      applied++;
    }
    return applied;
  }
}
