package com.fieldflow.tracker.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be tuned from the {@code logging.level} section of
 * the application configuration, e.g.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.fieldflow.tracker.polling: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply logger levels declared in the configuration. Unknown levels are reported and skipped. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      // Not running on logback; nothing to tune.
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String loggerName = keys.next();
      String value = levels.getString(loggerName, null);
      if (value == null || value.isBlank()) {
        continue;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      // The default expression engine escapes dots inside YAML keys as "..".
      String unescaped = loggerName.replace("..", ".");
      String name = "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(name).setLevel(level);
    }
  }
}
