package com.shelfscan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be overridden from the application configuration
 * using keys of the form {@code logging.level.<logger-name>} (use {@code root} for the root
 * logger).
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} overrides to the Logback context. Unknown levels are skipped. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Logger log = getLogger(LoggingService.class);
    for (Iterator<String> it = configuration.getKeys(LEVEL_PREFIX); it.hasNext(); ) {
      String key = it.next();
      String value = configuration.getString(key, null);
      if (value == null || value.isBlank()) {
        continue;
      }
      String loggerName = key.length() > LEVEL_PREFIX.length()
          ? key.substring(LEVEL_PREFIX.length() + 1)
          : Logger.ROOT_LOGGER_NAME;
      // dotted YAML keys come back with escaped separators
      loggerName = loggerName.replace("..", ".");
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger {}", value, loggerName);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
      log.trace("Logger {} set to {}", loggerName, level);
    }
  }
}
