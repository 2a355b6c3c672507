package com.gentoro.keyimport.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying level overrides from {@code
 * application.yaml}.
 *
 * <p>Levels are read from keys under {@code logging.level}, for example:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.keyimport.channel: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries. Unknown level names fall back to DEBUG. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logback is not the active SLF4J binding, skipping level configuration");
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      // dots inside a YAML key are escaped as ".." by the default expression engine
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String levelName = configuration.getString(key);
      if (levelName == null || levelName.isBlank()) {
        continue;
      }
      String target =
          "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(Level.toLevel(levelName.trim(), Level.DEBUG));
    }
  }
}
