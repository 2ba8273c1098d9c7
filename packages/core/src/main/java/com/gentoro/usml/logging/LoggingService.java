package com.gentoro.usml.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying logger levels declared in the
 * application configuration.
 *
 * <p>Levels are read from {@code logging.level.<logger-name>} keys, {@code root} addressing the
 * root logger:
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.usml.validator: DEBUG
 * }</pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to the Logback context; other backends are ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      // hierarchical configurations escape dots inside a single key segment as ".."
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String value = configuration.getString(key);
      if (value == null || value.isBlank()) {
        continue;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      String target = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
    }
  }
}
