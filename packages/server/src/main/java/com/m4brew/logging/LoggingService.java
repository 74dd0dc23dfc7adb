package com.m4brew.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from {@code application.yaml}:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.m4brew.management: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} keys to the Logback context. Unknown levels are ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name, null);
      if (value == null || value.isBlank()) continue;

      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Ignoring unknown log level '{}' for {}", value, name);
        continue;
      }
      // hierarchical configurations escape dots inside node names by doubling them
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
