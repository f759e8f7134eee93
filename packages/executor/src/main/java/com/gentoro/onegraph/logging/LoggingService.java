package com.gentoro.onegraph.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Loggers are plain SLF4J loggers backed by Logback. Levels can be adjusted at startup from the
 * application configuration:
 *
 * <pre>{@code
 * logging:
 *   level: INFO
 *   loggers:
 *     - name: com.gentoro.onegraph.engine
 *       level: TRACE
 * }</pre>
 */
public final class LoggingService {

  private LoggingService() {}

  public static org.slf4j.Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level} to the root logger and every {@code logging.loggers} entry to its
   * named logger. Unknown level names fall back to {@code INFO}. Does nothing when the SLF4J
   * binding is not Logback.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    String rootLevel = configuration.getString("logging.level", null);
    if (StringUtils.isNotBlank(rootLevel)) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(rootLevel));
    }

    List<String> names = configuration.getList(String.class, "logging.loggers.name", List.of());
    List<String> levels = configuration.getList(String.class, "logging.loggers.level", List.of());
    for (int i = 0; i < Math.min(names.size(), levels.size()); i++) {
      Logger logger = context.getLogger(names.get(i));
      logger.setLevel(Level.toLevel(levels.get(i), Level.INFO));
    }
  }
}
