package io.mixforge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from {@code application.yaml} through the {@code logging.levels} list,
 * whose entries take the form {@code logger.name=LEVEL} (use {@code ROOT} for the root logger).
 */
public final class LoggingService {
  private static final int MAX_LOGGED_VALUE_LENGTH = 1000;

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.levels} from the configuration to the Logback context. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      // Another SLF4J binding is active; nothing to tune.
      return;
    }

    List<String> entries = configuration.getList(String.class, "logging.levels", List.of());
    for (String entry : entries) {
      int eq = entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) {
        getLogger(LoggingService.class).warn("Ignoring malformed logging level entry: {}", entry);
        continue;
      }
      String name = entry.substring(0, eq).trim();
      Level level = Level.toLevel(entry.substring(eq + 1).trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Unknown logging level in entry: {}", entry);
        continue;
      }
      String loggerName = "ROOT".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(loggerName).setLevel(level);
    }
  }

  /**
   * Make an untrusted value safe to log: strips percent signs and control characters and bounds
   * the length.
   */
  public static String sanitize(Object value) {
    if (value == null) return "null";
    String s = String.valueOf(value).replace("%", "").replaceAll("[\\x00-\\x1F\\x7F]", "");
    return s.length() > MAX_LOGGED_VALUE_LENGTH ? s.substring(0, MAX_LOGGED_VALUE_LENGTH) : s;
  }
}
