package com.gentoro.recordbridge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup, YAML-driven Logback levels, and masking of the backend secrets that would
 * otherwise reach the logs (password, bearer tokens, login response tokens).
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String MASK = "***";

  private static final Pattern SECRET_JSON_FIELD =
      Pattern.compile("\"(password|access_token|refresh_token)\"\\s*:\\s*\"[^\"]*\"");

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries to Logback; {@code root} addresses the
   * root logger. Unknown levels are skipped with a warning.
   *
   * @return the levels that were applied, by logger name
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) return applied;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback, logging.level settings are ignored");
      return applied;
    }

    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger {}, ignoring", value, key);
        continue;
      }
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      ctx.getLogger(name).setLevel(level);
      applied.put(name, level);
    }
    log.debug("Applied logging levels {}", applied);
    return applied;
  }

  /** Masks password and token values inside a JSON text. */
  public static String maskSecrets(String json) {
    if (json == null || json.isEmpty()) return json;
    return SECRET_JSON_FIELD.matcher(json).replaceAll("\"$1\":\"" + MASK + "\"");
  }

  /** {@code Bearer ***} for any bearer header value; other values pass through. */
  public static String maskAuthorization(String header) {
    if (header == null) return null;
    return header.regionMatches(true, 0, "Bearer ", 0, 7) ? "Bearer " + MASK : MASK;
  }
}
