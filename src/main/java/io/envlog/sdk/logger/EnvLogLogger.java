package io.envlog.sdk.logger;

import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.runtime.EnvLogRuntime;
import io.envlog.sdk.types.Level;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * SLF4J logger wrapper that consults the EnvLog directives before every call.
 *
 * <p>Works with any SLF4J binding. When the Logback or Log4j2 filter is installed the backend
 * applies the same decision, so the check here only saves argument formatting. {@link Level#OFF}
 * is a threshold, never a message level: nothing is logged at OFF.
 *
 * <p>Usage: EnvLogLogger logger = EnvLogLogger.getLogger(MyClass.class); logger.debug("Pool
 * size {}", size);
 */
public class EnvLogLogger {

  private static final Map<String, EnvLogLogger> loggerInstances = new ConcurrentHashMap<>();

  private final Logger logger;
  private final LevelResolver resolver;

  EnvLogLogger(Logger logger, LevelResolver resolver) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /** Get an EnvLog logger for the specified class */
  public static EnvLogLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /** Get an EnvLog logger for the specified name, backed by the shared resolver */
  public static EnvLogLogger getLogger(String name) {
    Objects.requireNonNull(name, "name");
    return loggerInstances.computeIfAbsent(
        name,
        loggerName ->
            new EnvLogLogger(LoggerFactory.getLogger(loggerName), EnvLogRuntime.getResolver()));
  }

  /** Get a logger bound to a specific resolver instead of the shared one */
  public static EnvLogLogger getLogger(String name, LevelResolver resolver) {
    return new EnvLogLogger(LoggerFactory.getLogger(name), resolver);
  }

  // TRACE

  public void trace(String message) {
    if (isTraceEnabled()) {
      logger.trace(message);
    }
  }

  public void trace(String format, Object... args) {
    if (isTraceEnabled()) {
      logger.trace(format, args);
    }
  }

  public void trace(String message, Throwable throwable) {
    if (isTraceEnabled()) {
      logger.trace(message, throwable);
    }
  }

  // DEBUG

  public void debug(String message) {
    if (isDebugEnabled()) {
      logger.debug(message);
    }
  }

  public void debug(String format, Object... args) {
    if (isDebugEnabled()) {
      logger.debug(format, args);
    }
  }

  public void debug(String message, Throwable throwable) {
    if (isDebugEnabled()) {
      logger.debug(message, throwable);
    }
  }

  // INFO

  public void info(String message) {
    if (isInfoEnabled()) {
      logger.info(message);
    }
  }

  public void info(String format, Object... args) {
    if (isInfoEnabled()) {
      logger.info(format, args);
    }
  }

  public void info(String message, Throwable throwable) {
    if (isInfoEnabled()) {
      logger.info(message, throwable);
    }
  }

  // WARN

  public void warn(String message) {
    if (isWarnEnabled()) {
      logger.warn(message);
    }
  }

  public void warn(String format, Object... args) {
    if (isWarnEnabled()) {
      logger.warn(format, args);
    }
  }

  public void warn(String message, Throwable throwable) {
    if (isWarnEnabled()) {
      logger.warn(message, throwable);
    }
  }

  // ERROR

  public void error(String message) {
    if (isErrorEnabled()) {
      logger.error(message);
    }
  }

  public void error(String format, Object... args) {
    if (isErrorEnabled()) {
      logger.error(format, args);
    }
  }

  public void error(String message, Throwable throwable) {
    if (isErrorEnabled()) {
      logger.error(message, throwable);
    }
  }

  /** Log with additional MDC context, restoring any previous values afterwards */
  public void logWithContext(Level level, String message, Map<String, String> context) {
    if (!isEnabled(level)) {
      return;
    }

    Map<String, String> previous = new HashMap<>();
    if (context != null) {
      context.forEach(
          (key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
          });
    }

    try {
      switch (level) {
        case TRACE:
          logger.trace(message);
          break;
        case DEBUG:
          logger.debug(message);
          break;
        case INFO:
          logger.info(message);
          break;
        case WARN:
          logger.warn(message);
          break;
        case ERROR:
          logger.error(message);
          break;
        default:
          break;
      }
    } finally {
      previous.forEach(
          (key, value) -> {
            if (value != null) {
              MDC.put(key, value);
            } else {
              MDC.remove(key);
            }
          });
    }
  }

  /** True when both the directives and the underlying backend enable {@code level} */
  public boolean isEnabled(Level level) {
    if (level == null || level == Level.OFF || !resolver.isEnabled(logger.getName(), level)) {
      return false;
    }
    switch (level) {
      case TRACE:
        return logger.isTraceEnabled();
      case DEBUG:
        return logger.isDebugEnabled();
      case INFO:
        return logger.isInfoEnabled();
      case WARN:
        return logger.isWarnEnabled();
      case ERROR:
        return logger.isErrorEnabled();
      default:
        return false;
    }
  }

  public boolean isTraceEnabled() {
    return isEnabled(Level.TRACE);
  }

  public boolean isDebugEnabled() {
    return isEnabled(Level.DEBUG);
  }

  public boolean isInfoEnabled() {
    return isEnabled(Level.INFO);
  }

  public boolean isWarnEnabled() {
    return isEnabled(Level.WARN);
  }

  public boolean isErrorEnabled() {
    return isEnabled(Level.ERROR);
  }

  /** Threshold the directives assign to this logger */
  public Level getEffectiveLevel() {
    return resolver.effectiveLevel(logger.getName());
  }

  public String getName() {
    return logger.getName();
  }

  /** Get the underlying SLF4J logger */
  public Logger getUnderlyingLogger() {
    return logger;
  }
}
