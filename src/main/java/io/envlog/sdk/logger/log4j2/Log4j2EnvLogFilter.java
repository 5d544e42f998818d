package io.envlog.sdk.logger.log4j2;

import io.envlog.sdk.core.DirectiveParser;
import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.runtime.EnvLogRuntime;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.spi.StandardLevel;

/**
 * Log4j2 context-wide filter that lets the EnvLog directives decide every log call.
 *
 * <p>Returns ACCEPT when the resolver enables the event and DENY otherwise.
 *
 * <p>Usage in log4j2.xml: {@code <EnvLogFilter directives="warn,myapp=debug"/>} as a top-level
 * filter. Without {@code directives} the filter follows the shared resolver configured through
 * {@code EnvLog}.
 */
@Plugin(
    name = "EnvLogFilter",
    category = Node.CATEGORY,
    elementType = Filter.ELEMENT_TYPE,
    printObject = true)
public final class Log4j2EnvLogFilter extends AbstractFilter {

  private final LevelResolver resolver;
  // Set only on filters added by Log4j2EnvLogInstaller; declared filters are never removed by it
  private final boolean programmatic;

  private Log4j2EnvLogFilter(LevelResolver resolver, boolean programmatic) {
    super(Result.ACCEPT, Result.DENY);
    this.resolver = resolver;
    this.programmatic = programmatic;
  }

  /** Filter backed by the given resolver; {@code null} follows the shared resolver */
  public static Log4j2EnvLogFilter create(LevelResolver resolver) {
    return new Log4j2EnvLogFilter(resolver, false);
  }

  static Log4j2EnvLogFilter createInstalled(LevelResolver resolver) {
    return new Log4j2EnvLogFilter(resolver, true);
  }

  boolean isProgrammatic() {
    return programmatic;
  }

  @PluginFactory
  public static Log4j2EnvLogFilter createFilter(@PluginAttribute("directives") String directives) {
    if (directives == null) {
      return new Log4j2EnvLogFilter(null, false);
    }
    return new Log4j2EnvLogFilter(
        new LevelResolver(
            DirectiveParser.parse(
                directives,
                io.envlog.sdk.types.Level.WARN,
                skipped -> LOGGER.warn("Skipping log directive {}", skipped))),
        false);
  }

  @Override
  public Result filter(LogEvent event) {
    return decide(event.getLoggerName(), event.getLevel());
  }

  @Override
  public Result filter(Logger logger, Level level, Marker marker, Message msg, Throwable t) {
    return decide(logger.getName(), level);
  }

  @Override
  public Result filter(Logger logger, Level level, Marker marker, Object msg, Throwable t) {
    return decide(logger.getName(), level);
  }

  @Override
  public Result filter(Logger logger, Level level, Marker marker, String msg, Object... params) {
    return decide(logger.getName(), level);
  }

  // Configuration.removeFilter matches by equals; two filters are never interchangeable
  @Override
  public boolean equals(Object o) {
    return this == o;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }

  LevelResolver activeResolver() {
    return resolver != null ? resolver : EnvLogRuntime.getResolver();
  }

  private Result decide(String loggerName, Level level) {
    if (level == null) {
      return Result.NEUTRAL;
    }
    return activeResolver().isEnabled(loggerName, toEnvLogLevel(level)) ? onMatch : onMismatch;
  }

  /** Convert Log4j2 Level to EnvLog Level; FATAL folds into ERROR */
  static io.envlog.sdk.types.Level toEnvLogLevel(Level level) {
    int intLevel = level.intLevel();
    if (intLevel >= StandardLevel.TRACE.intLevel()) {
      return io.envlog.sdk.types.Level.TRACE;
    }
    if (intLevel >= StandardLevel.DEBUG.intLevel()) {
      return io.envlog.sdk.types.Level.DEBUG;
    }
    if (intLevel >= StandardLevel.INFO.intLevel()) {
      return io.envlog.sdk.types.Level.INFO;
    }
    if (intLevel >= StandardLevel.WARN.intLevel()) {
      return io.envlog.sdk.types.Level.WARN;
    }
    if (intLevel > StandardLevel.OFF.intLevel()) {
      return io.envlog.sdk.types.Level.ERROR;
    }
    return io.envlog.sdk.types.Level.OFF;
  }
}
