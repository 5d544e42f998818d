package io.envlog.sdk.logger.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import io.envlog.sdk.core.DirectiveParser;
import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.core.Ruleset;
import io.envlog.sdk.runtime.EnvLogRuntime;
import org.slf4j.Marker;

/**
 * Logback turbo filter that lets the EnvLog directives decide every log call.
 *
 * <p>Replies ACCEPT when the resolver enables the event and DENY otherwise, so the directives take
 * precedence over logger levels configured in {@code logback.xml}.
 *
 * <p>Usage in logback.xml: {@code <turboFilter
 * class="io.envlog.sdk.logger.logback.EnvLogTurboFilter"/>}, optionally with a nested {@code
 * <directives>warn,myapp=debug</directives>} element. Without directives the filter follows the
 * shared resolver configured through {@code EnvLog}.
 */
public class EnvLogTurboFilter extends TurboFilter {

  private volatile LevelResolver resolver;
  private String directives;

  public EnvLogTurboFilter() {}

  public EnvLogTurboFilter(LevelResolver resolver) {
    this.resolver = resolver;
  }

  /** Directive string for a filter that owns its resolver; set from logback.xml */
  public void setDirectives(String directives) {
    this.directives = directives;
  }

  public String getDirectives() {
    return directives;
  }

  @Override
  public void start() {
    if (directives != null) {
      Ruleset ruleset =
          DirectiveParser.parse(
              directives,
              Ruleset.FALLBACK_LEVEL,
              skipped -> addWarn("Skipping log directive " + skipped));
      resolver = new LevelResolver(ruleset);
    }
    super.start();
  }

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    if (!isStarted() || logger == null || level == null) {
      return FilterReply.NEUTRAL;
    }
    return activeResolver().isEnabled(logger.getName(), toEnvLogLevel(level))
        ? FilterReply.ACCEPT
        : FilterReply.DENY;
  }

  LevelResolver activeResolver() {
    LevelResolver current = resolver;
    return current != null ? current : EnvLogRuntime.getResolver();
  }

  /** Convert Logback Level to EnvLog Level */
  static io.envlog.sdk.types.Level toEnvLogLevel(Level level) {
    int levelInt = level.toInt();
    if (levelInt <= Level.TRACE_INT) {
      return io.envlog.sdk.types.Level.TRACE;
    }
    if (levelInt <= Level.DEBUG_INT) {
      return io.envlog.sdk.types.Level.DEBUG;
    }
    if (levelInt <= Level.INFO_INT) {
      return io.envlog.sdk.types.Level.INFO;
    }
    if (levelInt <= Level.WARN_INT) {
      return io.envlog.sdk.types.Level.WARN;
    }
    if (levelInt <= Level.ERROR_INT) {
      return io.envlog.sdk.types.Level.ERROR;
    }
    return io.envlog.sdk.types.Level.OFF;
  }
}
