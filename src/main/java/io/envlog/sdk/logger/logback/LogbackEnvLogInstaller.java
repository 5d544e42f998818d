package io.envlog.sdk.logger.logback;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import io.envlog.sdk.constants.EnvLogConstants;
import io.envlog.sdk.core.LevelResolver;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Installs and removes the {@link EnvLogTurboFilter} on a Logback {@link LoggerContext} */
public final class LogbackEnvLogInstaller {

  private LogbackEnvLogInstaller() {
    // Utility class
  }

  /** Install into the context SLF4J is bound to */
  public static void install(LevelResolver resolver) {
    install(currentContext(), resolver);
  }

  /**
   * Install a filter backed by {@code resolver}, replacing one installed earlier. Filters declared
   * in logback.xml under another name are left alone.
   */
  public static EnvLogTurboFilter install(LoggerContext context, LevelResolver resolver) {
    uninstall(context);

    EnvLogTurboFilter filter = new EnvLogTurboFilter(resolver);
    filter.setName(EnvLogConstants.LOGBACK_TURBO_FILTER_NAME);
    filter.setContext(context);
    filter.start();
    context.addTurboFilter(filter);
    return filter;
  }

  /** Remove the filter from the context SLF4J is bound to */
  public static void uninstall() {
    uninstall(currentContext());
  }

  /** @return true if a filter was removed */
  public static boolean uninstall(LoggerContext context) {
    List<TurboFilter> installed = new ArrayList<>();
    for (TurboFilter filter : context.getTurboFilterList()) {
      if (filter instanceof EnvLogTurboFilter
          && EnvLogConstants.LOGBACK_TURBO_FILTER_NAME.equals(filter.getName())) {
        installed.add(filter);
      }
    }
    for (TurboFilter filter : installed) {
      context.getTurboFilterList().remove(filter);
      filter.stop();
    }
    return !installed.isEmpty();
  }

  private static LoggerContext currentContext() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      throw new IllegalStateException(
          "SLF4J is not bound to Logback: " + factory.getClass().getName());
    }
    return (LoggerContext) factory;
  }
}
