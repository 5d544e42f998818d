package io.envlog.sdk.logger.log4j2;

import io.envlog.sdk.core.LevelResolver;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.filter.CompositeFilter;
import org.apache.logging.log4j.spi.LoggerContext;

/**
 * Installs and removes the {@link Log4j2EnvLogFilter} as a context-wide filter of the running
 * Log4j2 configuration. A configuration reload drops the filter; install again afterwards.
 *
 * <p>Only the filter added here is ever removed; an {@code EnvLogFilter} declared in log4j2.xml is
 * left in place.
 */
public final class Log4j2EnvLogInstaller {

  private Log4j2EnvLogInstaller() {
    // Utility class
  }

  /** Install into the current Log4j2 context */
  public static void install(LevelResolver resolver) {
    install(currentContext(), resolver);
  }

  public static Log4j2EnvLogFilter install(
      org.apache.logging.log4j.core.LoggerContext context, LevelResolver resolver) {
    uninstall(context);

    Log4j2EnvLogFilter filter = Log4j2EnvLogFilter.createInstalled(resolver);
    filter.start();
    context.getConfiguration().addFilter(filter);
    context.updateLoggers();
    return filter;
  }

  /** Remove the filter from the current Log4j2 context */
  public static void uninstall() {
    uninstall(currentContext());
  }

  /** @return true if a filter was removed */
  public static boolean uninstall(org.apache.logging.log4j.core.LoggerContext context) {
    Configuration configuration = context.getConfiguration();
    List<Filter> installed = new ArrayList<>();
    Filter current = configuration.getFilter();
    if (isInstalledFilter(current)) {
      installed.add(current);
    } else if (current instanceof CompositeFilter) {
      for (Filter filter : (CompositeFilter) current) {
        if (isInstalledFilter(filter)) {
          installed.add(filter);
        }
      }
    }
    for (Filter filter : installed) {
      configuration.removeFilter(filter);
      filter.stop();
    }
    if (!installed.isEmpty()) {
      context.updateLoggers();
    }
    return !installed.isEmpty();
  }

  private static boolean isInstalledFilter(Filter filter) {
    return filter instanceof Log4j2EnvLogFilter && ((Log4j2EnvLogFilter) filter).isProgrammatic();
  }

  private static org.apache.logging.log4j.core.LoggerContext currentContext() {
    LoggerContext context = LogManager.getContext(false);
    if (!(context instanceof org.apache.logging.log4j.core.LoggerContext)) {
      throw new IllegalStateException(
          "Log4j2 API is not backed by log4j-core: " + context.getClass().getName());
    }
    return (org.apache.logging.log4j.core.LoggerContext) context;
  }
}
