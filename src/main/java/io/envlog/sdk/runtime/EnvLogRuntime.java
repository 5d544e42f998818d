package io.envlog.sdk.runtime;

import io.envlog.sdk.config.EnvLogConfigImpl;
import io.envlog.sdk.constants.EnvLogConstants;
import io.envlog.sdk.core.DirectiveParser;
import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.core.Ruleset;
import io.envlog.sdk.core.SkippedDirective;
import io.envlog.sdk.logger.LoggerBackend;
import io.envlog.sdk.types.Level;
import io.envlog.sdk.utils.SystemUtils;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide EnvLog state: the shared {@link LevelResolver} and the init/shutdown lifecycle.
 *
 * <p>The shared resolver exists from class load, seeded from the default environment variable, so
 * filters declared in backend configuration files work before {@link #initialize} runs.
 */
public class EnvLogRuntime {
  private static final Logger logger = LoggerFactory.getLogger(EnvLogRuntime.class);

  private static final LevelResolver resolver =
      new LevelResolver(
          DirectiveParser.parse(SystemUtils.readDirectives(EnvLogConstants.DEFAULT_ENV_VARIABLE)));

  private static volatile EnvLogRuntime instance;
  private static final AtomicBoolean initialized = new AtomicBoolean(false);

  private final EnvLogConfigImpl config;
  private volatile LoggerBackend installedBackend = LoggerBackend.NONE;

  private EnvLogRuntime(EnvLogConfigImpl config) {
    this.config = config;
  }

  /** Initialize EnvLog: apply the configured directives and install the backend filter */
  public static EnvLogRuntime initialize(EnvLogConfigImpl config) {
    if (initialized.get()) {
      logger.warn(
          "{} Already initialized; use reconfigure to change directives",
          EnvLogConstants.LOG_PREFIX);
      return instance;
    }

    synchronized (EnvLogRuntime.class) {
      if (initialized.get()) {
        return instance;
      }

      EnvLogConfigImpl effectiveConfig =
          new EnvLogConfigImpl(config != null ? config : EnvLogConfigImpl.builder().build());
      EnvLogRuntime runtime = new EnvLogRuntime(effectiveConfig);
      instance = runtime;

      String raw =
          effectiveConfig.getDirectives() != null
              ? effectiveConfig.getDirectives()
              : SystemUtils.readDirectives(effectiveConfig.getEnvVariable());
      Ruleset ruleset = configure(raw);

      if (effectiveConfig.isInstallBackendFilter()) {
        runtime.setupBackend();
      }

      initialized.set(true);

      if (effectiveConfig.isVerbose()) {
        logger.info(
            "{} Initialized with '{}' (backend: {})",
            EnvLogConstants.LOG_PREFIX,
            ruleset.toDirectiveString(),
            runtime.installedBackend);
      }
      return runtime;
    }
  }

  /** Get the initialized runtime */
  public static EnvLogRuntime getInstance() {
    if (!initialized.get()) {
      throw new IllegalStateException("EnvLog not initialized. Call initialize() first.");
    }
    return instance;
  }

  /** The initialized runtime, or {@code null} */
  public static EnvLogRuntime currentInstance() {
    return instance;
  }

  /** Check if EnvLog is initialized */
  public static boolean isInitialized() {
    return initialized.get();
  }

  /** The process-wide resolver consulted by the backend filters and EnvLog loggers */
  public static LevelResolver getResolver() {
    return resolver;
  }

  /**
   * Parse {@code raw} and swap it into the shared resolver. Uses the fallback level and skip
   * reporting of the current configuration, or the defaults before initialization.
   */
  public static Ruleset configure(String raw) {
    EnvLogRuntime current = instance;
    Level fallback =
        current != null ? current.config.getFallbackLevel() : Ruleset.FALLBACK_LEVEL;
    boolean report = current == null || current.config.isReportSkippedDirectives();
    Consumer<SkippedDirective> onSkipped = report ? EnvLogRuntime::reportSkipped : null;

    Ruleset ruleset = resolver.reconfigure(raw, fallback, onSkipped);
    logLifecycle(
        current != null && current.config.isVerbose(),
        "{} Applied log directives '{}'",
        EnvLogConstants.LOG_PREFIX,
        ruleset.toDirectiveString());
    return ruleset;
  }

  /** Lifecycle messages go to INFO in verbose mode and DEBUG otherwise */
  private static void logLifecycle(boolean verbose, String format, Object... args) {
    if (verbose) {
      logger.info(format, args);
    } else {
      logger.debug(format, args);
    }
  }

  private static void reportSkipped(SkippedDirective skipped) {
    logger.warn("{} Skipping log directive {}", EnvLogConstants.LOG_PREFIX, skipped);
  }

  public EnvLogConfigImpl getConfig() {
    return config;
  }

  /** Backend the filter was installed into, or NONE */
  public LoggerBackend getInstalledBackend() {
    return installedBackend;
  }

  /** Shutdown: remove the backend filter and reset the shared resolver to defaults */
  public void shutdown() {
    if (!initialized.get()) {
      return;
    }

    synchronized (EnvLogRuntime.class) {
      if (!initialized.get() || instance != this) {
        return;
      }

      shutdownBackend();
      resolver.replace(Ruleset.defaults(config.getFallbackLevel()));

      initialized.set(false);
      instance = null;

      if (config.isVerbose()) {
        logger.info("{} Shutdown completed", EnvLogConstants.LOG_PREFIX);
      }
    }
  }

  /** Install the filter into the detected backend (prefers Logback, falls back to Log4j2) */
  private void setupBackend() {
    LoggerBackend detected = LoggerBackend.detect();

    if (detected == LoggerBackend.LOGBACK) {
      try {
        invokeInstaller(EnvLogConstants.LOGBACK_INSTALLER_CLASS, "install");
        installedBackend = LoggerBackend.LOGBACK;
        logLifecycle(
            config.isVerbose(), "{} Installed Logback turbo filter", EnvLogConstants.LOG_PREFIX);
        return;
      } catch (Exception e) {
        logger.warn(
            "{} Failed to install Logback filter, trying Log4j2: {}",
            EnvLogConstants.LOG_PREFIX,
            e.getMessage());
      }
    }

    if (LoggerBackend.isLog4j2Available()) {
      try {
        invokeInstaller(EnvLogConstants.LOG4J2_INSTALLER_CLASS, "install");
        installedBackend = LoggerBackend.LOG4J2;
        logLifecycle(config.isVerbose(), "{} Installed Log4j2 filter", EnvLogConstants.LOG_PREFIX);
        return;
      } catch (Exception e) {
        logger.warn(
            "{} Failed to install Log4j2 filter: {}", EnvLogConstants.LOG_PREFIX, e.getMessage());
      }
    }

    logger.warn(
        "{} No supported logging backend found; directives only apply to EnvLog loggers",
        EnvLogConstants.LOG_PREFIX);
  }

  private void shutdownBackend() {
    LoggerBackend backend = installedBackend;
    try {
      if (backend == LoggerBackend.LOGBACK) {
        invokeInstaller(EnvLogConstants.LOGBACK_INSTALLER_CLASS, "uninstall");
      } else if (backend == LoggerBackend.LOG4J2) {
        invokeInstaller(EnvLogConstants.LOG4J2_INSTALLER_CLASS, "uninstall");
      }
    } catch (Exception e) {
      logger.warn(
          "{} Failed to remove {} filter: {}", EnvLogConstants.LOG_PREFIX, backend, e.getMessage());
    } finally {
      installedBackend = LoggerBackend.NONE;
    }
  }

  /** Backend installers are loaded reflectively so neither backend is required at runtime */
  private static void invokeInstaller(String className, String methodName) throws Exception {
    Class<?> installerClass = Class.forName(className);
    try {
      if ("install".equals(methodName)) {
        Method install = installerClass.getMethod(methodName, LevelResolver.class);
        install.invoke(null, resolver);
      } else {
        Method uninstall = installerClass.getMethod(methodName);
        uninstall.invoke(null);
      }
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw e;
    }
  }
}
