package io.envlog.sdk;

import io.envlog.sdk.config.EnvLogConfigImpl;
import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.core.Ruleset;
import io.envlog.sdk.logger.EnvLogLogger;
import io.envlog.sdk.logger.LoggerBackend;
import io.envlog.sdk.runtime.EnvLogRuntime;
import io.envlog.sdk.types.Level;

/**
 * Main entry point for EnvLog
 *
 * <p>Usage: EnvLog.init(); // reads JAVA_LOG, e.g. "warn,myapp=info,myapp.database=trace"
 * EnvLogLogger logger = EnvLog.getLogger(MyClass.class);
 */
public final class EnvLog {

  private EnvLog() {
    // Utility class
  }

  /** Initialize from environment defaults and the JAVA_LOG variable */
  public static void init() {
    init(EnvLogConfigImpl.builderWithEnvDefaults().build());
  }

  /** Initialize EnvLog with configuration */
  public static void init(EnvLogConfigImpl config) {
    EnvLogRuntime.initialize(config);
  }

  /** Check if EnvLog is initialized */
  public static boolean isInitialized() {
    return EnvLogRuntime.isInitialized();
  }

  /** Get the current configuration */
  public static EnvLogConfigImpl getConfig() {
    return EnvLogRuntime.getInstance().getConfig();
  }

  /** Apply a directive string to the shared resolver */
  public static Ruleset configure(String directives) {
    return EnvLogRuntime.configure(directives);
  }

  /** Replace the directives in effect; loggers pick up the change on their next call */
  public static Ruleset reconfigure(String directives) {
    return EnvLogRuntime.configure(directives);
  }

  /** Threshold in effect for a logger name */
  public static Level effectiveLevel(String loggerName) {
    return EnvLogRuntime.getResolver().effectiveLevel(loggerName);
  }

  /** Check whether a message at {@code level} from {@code loggerName} would be emitted */
  public static boolean isEnabled(String loggerName, Level level) {
    return EnvLogRuntime.getResolver().isEnabled(loggerName, level);
  }

  /** The shared resolver, for injection into host code */
  public static LevelResolver getResolver() {
    return EnvLogRuntime.getResolver();
  }

  /** Get an EnvLog logger */
  public static EnvLogLogger getLogger(Class<?> clazz) {
    return EnvLogLogger.getLogger(clazz);
  }

  /** Get an EnvLog logger */
  public static EnvLogLogger getLogger(String name) {
    return EnvLogLogger.getLogger(name);
  }

  /** Backend detected on the classpath */
  public static LoggerBackend getDetectedBackend() {
    return LoggerBackend.detect();
  }

  /** Shutdown EnvLog */
  public static void shutdown() {
    EnvLogRuntime runtime = EnvLogRuntime.currentInstance();
    if (runtime != null) {
      runtime.shutdown();
    }
  }
}
