package io.envlog.sdk.logger;

/** Logging backends EnvLog can install its level filter into */
public enum LoggerBackend {
  LOGBACK,
  LOG4J2,
  NONE;

  /** Detect which logging backend is available on the classpath (prefers Logback) */
  public static LoggerBackend detect() {
    // Try Logback first (preferred)
    if (isLogbackAvailable()) {
      return LOGBACK;
    }

    // Fall back to Log4j2
    if (isLog4j2Available()) {
      return LOG4J2;
    }

    // No supported backend found
    return NONE;
  }

  /** Check if Logback is available on the classpath */
  public static boolean isLogbackAvailable() {
    return isPresent("ch.qos.logback.classic.turbo.TurboFilter");
  }

  /** Check if Log4j2 is available on the classpath */
  public static boolean isLog4j2Available() {
    return isPresent("org.apache.logging.log4j.core.filter.AbstractFilter");
  }

  private static boolean isPresent(String className) {
    try {
      Class.forName(className, false, LoggerBackend.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException | LinkageError e) {
      return false;
    }
  }
}
