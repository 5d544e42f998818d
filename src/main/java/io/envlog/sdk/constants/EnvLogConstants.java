package io.envlog.sdk.constants;

public final class EnvLogConstants {

  public static final String LOG_PREFIX = "[EnvLog]";

  // Directive source
  public static final String DEFAULT_ENV_VARIABLE = "JAVA_LOG";

  // System Properties
  public static final String SYSTEM_PROPERTY_DIRECTIVES = "envlog.directives";

  // Environment Variables
  public static final String ENV_ENV_VARIABLE = "ENVLOG_ENV_VARIABLE";
  public static final String ENV_FALLBACK_LEVEL = "ENVLOG_FALLBACK_LEVEL";
  public static final String ENV_INSTALL_BACKEND_FILTER = "ENVLOG_INSTALL_BACKEND_FILTER";
  public static final String ENV_REPORT_SKIPPED_DIRECTIVES = "ENVLOG_REPORT_SKIPPED_DIRECTIVES";
  public static final String ENV_VERBOSE = "ENVLOG_VERBOSE";

  // Backend integration
  public static final String LOGBACK_TURBO_FILTER_NAME = "ENVLOG";
  public static final String LOGBACK_INSTALLER_CLASS =
      "io.envlog.sdk.logger.logback.LogbackEnvLogInstaller";
  public static final String LOG4J2_INSTALLER_CLASS =
      "io.envlog.sdk.logger.log4j2.Log4j2EnvLogInstaller";

  private EnvLogConstants() {
    // Utility class
  }
}
