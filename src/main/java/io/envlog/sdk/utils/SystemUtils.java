package io.envlog.sdk.utils;

import io.envlog.sdk.constants.EnvLogConstants;
import java.util.function.Function;

public class SystemUtils {

  /**
   * Read the raw directive string for the given environment variable.
   *
   * <p>Sources are tried in order:
   *
   * <ul>
   *   <li>The environment variable itself
   *   <li>System property "envlog.directives"
   *   <li>Empty string, which parses to the fallback level with no rules
   * </ul>
   *
   * @param envVariable name of the environment variable, e.g. {@code JAVA_LOG}
   * @return the trimmed directive string, never null
   */
  public static String readDirectives(String envVariable) {
    return readDirectives(envVariable, System::getenv, System::getProperty);
  }

  static String readDirectives(
      String envVariable,
      Function<String, String> env,
      Function<String, String> systemProperties) {
    if (envVariable != null && !envVariable.isBlank()) {
      String directives = env.apply(envVariable);
      if (directives != null && !directives.trim().isEmpty()) {
        return directives.trim();
      }
    }

    String directives = systemProperties.apply(EnvLogConstants.SYSTEM_PROPERTY_DIRECTIVES);
    if (directives != null && !directives.trim().isEmpty()) {
      return directives.trim();
    }

    return "";
  }

  private SystemUtils() {
    // Utility class
  }
}
