package io.envlog.sdk.config;

import io.envlog.sdk.types.Level;

public interface EnvLogConfig {

  // Name of the environment variable holding the directive string
  String getEnvVariable();

  // Explicit directive string; when set, the environment is not consulted
  String getDirectives();

  // Default level when the directives carry no bare level
  Level getFallbackLevel();

  // Backend integration
  boolean isInstallBackendFilter();

  // Diagnostics
  boolean isReportSkippedDirectives();

  boolean isVerbose();
}
