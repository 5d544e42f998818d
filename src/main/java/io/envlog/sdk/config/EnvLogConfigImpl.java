package io.envlog.sdk.config;

import io.envlog.sdk.constants.EnvLogConstants;
import io.envlog.sdk.types.Level;
import java.util.function.Function;

public class EnvLogConfigImpl implements EnvLogConfig {
  private String envVariable = EnvLogConstants.DEFAULT_ENV_VARIABLE;
  private String directives;
  private Level fallbackLevel = Level.WARN;
  private boolean installBackendFilter = true;
  private boolean reportSkippedDirectives = true;
  private boolean verbose = false;

  public EnvLogConfigImpl() {}

  public EnvLogConfigImpl(EnvLogConfig config) {
    this.envVariable =
        config.getEnvVariable() != null && !config.getEnvVariable().isBlank()
            ? config.getEnvVariable()
            : this.envVariable;
    this.directives = config.getDirectives();
    this.fallbackLevel =
        config.getFallbackLevel() != null ? config.getFallbackLevel() : this.fallbackLevel;
    this.installBackendFilter = config.isInstallBackendFilter();
    this.reportSkippedDirectives = config.isReportSkippedDirectives();
    this.verbose = config.isVerbose();
  }

  // Builder pattern for easy configuration
  public static Builder builder() {
    return new Builder();
  }

  // Builder with environment variable defaults
  public static Builder builderWithEnvDefaults() {
    return builderWithEnvDefaults(System::getenv);
  }

  static Builder builderWithEnvDefaults(Function<String, String> env) {
    Builder builder = new Builder();

    String envVariable = env.apply(EnvLogConstants.ENV_ENV_VARIABLE);
    if (envVariable != null && !envVariable.isBlank()) {
      builder.envVariable(envVariable.trim());
    }

    String fallbackLevel = env.apply(EnvLogConstants.ENV_FALLBACK_LEVEL);
    if (fallbackLevel != null) {
      builder.fallbackLevel(Level.fromString(fallbackLevel, Level.WARN));
    }

    builder.installBackendFilter(env.apply(EnvLogConstants.ENV_INSTALL_BACKEND_FILTER));
    builder.reportSkippedDirectives(env.apply(EnvLogConstants.ENV_REPORT_SKIPPED_DIRECTIVES));
    builder.verbose(env.apply(EnvLogConstants.ENV_VERBOSE));

    return builder;
  }

  public static class Builder {
    private final EnvLogConfigImpl config = new EnvLogConfigImpl();

    public Builder envVariable(String envVariable) {
      config.envVariable = envVariable;
      return this;
    }

    public Builder directives(String directives) {
      config.directives = directives;
      return this;
    }

    public Builder fallbackLevel(Level fallbackLevel) {
      config.fallbackLevel = fallbackLevel;
      return this;
    }

    public Builder installBackendFilter(boolean installBackendFilter) {
      config.installBackendFilter = installBackendFilter;
      return this;
    }

    public Builder reportSkippedDirectives(boolean reportSkippedDirectives) {
      config.reportSkippedDirectives = reportSkippedDirectives;
      return this;
    }

    public Builder verbose(boolean verbose) {
      config.verbose = verbose;
      return this;
    }

    // Overloaded methods for environment variable support
    public Builder installBackendFilter(String installBackendFilter) {
      if (installBackendFilter != null) {
        config.installBackendFilter = Boolean.parseBoolean(installBackendFilter.trim());
      }
      return this;
    }

    public Builder reportSkippedDirectives(String reportSkippedDirectives) {
      if (reportSkippedDirectives != null) {
        config.reportSkippedDirectives = Boolean.parseBoolean(reportSkippedDirectives.trim());
      }
      return this;
    }

    public Builder verbose(String verbose) {
      if (verbose != null) {
        config.verbose = Boolean.parseBoolean(verbose.trim());
      }
      return this;
    }

    public EnvLogConfigImpl build() {
      if (config.envVariable == null || config.envVariable.isBlank()) {
        config.envVariable = EnvLogConstants.DEFAULT_ENV_VARIABLE;
      }
      if (config.fallbackLevel == null) {
        config.fallbackLevel = Level.WARN;
      }
      return config;
    }
  }

  // Getters and setters
  @Override
  public String getEnvVariable() {
    return envVariable;
  }

  public void setEnvVariable(String envVariable) {
    this.envVariable = envVariable;
  }

  @Override
  public String getDirectives() {
    return directives;
  }

  public void setDirectives(String directives) {
    this.directives = directives;
  }

  @Override
  public Level getFallbackLevel() {
    return fallbackLevel;
  }

  public void setFallbackLevel(Level fallbackLevel) {
    this.fallbackLevel = fallbackLevel;
  }

  @Override
  public boolean isInstallBackendFilter() {
    return installBackendFilter;
  }

  public void setInstallBackendFilter(boolean installBackendFilter) {
    this.installBackendFilter = installBackendFilter;
  }

  @Override
  public boolean isReportSkippedDirectives() {
    return reportSkippedDirectives;
  }

  public void setReportSkippedDirectives(boolean reportSkippedDirectives) {
    this.reportSkippedDirectives = reportSkippedDirectives;
  }

  @Override
  public boolean isVerbose() {
    return verbose;
  }

  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }
}
