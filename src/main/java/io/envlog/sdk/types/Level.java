package io.envlog.sdk.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Log levels understood by directive strings, ordered from most verbose to least.
 *
 * <p>A level used as a threshold enables messages at that level and every level ranked above it.
 */
public enum Level {
  TRACE,
  DEBUG,
  INFO,
  WARN,
  ERROR,
  OFF;

  /** Verbosity rank: TRACE=0 through OFF=5 */
  public int rank() {
    return ordinal();
  }

  /** True when a message at this level passes the given threshold */
  public boolean isEnabledFor(Level threshold) {
    return threshold != null && rank() >= threshold.rank();
  }

  /**
   * Parse a level name case-insensitively. Accepts {@code warning} as an alias of {@code warn}.
   *
   * @return the level, or empty for {@code null} and unknown names
   */
  public static Optional<Level> parse(String name) {
    if (name == null) {
      return Optional.empty();
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "trace":
        return Optional.of(TRACE);
      case "debug":
        return Optional.of(DEBUG);
      case "info":
        return Optional.of(INFO);
      case "warn":
      case "warning":
        return Optional.of(WARN);
      case "error":
        return Optional.of(ERROR);
      case "off":
        return Optional.of(OFF);
      default:
        return Optional.empty();
    }
  }

  public static Level fromString(String level, Level fallback) {
    return parse(level).orElse(fallback);
  }

  public String directiveName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
