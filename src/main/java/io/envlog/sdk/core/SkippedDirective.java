package io.envlog.sdk.core;

import java.util.Objects;

/** A directive dropped while parsing, with the reason it was dropped. */
public final class SkippedDirective {

  public enum Reason {
    /** Level name outside the supported vocabulary */
    UNKNOWN_LEVEL,
    /** {@code =level} with nothing before the separator */
    EMPTY_TARGET,
    /** Target with an empty segment or embedded whitespace */
    MALFORMED_TARGET
  }

  private final String directive;
  private final Reason reason;

  public SkippedDirective(String directive, Reason reason) {
    this.directive = Objects.requireNonNull(directive, "directive");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String getDirective() {
    return directive;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SkippedDirective)) {
      return false;
    }
    SkippedDirective other = (SkippedDirective) o;
    return directive.equals(other.directive) && reason == other.reason;
  }

  @Override
  public int hashCode() {
    return Objects.hash(directive, reason);
  }

  @Override
  public String toString() {
    return "'" + directive + "' (" + reason + ")";
  }
}
