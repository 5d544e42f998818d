package io.envlog.sdk.core;

import io.envlog.sdk.types.Level;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One {@code target=level} directive: a logger-name prefix and the level applied beneath it. */
public final class Rule {

  private final List<String> segments;
  private final Level level;
  private final String target;
  private final String targetWithSeparator;

  /**
   * @param segments non-empty list of non-empty, dot-free name segments
   * @param level level applied to the target and its descendants
   */
  public Rule(List<String> segments, Level level) {
    Objects.requireNonNull(segments, "segments");
    Objects.requireNonNull(level, "level");
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("Rule target must have at least one segment");
    }
    for (String segment : segments) {
      if (segment == null || segment.isEmpty() || segment.indexOf('.') >= 0) {
        throw new IllegalArgumentException("Invalid rule segment: '" + segment + "'");
      }
    }
    this.segments = Collections.unmodifiableList(List.copyOf(segments));
    this.level = level;
    this.target = String.join(".", segments);
    this.targetWithSeparator = target + ".";
  }

  public static Rule of(String target, Level level) {
    return new Rule(List.of(target.split("\\.", -1)), level);
  }

  public List<String> getSegments() {
    return segments;
  }

  public Level getLevel() {
    return level;
  }

  /** Dotted form of the target, e.g. {@code myapp.database} */
  public String getTarget() {
    return target;
  }

  /** Number of segments in the target */
  public int getSpecificity() {
    return segments.size();
  }

  /**
   * Segment-wise prefix match: {@code myapp} matches {@code myapp} and {@code myapp.database} but
   * not {@code myapplication}.
   */
  public boolean matches(String loggerName) {
    if (loggerName == null) {
      return false;
    }
    return loggerName.equals(target) || loggerName.startsWith(targetWithSeparator);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Rule)) {
      return false;
    }
    Rule other = (Rule) o;
    return segments.equals(other.segments) && level == other.level;
  }

  @Override
  public int hashCode() {
    return Objects.hash(segments, level);
  }

  @Override
  public String toString() {
    return target + "=" + level.directiveName();
  }
}
