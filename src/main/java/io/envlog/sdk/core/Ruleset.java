package io.envlog.sdk.core;

import io.envlog.sdk.types.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of parsing a directive string: rules in declaration order plus the default
 * level applied when no rule matches.
 */
public final class Ruleset {

  public static final Level FALLBACK_LEVEL = Level.WARN;

  private static final Ruleset DEFAULTS = new Ruleset(List.of(), FALLBACK_LEVEL);

  private final List<Rule> rules;
  private final Level defaultLevel;

  public Ruleset(List<Rule> rules, Level defaultLevel) {
    Objects.requireNonNull(rules, "rules");
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    this.defaultLevel = Objects.requireNonNull(defaultLevel, "defaultLevel");
  }

  /** No rules, {@link #FALLBACK_LEVEL} default */
  public static Ruleset defaults() {
    return DEFAULTS;
  }

  public static Ruleset defaults(Level defaultLevel) {
    return defaultLevel == FALLBACK_LEVEL ? DEFAULTS : new Ruleset(List.of(), defaultLevel);
  }

  public List<Rule> getRules() {
    return rules;
  }

  public Level getDefaultLevel() {
    return defaultLevel;
  }

  public boolean isEmpty() {
    return rules.isEmpty();
  }

  /**
   * Render back into directive syntax, default level first, e.g. {@code
   * warn,myapp=info,myapp.database=trace}. Parsing the result yields an equal ruleset.
   */
  public String toDirectiveString() {
    StringBuilder sb = new StringBuilder(defaultLevel.directiveName());
    for (Rule rule : rules) {
      sb.append(',').append(rule);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Ruleset)) {
      return false;
    }
    Ruleset other = (Ruleset) o;
    return rules.equals(other.rules) && defaultLevel == other.defaultLevel;
  }

  @Override
  public int hashCode() {
    return Objects.hash(rules, defaultLevel);
  }

  @Override
  public String toString() {
    return "Ruleset{" + toDirectiveString() + "}";
  }
}
