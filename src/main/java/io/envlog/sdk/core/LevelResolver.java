package io.envlog.sdk.core;

import io.envlog.sdk.types.Level;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Answers "which level is enabled for this logger?" from the current {@link Ruleset}.
 *
 * <p>The most specific matching rule wins; among rules of equal specificity the one declared later
 * wins. Names no rule matches get the ruleset's default level.
 *
 * <p>Reads are lock-free and see either the old or the new ruleset in full. Writers are serialized
 * against each other; the last one wins.
 */
public final class LevelResolver {

  private final AtomicReference<Ruleset> ruleset;
  private final Object writeLock = new Object();

  public LevelResolver(Ruleset ruleset) {
    this.ruleset = new AtomicReference<>(ruleset != null ? ruleset : Ruleset.defaults());
  }

  public LevelResolver() {
    this(Ruleset.defaults());
  }

  /** The ruleset currently in effect */
  public Ruleset getRuleset() {
    return ruleset.get();
  }

  /** Threshold in effect for the given logger name */
  public Level effectiveLevel(String loggerName) {
    return resolve(ruleset.get(), loggerName);
  }

  /** True when a message at {@code level} from {@code loggerName} should be emitted */
  public boolean isEnabled(String loggerName, Level level) {
    if (level == null) {
      return false;
    }
    return level.isEnabledFor(effectiveLevel(loggerName));
  }

  /** Parse {@code raw} and swap the result in */
  public Ruleset reconfigure(String raw) {
    return reconfigure(raw, Ruleset.FALLBACK_LEVEL, null);
  }

  /**
   * Parse {@code raw} and swap the result in.
   *
   * @return the ruleset now in effect
   */
  public Ruleset reconfigure(String raw, Level fallback, Consumer<SkippedDirective> onSkipped) {
    synchronized (writeLock) {
      Ruleset parsed = DirectiveParser.parse(raw, fallback, onSkipped);
      ruleset.set(parsed);
      return parsed;
    }
  }

  /** Swap in an already-built ruleset */
  public void replace(Ruleset replacement) {
    synchronized (writeLock) {
      ruleset.set(replacement != null ? replacement : Ruleset.defaults());
    }
  }

  static Level resolve(Ruleset snapshot, String loggerName) {
    if (loggerName == null || loggerName.isEmpty()) {
      return snapshot.getDefaultLevel();
    }
    List<Rule> rules = snapshot.getRules();
    Rule best = null;
    for (int i = 0; i < rules.size(); i++) {
      Rule rule = rules.get(i);
      // >= so a later rule of equal specificity replaces an earlier one
      if (rule.matches(loggerName)
          && (best == null || rule.getSpecificity() >= best.getSpecificity())) {
        best = rule;
      }
    }
    return best != null ? best.getLevel() : snapshot.getDefaultLevel();
  }
}
