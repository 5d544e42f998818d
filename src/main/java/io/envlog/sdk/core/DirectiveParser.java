package io.envlog.sdk.core;

import io.envlog.sdk.types.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Parses directive strings such as {@code warn,myapp=info,myapp.database=trace} into a {@link
 * Ruleset}.
 *
 * <p>Parsing is total: malformed directives are dropped one at a time and reported to the optional
 * listener, never thrown. A bad environment variable must not stop the host from starting.
 */
public final class DirectiveParser {

  private static final Consumer<SkippedDirective> IGNORE_SKIPPED = skipped -> {};

  private DirectiveParser() {
    // Utility class
  }

  /** Parse with the {@link Ruleset#FALLBACK_LEVEL} default and no skip reporting */
  public static Ruleset parse(String raw) {
    return parse(raw, Ruleset.FALLBACK_LEVEL, IGNORE_SKIPPED);
  }

  /**
   * Parse a directive string.
   *
   * @param raw directive string; {@code null} is treated as empty
   * @param fallback default level used when no bare level directive is present
   * @param onSkipped receives each dropped directive, in order of appearance
   */
  public static Ruleset parse(String raw, Level fallback, Consumer<SkippedDirective> onSkipped) {
    Level defaultLevel = fallback != null ? fallback : Ruleset.FALLBACK_LEVEL;
    Consumer<SkippedDirective> listener = onSkipped != null ? onSkipped : IGNORE_SKIPPED;
    if (raw == null || raw.isBlank()) {
      return Ruleset.defaults(defaultLevel);
    }

    List<Rule> rules = new ArrayList<>();
    for (String token : raw.split(",")) {
      String directive = token.trim();
      if (directive.isEmpty()) {
        continue;
      }

      int separator = directive.indexOf('=');
      if (separator < 0) {
        // Bare level: last one wins
        Optional<Level> level = Level.parse(directive);
        if (level.isPresent()) {
          defaultLevel = level.get();
        } else {
          listener.accept(new SkippedDirective(directive, SkippedDirective.Reason.UNKNOWN_LEVEL));
        }
        continue;
      }

      String target = directive.substring(0, separator).trim();
      String levelName = directive.substring(separator + 1).trim();
      if (target.isEmpty()) {
        listener.accept(new SkippedDirective(directive, SkippedDirective.Reason.EMPTY_TARGET));
        continue;
      }
      List<String> segments = splitTarget(target);
      if (segments == null) {
        listener.accept(new SkippedDirective(directive, SkippedDirective.Reason.MALFORMED_TARGET));
        continue;
      }
      Optional<Level> level = Level.parse(levelName);
      if (level.isEmpty()) {
        listener.accept(new SkippedDirective(directive, SkippedDirective.Reason.UNKNOWN_LEVEL));
        continue;
      }
      rules.add(new Rule(segments, level.get()));
    }
    return new Ruleset(rules, defaultLevel);
  }

  /** Split a dotted target, or return null when a segment is empty or holds whitespace */
  private static List<String> splitTarget(String target) {
    List<String> segments = new ArrayList<>();
    int start = 0;
    while (true) {
      int dot = target.indexOf('.', start);
      String segment = dot < 0 ? target.substring(start) : target.substring(start, dot);
      if (segment.isEmpty() || containsWhitespace(segment)) {
        return null;
      }
      segments.add(segment);
      if (dot < 0) {
        return segments;
      }
      start = dot + 1;
    }
  }

  private static boolean containsWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
