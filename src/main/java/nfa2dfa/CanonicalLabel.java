package nfa2dfa;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stable display labels for sets of states.
 *
 * Labels are a presentation concern only: composite states are compared and
 * deduplicated through {@link StateSet} equality, never through their labels.
 */
public final class CanonicalLabel {

  private CanonicalLabel() { }

  /**
   * Order state names lexicographically.
   *
   * @param states state names, in any order
   * @return unmodifiable sorted list of the names
   */
  public static List<String> of(Collection<String> states) {
    return states
      .stream()
      .sorted()
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Render a label as a single string, eg. {@code {q0,q1}}.
   *
   * @param label label produced by {@link #of}
   * @return display string
   */
  public static String render(List<String> label) {
    return label
      .stream()
      .collect(Collectors.joining(",", "{", "}"));
  }
}
