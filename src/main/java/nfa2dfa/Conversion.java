package nfa2dfa;

/**
 * Result of converting an automaton with epsilon transitions into a DFA,
 * along with the intermediate artifacts.
 *
 * @param closures epsilon closure of every source state
 * @param epsilonFreeNfa automaton with the epsilon transitions eliminated
 * @param dfa deterministic automaton from the subset construction
 */
public record Conversion(
  ClosureTable closures,
  EpsilonFreeNfa epsilonFreeNfa,
  SubsetDfa dfa
) {

  /**
   * Convert an automaton. This is a pure function of its input: converting the
   * same automaton twice produces equal results.
   *
   * @param nfa validated automaton
   * @return closures, epsilon-free NFA and DFA
   */
  public static Conversion convert(EpsilonNfa nfa) {
    final var epsilonFree = EpsilonFreeNfa.fromEpsilonNfa(nfa);
    final var dfa = SubsetDfa.fromNfa(epsilonFree);
    return new Conversion(epsilonFree.closures, epsilonFree, dfa);
  }
}
