package nfa2dfa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Epsilon closures of every state in an automaton.
 *
 * For every state {@code s}, {@code s} is in its own closure and the closure
 * of any member of {@code closureOf(s)} is a subset of {@code closureOf(s)}.
 */
public final class ClosureTable {

  private final EpsilonNfa nfa;

  // Indexed along states
  private final List<StateSet> closures;

  ClosureTable(EpsilonNfa nfa, List<StateSet> closures) {
    this.nfa = nfa;
    this.closures = Collections.unmodifiableList(closures);
  }

  /**
   * @param state index of a state
   * @return closure of the state
   * @throws InvalidStateException if there is no state at that index
   */
  public StateSet closureOf(int state) {
    return closures.get(nfa.checkState(state, "closure table"));
  }

  /**
   * @param state state name
   * @return closure of the state
   * @throws InvalidStateException if the state is not declared
   */
  public StateSet closureOf(String state) {
    return closures.get(nfa.indexOf(state));
  }

  /**
   * Union of the closures of several states.
   *
   * @param states indices of states
   * @return states reachable from any of {@code states} over epsilon transitions
   */
  public StateSet closureOf(StateSet states) {
    return states
      .stream()
      .mapToObj(closures::get)
      .reduce(StateSet.EMPTY, StateSet::union);
  }

  public int size() {
    return closures.size();
  }

  /**
   * Closures keyed and labelled by state name, in declaration order.
   *
   * @return map from state name to the canonical label of its closure
   */
  public Map<String, List<String>> labelled() {
    final var output = new LinkedHashMap<String, List<String>>();
    for (int state = 0; state < closures.size(); state++) {
      output.put(nfa.stateName(state), nfa.label(closures.get(state)));
    }
    return Collections.unmodifiableMap(output);
  }

  @Override
  public String toString() {
    return labelled().toString();
  }
}
