package nfa2dfa;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;

/**
 * Deterministic finite automata
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public interface Dfa<Q, E> {

  /**
   * Initial state
   *
   * @return starting state in the machine
   */
  Q initial();

  /**
   * Accepting states
   *
   * @return accepting states in the machine
   */
  Set<Q> accepting();

  /**
   * Look up the mapping of transitions from a certain state
   *
   * Symbols with no outgoing transition are simply missing from the map.
   *
   * @param state state inside the DFA
   * @return map of alphabet symbols to target states
   */
  Map<E, Q> transitionsMap(Q state);

  /**
   * Look up a single transition.
   *
   * @param state state inside the DFA
   * @param symbol alphabet symbol
   * @return target state, or empty if the DFA rejects on that symbol
   */
  default Optional<Q> transition(Q state, E symbol) {
    return Optional.ofNullable(transitionsMap(state).get(symbol));
  }

  /**
   * All states
   *
   * @return set of all (reachable) states in the DFA
   */
  default Set<Q> allStates() {
    final Set<Q> states = new HashSet<Q>();
    final Stack<Q> toVisit = new Stack<Q>();

    {
      final Q initial = initial();
      toVisit.push(initial);
      states.add(initial);
    }

    while (!toVisit.empty()) {
      for (Q target : transitionsMap(toVisit.pop()).values()) {
        if (states.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return states;
  }
}
