package nfa2dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nondeterministic automaton with the epsilon transitions of an
 * {@link EpsilonNfa} folded into its ordinary transitions and final states.
 *
 * No new states are introduced: this is over the same state arena as the
 * automaton it was built from.
 */
public final class EpsilonFreeNfa implements DotGraph<String, String> {

  private static final Logger LOG = LoggerFactory.getLogger(EpsilonFreeNfa.class);

  /**
   * Automaton from which this one was derived (and which owns the states).
   */
  public final EpsilonNfa source;

  /**
   * Epsilon closures used during the elimination.
   */
  public final ClosureTable closures;

  /**
   * State transitions, indexed along starting states.
   *
   * The inner maps are not modifiable, never contain {@link EpsilonNfa#EPSILON}
   * and have their symbols in alphabet order. A missing symbol means there is
   * no transition (the destination sets are never empty).
   */
  public final List<Map<String, StateSet>> transitions;

  /**
   * Accepting states: those whose epsilon closure contains an accepting state
   * of the source automaton.
   */
  public final StateSet finalStates;

  private EpsilonFreeNfa(
    EpsilonNfa source,
    ClosureTable closures,
    List<Map<String, StateSet>> transitions,
    StateSet finalStates
  ) {
    this.source = source;
    this.closures = closures;
    this.transitions = transitions;
    this.finalStates = finalStates;
  }

  /**
   * Remove epsilon transitions from an automaton.
   *
   * For a state {@code s} and symbol {@code a}, the new destinations are the
   * closure of the states reached on {@code a} from any state in the closure of
   * {@code s}. Closing again after the move matters when the move lands on a
   * state that has its own epsilon transitions.
   *
   * @param nfa automaton with epsilon transitions
   * @return equivalent automaton without epsilon transitions
   * @throws InvalidSymbolException if the alphabet contains the epsilon symbol
   */
  public static EpsilonFreeNfa fromEpsilonNfa(EpsilonNfa nfa) {
    if (nfa.alphabet.contains(EpsilonNfa.EPSILON)) {
      throw new InvalidSymbolException(EpsilonNfa.EPSILON, "alphabet contains the epsilon symbol");
    }

    final ClosureTable closures = nfa.closureTable();
    LOG.debug("Computed epsilon closures: {}", closures);

    final var transitions = new ArrayList<Map<String, StateSet>>(nfa.states.size());
    final var finals = new ArrayList<Integer>();

    for (int state = 0; state < nfa.states.size(); state++) {
      final StateSet closure = closures.closureOf(state);

      if (closure.intersects(nfa.finalStates)) {
        finals.add(state);
      }

      final var transitionMap = new LinkedHashMap<String, StateSet>();
      for (String symbol : nfa.alphabet) {
        final StateSet move = closure
          .stream()
          .mapToObj(c -> nfa.transition(c, symbol).orElse(StateSet.EMPTY))
          .reduce(StateSet.EMPTY, StateSet::union);

        // An empty move is an implicit reject, not an empty destination
        if (!move.isEmpty()) {
          transitionMap.put(symbol, closures.closureOf(move));
        }
      }
      transitions.add(Collections.unmodifiableMap(transitionMap));
    }

    final var finalStates = new StateSet(finals);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Eliminated epsilon transitions, final states are {}", nfa.label(finalStates));
    }

    return new EpsilonFreeNfa(nfa, closures, Collections.unmodifiableList(transitions), finalStates);
  }

  /**
   * Look up the destinations of a transition.
   *
   * @param state index of the source state
   * @param symbol alphabet symbol
   * @return destinations, or empty if there is no such transition
   * @throws InvalidStateException if there is no state at that index
   */
  public Optional<StateSet> transition(int state, String symbol) {
    return Optional.ofNullable(transitions.get(source.checkState(state, "transition")).get(symbol));
  }

  /**
   * @param state source state name
   * @param symbol alphabet symbol
   * @return destinations, or empty if there is no such transition
   * @throws InvalidStateException if the state is not declared
   */
  public Optional<StateSet> transition(String state, String symbol) {
    return transition(source.indexOf(state), symbol);
  }

  public boolean isAccepting(int state) {
    return finalStates.contains(source.checkState(state, "final states"));
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return IntStream
      .range(0, source.states.size())
      .mapToObj((int id) -> new DotGraph.Vertex<String>(source.stateName(id), isAccepting(id)));
  }

  @Override
  public Stream<DotGraph.Edge<String, String>> edges() {
    return source.transitionEdges(transitions);
  }

  @Override
  public String initialVertex() {
    return source.stateName(source.initialState);
  }
}
