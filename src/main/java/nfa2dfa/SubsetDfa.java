package nfa2dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic automaton obtained by the subset (powerset) construction.
 *
 * Every state of this DFA is a non-empty {@link StateSet} of states of the
 * source automaton. Only sets reachable from the start state are built.
 */
public final class SubsetDfa implements Dfa<StateSet, String>, DotGraph<StateSet, String> {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetDfa.class);

  /**
   * Automaton owning the states referenced by the composite states.
   */
  public final EpsilonNfa source;

  /**
   * Alphabet the construction ran over, in the order symbols were processed.
   */
  public final List<String> alphabet;

  /**
   * Composite states, in the order they were discovered. The initial state is
   * always first.
   *
   * The list is not modifiable.
   */
  public final List<StateSet> states;

  /**
   * State transitions, indexed along starting states (in discovery order).
   *
   * None of the nested maps are modifiable. Missing symbols mean there is no
   * transition.
   */
  public final Map<StateSet, Map<String, StateSet>> transitions;

  /**
   * Initial state.
   */
  public final StateSet initialState;

  /**
   * Accepting states, in discovery order.
   */
  public final Set<StateSet> finalStates;

  private SubsetDfa(
    EpsilonNfa source,
    List<String> alphabet,
    List<StateSet> states,
    Map<StateSet, Map<String, StateSet>> transitions,
    StateSet initialState,
    Set<StateSet> finalStates
  ) {
    this.source = source;
    this.alphabet = alphabet;
    this.states = states;
    this.transitions = transitions;
    this.initialState = initialState;
    this.finalStates = finalStates;
  }

  /**
   * Determinize an epsilon-free NFA, starting from its source's start state and
   * using its source's alphabet.
   *
   * @param nfa epsilon-free automaton
   * @return equivalent DFA
   */
  public static SubsetDfa fromNfa(EpsilonFreeNfa nfa) {
    return determinize(nfa, nfa.source.stateName(nfa.source.initialState), nfa.source.alphabet);
  }

  /**
   * Construct a DFA using a breadth-first powerset construction.
   *
   * Symbols are tried in the order given at every state, so the discovery
   * order of states is the same from one run to the next.
   *
   * @param nfa epsilon-free automaton
   * @param start name of the start state
   * @param alphabet symbols to follow
   * @return equivalent DFA
   * @throws InvalidStateException if the start state is not declared
   * @throws InvalidSymbolException if the alphabet contains the epsilon symbol
   */
  public static SubsetDfa determinize(EpsilonFreeNfa nfa, String start, List<String> alphabet) {
    final int startIndex = nfa.source.indexOf(start);
    for (String symbol : alphabet) {
      if (EpsilonNfa.EPSILON.equals(symbol)) {
        throw new InvalidSymbolException(symbol, "cannot determinize over the epsilon symbol");
      }
    }

    // Set equality on `StateSet` deduplicates, insertion order is discovery order
    final var seenStates = new LinkedHashSet<StateSet>();
    final var toVisit = new LinkedList<StateSet>();
    final var transitions = new LinkedHashMap<StateSet, Map<String, StateSet>>();

    final var initialState = StateSet.of(startIndex);
    seenStates.add(initialState);
    toVisit.addLast(initialState);

    while (!toVisit.isEmpty()) {
      final StateSet powerState = toVisit.removeFirst();
      final var transitionMap = new LinkedHashMap<String, StateSet>();

      for (String symbol : alphabet) {
        final StateSet next = powerState
          .stream()
          .mapToObj(s -> nfa.transition(s, symbol).orElse(StateSet.EMPTY))
          .reduce(StateSet.EMPTY, StateSet::union);

        // Implicit reject
        if (next.isEmpty()) {
          continue;
        }

        if (seenStates.add(next)) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Discovered state {} on '{}' from {}", nfa.source.label(next), symbol, nfa.source.label(powerState));
          }
          toVisit.addLast(next);
        }
        transitionMap.put(symbol, next);
      }

      transitions.put(powerState, Collections.unmodifiableMap(transitionMap));
    }

    final Set<StateSet> finalStates = seenStates
      .stream()
      .filter(powerState -> powerState.intersects(nfa.finalStates))
      .collect(Collectors.toCollection(LinkedHashSet::new));

    LOG.debug("Subset construction produced {} states ({} accepting)", seenStates.size(), finalStates.size());

    return new SubsetDfa(
      nfa.source,
      List.copyOf(alphabet),
      Collections.unmodifiableList(new ArrayList<>(seenStates)),
      Collections.unmodifiableMap(transitions),
      initialState,
      Collections.unmodifiableSet(finalStates)
    );
  }

  @Override
  public StateSet initial() {
    return initialState;
  }

  @Override
  public Set<StateSet> accepting() {
    return finalStates;
  }

  /**
   * @param state composite state
   * @return transitions out of the state (empty for states not in this DFA)
   */
  @Override
  public Map<String, StateSet> transitionsMap(StateSet state) {
    return transitions.getOrDefault(state, Map.of());
  }

  /**
   * Canonical label of a composite state.
   *
   * @param state composite state
   * @return names of the underlying states, sorted lexicographically
   */
  public List<String> label(StateSet state) {
    return source.label(state);
  }

  @Override
  public Stream<DotGraph.Vertex<StateSet>> vertices() {
    return states
      .stream()
      .map((StateSet state) -> new DotGraph.Vertex<StateSet>(state, finalStates.contains(state)));
  }

  @Override
  public Stream<DotGraph.Edge<StateSet, String>> edges() {
    return states
      .stream()
      .flatMap((StateSet from) -> transitionsMap(from)
        .entrySet()
        .stream()
        .map(entry -> new DotGraph.Edge<StateSet, String>(from, entry.getValue(), entry.getKey()))
      );
  }

  @Override
  public StateSet initialVertex() {
    return initialState;
  }

  @Override
  public String renderVertexLabel(StateSet state) {
    return DotGraph.escapeHtml(CanonicalLabel.render(label(state)));
  }
}
