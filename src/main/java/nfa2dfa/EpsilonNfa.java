package nfa2dfa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Finite automaton with (optional) epsilon transitions.
 *
 * This is the validated input to the conversion. It owns the arena of states:
 * every other structure ({@link StateSet}, {@link ClosureTable},
 * {@link EpsilonFreeNfa}, {@link SubsetDfa}) refers to states by their index
 * in {@link #states}.
 *
 * Instances can only be obtained through {@link #validate} or a
 * {@link Builder}, so all of the following always hold:
 *
 *   - the start state and final states are declared states
 *
 *   - transition destinations are declared states
 *
 *   - transitions are on alphabet symbols or on {@link #EPSILON}, and the
 *     alphabet never contains {@link #EPSILON}
 */
public final class EpsilonNfa implements DotGraph<String, String> {

  /**
   * Reserved symbol for the empty string.
   */
  public static final String EPSILON = "ε";

  /**
   * State names, in declaration order. A state's position in this list is its
   * index everywhere else.
   *
   * The list is not modifiable.
   */
  public final List<String> states;

  /**
   * Alphabet symbols, in declaration order (epsilon excluded).
   *
   * The list is not modifiable.
   */
  public final List<String> alphabet;

  /**
   * Index of the start state.
   */
  public final int initialState;

  /**
   * Indices of the accepting states.
   */
  public final StateSet finalStates;

  /**
   * State transitions, indexed along starting states.
   *
   * The inner maps are not modifiable and have their symbols ordered as in the
   * alphabet, with {@link #EPSILON} last. Symbols with no transition are
   * missing from the map (there are no empty destination sets).
   */
  public final List<Map<String, StateSet>> transitions;

  private final Map<String, Integer> stateIndices;

  private EpsilonNfa(
    List<String> states,
    Map<String, Integer> stateIndices,
    List<String> alphabet,
    int initialState,
    StateSet finalStates,
    List<Map<String, StateSet>> transitions
  ) {
    this.states = states;
    this.stateIndices = stateIndices;
    this.alphabet = alphabet;
    this.initialState = initialState;
    this.finalStates = finalStates;
    this.transitions = transitions;
  }

  /**
   * Validate a raw automaton description and build the automaton from it.
   *
   * Checks are run in a fixed order and the first violation is raised.
   *
   * @param states declared states (iteration order becomes declaration order)
   * @param alphabet declared alphabet symbols
   * @param start start state
   * @param finals accepting states
   * @param transitions destination states for each (state, symbol) pair
   * @return validated automaton
   * @throws InvalidAutomatonException on missing, blank or duplicated entries
   * @throws InvalidStateException when an undeclared state is referenced
   * @throws InvalidSymbolException when epsilon is in the alphabet, or a
   *                                transition is on an undeclared symbol
   */
  public static EpsilonNfa validate(
    Collection<String> states,
    List<String> alphabet,
    String start,
    Collection<String> finals,
    Map<TransitionKey, ? extends Collection<String>> transitions
  ) {

    // States
    if (states == null || states.isEmpty()) {
      throw new InvalidAutomatonException("automaton must declare at least one state");
    }
    final var stateList = new ArrayList<String>(states.size());
    final var stateIndices = new HashMap<String, Integer>();
    for (String state : states) {
      if (state == null || state.isBlank()) {
        throw new InvalidAutomatonException("state names must not be blank");
      } else if (stateIndices.putIfAbsent(state, stateList.size()) != null) {
        throw new InvalidAutomatonException("state '" + state + "' is declared more than once");
      }
      stateList.add(state);
    }

    // Alphabet
    final var alphabetList = new ArrayList<String>(alphabet == null ? 0 : alphabet.size());
    final var symbols = new HashSet<String>();
    if (alphabet != null) {
      for (String symbol : alphabet) {
        if (symbol == null || symbol.isBlank()) {
          throw new InvalidAutomatonException("alphabet symbols must not be blank");
        } else if (EPSILON.equals(symbol)) {
          throw new InvalidSymbolException(symbol, "epsilon '" + EPSILON + "' cannot be declared as an alphabet symbol");
        } else if (!symbols.add(symbol)) {
          throw new InvalidAutomatonException("symbol '" + symbol + "' is declared more than once");
        }
        alphabetList.add(symbol);
      }
    }

    // Start and final states
    if (start == null) {
      throw new InvalidAutomatonException("automaton must have a start state");
    }
    final int initialState = lookup(stateIndices, start, "start state");
    final var finalIndices = new ArrayList<Integer>();
    if (finals != null) {
      for (String state : finals) {
        finalIndices.add(lookup(stateIndices, state, "final states"));
      }
    }

    // Transitions, grouped per source state first
    final var grouped = new HashMap<Integer, Map<String, Set<Integer>>>();
    if (transitions != null) {
      for (var entry : transitions.entrySet()) {
        final TransitionKey key = entry.getKey();
        if (key == null) {
          throw new InvalidAutomatonException("transition keys must not be null");
        }
        final int from = lookup(stateIndices, key.state(), "transition source");
        final String symbol = key.symbol();
        if (!EPSILON.equals(symbol) && !symbols.contains(symbol)) {
          throw new InvalidSymbolException(
            symbol,
            "transition from '" + key.state() + "' is on undeclared symbol '" + symbol + "'"
          );
        }
        final var destinations = grouped
          .computeIfAbsent(from, k -> new HashMap<>())
          .computeIfAbsent(symbol, k -> new HashSet<>());
        if (entry.getValue() == null) {
          throw new InvalidAutomatonException("transition δ(" + key.state() + ", " + symbol + ") has no destination collection");
        }
        for (String to : entry.getValue()) {
          destinations.add(lookup(stateIndices, to, "transition δ(" + key.state() + ", " + symbol + ")"));
        }
      }
    }

    // Lay out the transition maps in alphabet order, then epsilon
    final var symbolOrder = new ArrayList<String>(alphabetList);
    symbolOrder.add(EPSILON);
    final var transitionList = new ArrayList<Map<String, StateSet>>(stateList.size());
    for (int state = 0; state < stateList.size(); state++) {
      final Map<String, Set<Integer>> raw = grouped.getOrDefault(state, Map.of());
      final var transitionMap = new LinkedHashMap<String, StateSet>();
      for (String symbol : symbolOrder) {
        final Set<Integer> destinations = raw.get(symbol);
        if (destinations != null && !destinations.isEmpty()) {
          transitionMap.put(symbol, new StateSet(destinations));
        }
      }
      transitionList.add(Collections.unmodifiableMap(transitionMap));
    }

    return new EpsilonNfa(
      Collections.unmodifiableList(stateList),
      Collections.unmodifiableMap(stateIndices),
      Collections.unmodifiableList(alphabetList),
      initialState,
      new StateSet(finalIndices),
      Collections.unmodifiableList(transitionList)
    );
  }

  private static int lookup(Map<String, Integer> stateIndices, String state, String context) {
    final Integer index = state == null ? null : stateIndices.get(state);
    if (index == null) {
      throw new InvalidStateException(state, context);
    }
    return index;
  }

  /**
   * Find the index of a state.
   *
   * @param state state name
   * @return index of the state in {@link #states}
   * @throws InvalidStateException if the state is not declared
   */
  public int indexOf(String state) {
    return lookup(stateIndices, state, "automaton");
  }

  /**
   * Check that an index refers to a state of this automaton.
   *
   * @param state index of a state
   * @param context what the index was used for (shows up in the error)
   * @return the same index
   * @throws InvalidStateException if there is no state at that index
   */
  int checkState(int state, String context) {
    if (state < 0 || state >= states.size()) {
      throw new InvalidStateException("#" + state, context);
    }
    return state;
  }

  /**
   * @param state index of a state
   * @return name of the state
   * @throws InvalidStateException if there is no state at that index
   */
  public String stateName(int state) {
    return states.get(checkState(state, "state name"));
  }

  /**
   * Convert state names into a set of indices.
   *
   * @param names state names
   * @return indices of those states
   * @throws InvalidStateException if any name is not declared
   */
  public StateSet stateSet(Collection<String> names) {
    return new StateSet(names.stream().map(this::indexOf).collect(Collectors.toList()));
  }

  /**
   * Look up the destinations of a transition.
   *
   * @param state index of the source state
   * @param symbol alphabet symbol or {@link #EPSILON}
   * @return destinations, or empty if there is no such transition
   * @throws InvalidStateException if there is no state at that index
   */
  public Optional<StateSet> transition(int state, String symbol) {
    return Optional.ofNullable(transitions.get(checkState(state, "transition")).get(symbol));
  }

  /**
   * Compute the set of states reachable from a state using only epsilon
   * transitions (including the state itself).
   *
   * Each state is pushed at most once, so cycles of epsilon transitions are
   * fine.
   *
   * @param state index of the state from which to start
   * @return epsilon closure of the state
   * @throws InvalidStateException if there is no state at that index
   */
  public StateSet epsilonClosure(int state) {
    checkState(state, "epsilon closure");
    final var seenStates = new HashSet<Integer>();
    final var toVisit = new Stack<Integer>();

    // Seed the DFS with the starting node
    seenStates.add(state);
    toVisit.push(state);

    while (!toVisit.isEmpty()) {
      final int next = toVisit.pop();
      final StateSet targets = transitions.get(next).get(EPSILON);
      if (targets == null) {
        continue;
      }
      targets.stream().forEach((int target) -> {
        if (seenStates.add(target)) {
          toVisit.push(target);
        }
      });
    }

    return new StateSet(seenStates);
  }

  /**
   * Compute the epsilon closure of a named state.
   *
   * @param state state name
   * @return epsilon closure of the state
   * @throws InvalidStateException if the state is not declared
   */
  public StateSet epsilonClosure(String state) {
    return epsilonClosure(lookup(stateIndices, state, "epsilon closure"));
  }

  /**
   * Compute the epsilon closure of every state.
   *
   * @return closures, indexed along states
   */
  public ClosureTable closureTable() {
    final List<StateSet> closures = IntStream
      .range(0, states.size())
      .mapToObj(this::epsilonClosure)
      .collect(Collectors.toList());
    return new ClosureTable(this, closures);
  }

  /**
   * Canonical label of a set of states.
   *
   * @param stateSet indices of states in this automaton
   * @return state names, sorted lexicographically
   */
  public List<String> label(StateSet stateSet) {
    return CanonicalLabel.of(stateSet.stream().mapToObj(states::get).collect(Collectors.toList()));
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return IntStream
      .range(0, states.size())
      .mapToObj((int id) -> new DotGraph.Vertex<String>(states.get(id), finalStates.contains(id)));
  }

  @Override
  public Stream<DotGraph.Edge<String, String>> edges() {
    return transitionEdges(transitions);
  }

  @Override
  public String initialVertex() {
    return states.get(initialState);
  }

  /**
   * Edges of a nondeterministic transition relation over this automaton's
   * states. Each destination gets its own edge, in canonical label order.
   *
   * @param relation transitions, indexed along starting states
   * @return edges for rendering
   */
  Stream<DotGraph.Edge<String, String>> transitionEdges(List<Map<String, StateSet>> relation) {
    return IntStream
      .range(0, relation.size())
      .boxed()
      .flatMap((Integer from) -> {
        final String fromName = states.get(from);
        return relation
          .get(from)
          .entrySet()
          .stream()
          .flatMap((Map.Entry<String, StateSet> entry) -> label(entry.getValue())
            .stream()
            .map(to -> new DotGraph.Edge<String, String>(fromName, to, entry.getKey()))
          );
      });
  }

  @Override
  public String toString() {
    return "EpsilonNfa(states = " + states + ", alphabet = " + alphabet + ", start = " + stateName(initialState)
      + ", finals = " + label(finalStates) + ")";
  }

  /**
   * Incrementally collects a raw automaton description, then validates it.
   */
  public static final class Builder {
    private final List<String> states = new ArrayList<>();
    private final List<String> alphabet = new ArrayList<>();
    private final List<String> finals = new ArrayList<>();
    private final Map<TransitionKey, Set<String>> transitions = new LinkedHashMap<>();
    private String start;

    public Builder states(String... names) {
      Collections.addAll(states, names);
      return this;
    }

    public Builder alphabet(String... symbols) {
      Collections.addAll(alphabet, symbols);
      return this;
    }

    public Builder start(String state) {
      this.start = state;
      return this;
    }

    public Builder finals(String... names) {
      Collections.addAll(finals, names);
      return this;
    }

    /**
     * Add destinations to a transition. Repeated calls for the same state and
     * symbol accumulate destinations.
     *
     * @param from source state
     * @param symbol alphabet symbol or {@link EpsilonNfa#EPSILON}
     * @param to destination states
     * @return this builder
     */
    public Builder transition(String from, String symbol, String... to) {
      final var destinations = transitions.computeIfAbsent(new TransitionKey(from, symbol), k -> new LinkedHashSet<>());
      Collections.addAll(destinations, to);
      return this;
    }

    public Builder epsilonTransition(String from, String... to) {
      return transition(from, EPSILON, to);
    }

    /**
     * Validate the collected description.
     *
     * @return validated automaton
     * @see EpsilonNfa#validate
     */
    public EpsilonNfa build() {
      return EpsilonNfa.validate(states, alphabet, start, finals, transitions);
    }
  }
}
