package nfa2dfa;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SubsetDfaTest {

  private static List<List<String>> labels(SubsetDfa dfa, Iterable<StateSet> states) {
    final var output = new ArrayList<List<String>>();
    states.forEach(state -> output.add(dfa.label(state)));
    return output;
  }

  private static StateSet target(SubsetDfa dfa, List<String> from, String symbol) {
    return dfa.transition(dfa.source.stateSet(from), symbol).orElseThrow();
  }

  @Test
  void plainNfa() {
    final SubsetDfa dfa = Conversion.convert(Fixtures.plainNfa()).dfa();

    // {q1} is not reachable: on 'b', {q0,q1} goes back to itself
    Assertions.assertEquals(List.of(List.of("q0"), List.of("q0", "q1")), labels(dfa, dfa.states));
    Assertions.assertEquals(List.of("q0"), dfa.label(dfa.initial()));

    Assertions.assertEquals(List.of("q0", "q1"), dfa.label(target(dfa, List.of("q0"), "a")));
    Assertions.assertEquals(List.of("q0"), dfa.label(target(dfa, List.of("q0"), "b")));
    Assertions.assertEquals(List.of("q0", "q1"), dfa.label(target(dfa, List.of("q0", "q1"), "a")));
    Assertions.assertEquals(List.of("q0", "q1"), dfa.label(target(dfa, List.of("q0", "q1"), "b")));

    Assertions.assertEquals(List.of(List.of("q0", "q1")), labels(dfa, dfa.accepting()));
  }

  @Test
  void unreachableStatesArePruned() {
    final EpsilonNfa source = Fixtures.unreachableState();
    final SubsetDfa dfa = Conversion.convert(source).dfa();
    final int q2 = source.indexOf("q2");

    Assertions.assertEquals(List.of(List.of("q0"), List.of("q1")), labels(dfa, dfa.states));
    for (StateSet state : dfa.states) {
      Assertions.assertFalse(state.contains(q2));
    }
  }

  @Test
  void deadStateHasAbsentTransitions() {
    final EpsilonNfa source = new EpsilonNfa.Builder()
      .states("q0", "q1")
      .alphabet("a", "b")
      .start("q0")
      .finals("q1")
      .transition("q0", "a", "q1")
      .build();
    final SubsetDfa dfa = Conversion.convert(source).dfa();
    final StateSet dead = source.stateSet(List.of("q1"));

    Assertions.assertEquals(List.of(StateSet.of(0), dead), dfa.states);
    Assertions.assertTrue(dfa.transitionsMap(dead).isEmpty());
    Assertions.assertTrue(dfa.transition(dead, "a").isEmpty());
    Assertions.assertTrue(dfa.transition(dead, "b").isEmpty());
    Assertions.assertFalse(dfa.transitionsMap(StateSet.of(0)).containsKey("b"));
    Assertions.assertEquals(Set.of(dead), dfa.accepting());
  }

  private static EpsilonNfa branching() {
    return new EpsilonNfa.Builder()
      .states("q0", "q1", "q2", "q3", "q4")
      .alphabet("a", "b")
      .start("q0")
      .finals("q4")
      .transition("q0", "a", "q1")
      .transition("q0", "b", "q2")
      .transition("q1", "a", "q3")
      .transition("q2", "a", "q4")
      .build();
  }

  @Test
  void discoveryIsBreadthFirst() {
    final SubsetDfa dfa = Conversion.convert(branching()).dfa();
    Assertions.assertEquals(
      List.of(List.of("q0"), List.of("q1"), List.of("q2"), List.of("q3"), List.of("q4")),
      labels(dfa, dfa.states)
    );
  }

  @Test
  void discoveryFollowsGivenAlphabetOrder() {
    final EpsilonFreeNfa nfa = EpsilonFreeNfa.fromEpsilonNfa(branching());
    final SubsetDfa dfa = SubsetDfa.determinize(nfa, "q0", List.of("b", "a"));
    Assertions.assertEquals(
      List.of(List.of("q0"), List.of("q2"), List.of("q1"), List.of("q4"), List.of("q3")),
      labels(dfa, dfa.states)
    );
    Assertions.assertEquals(List.of("b", "a"), dfa.alphabet);
  }

  @Test
  void determinizeFromAnotherStart() {
    final EpsilonFreeNfa nfa = EpsilonFreeNfa.fromEpsilonNfa(branching());
    final SubsetDfa dfa = SubsetDfa.determinize(nfa, "q2", nfa.source.alphabet);
    Assertions.assertEquals(List.of(List.of("q2"), List.of("q4")), labels(dfa, dfa.states));
  }

  @Test
  void determinizeRejectsBadArguments() {
    final EpsilonFreeNfa nfa = EpsilonFreeNfa.fromEpsilonNfa(branching());
    Assertions.assertThrows(InvalidStateException.class, () -> SubsetDfa.determinize(nfa, "q9", List.of("a")));
    Assertions.assertThrows(
      InvalidSymbolException.class,
      () -> SubsetDfa.determinize(nfa, "q0", List.of("a", EpsilonNfa.EPSILON))
    );
  }

  @Test
  void compositeStatesAreNonEmptyAndReachable() {
    for (EpsilonNfa source : List.of(Fixtures.plainNfa(), Fixtures.epsilonCycle(), Fixtures.unreachableState(), Fixtures.mixed(), branching())) {
      final SubsetDfa dfa = Conversion.convert(source).dfa();
      final StateSet all = new StateSet(
        IntStream.range(0, source.states.size()).boxed().collect(Collectors.toList())
      );

      Assertions.assertEquals(StateSet.of(source.initialState), dfa.initial());
      Assertions.assertEquals(Set.copyOf(dfa.states), dfa.allStates());
      Assertions.assertEquals(dfa.states.size(), Set.copyOf(dfa.states).size());
      for (StateSet state : dfa.states) {
        Assertions.assertFalse(state.isEmpty());
        Assertions.assertTrue(state.isSubsetOf(all));
        for (StateSet target : dfa.transitionsMap(state).values()) {
          Assertions.assertTrue(dfa.states.contains(target));
        }
      }
    }
  }

  @Test
  void conversionIsDeterministic() {
    final SubsetDfa first = Conversion.convert(Fixtures.mixed()).dfa();
    final SubsetDfa second = Conversion.convert(Fixtures.mixed()).dfa();

    Assertions.assertEquals(first.states, second.states);
    Assertions.assertEquals(first.transitions, second.transitions);
    Assertions.assertEquals(List.copyOf(first.finalStates), List.copyOf(second.finalStates));
    Assertions.assertEquals(first.dotGraph("dfa"), second.dotGraph("dfa"));
  }

  @Test
  void mixedAutomaton() {
    final SubsetDfa dfa = Conversion.convert(Fixtures.mixed()).dfa();

    Assertions.assertEquals(
      List.of(
        List.of("s"),
        List.of("w", "x"),
        List.of("t", "u", "v", "x"),
        List.of("s", "t", "u", "v"),
        List.of("s", "t", "u", "v", "w", "x")
      ),
      labels(dfa, dfa.states)
    );
    Assertions.assertEquals(
      List.of(List.of("w", "x"), List.of("t", "u", "v", "x"), List.of("s", "t", "u", "v", "w", "x")),
      labels(dfa, dfa.finalStates)
    );

    final Map<String, StateSet> fromStart = dfa.transitionsMap(dfa.initial());
    Assertions.assertEquals(List.of("0", "1"), List.copyOf(fromStart.keySet()));
  }
}
