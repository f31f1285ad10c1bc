package nfa2dfa;

/**
 * Automata shared between tests.
 */
final class Fixtures {

  private Fixtures() { }

  /** No epsilon transitions at all. */
  static EpsilonNfa plainNfa() {
    return new EpsilonNfa.Builder()
      .states("q0", "q1")
      .alphabet("a", "b")
      .start("q0")
      .finals("q1")
      .transition("q0", "a", "q0", "q1")
      .transition("q0", "b", "q0")
      .transition("q1", "b", "q1")
      .build();
  }

  /** Epsilon cycle between q0 and q1. */
  static EpsilonNfa epsilonCycle() {
    return new EpsilonNfa.Builder()
      .states("q0", "q1")
      .alphabet("a")
      .start("q0")
      .finals("q1")
      .epsilonTransition("q0", "q1")
      .epsilonTransition("q1", "q0")
      .transition("q0", "a", "q0")
      .build();
  }

  /** q2 cannot be reached from the start state. */
  static EpsilonNfa unreachableState() {
    return new EpsilonNfa.Builder()
      .states("q0", "q1", "q2")
      .alphabet("a", "b")
      .start("q0")
      .finals("q1", "q2")
      .transition("q0", "a", "q1")
      .transition("q1", "b", "q0")
      .transition("q2", "a", "q0", "q1", "q2")
      .epsilonTransition("q2", "q1")
      .build();
  }

  /** Mixture of epsilon chains, an epsilon cycle and nondeterminism. */
  static EpsilonNfa mixed() {
    return new EpsilonNfa.Builder()
      .states("s", "t", "u", "v", "w", "x")
      .alphabet("0", "1")
      .start("s")
      .finals("x")
      .epsilonTransition("s", "t")
      .epsilonTransition("t", "u", "v")
      .epsilonTransition("v", "t")
      .transition("u", "0", "w")
      .transition("v", "1", "v", "x")
      .epsilonTransition("w", "x")
      .transition("x", "0", "s")
      .build();
  }
}
