package nfa2dfa;

/**
 * Key of a raw transition relation entry.
 *
 * @param state state the transition leaves from
 * @param symbol alphabet symbol (or {@link EpsilonNfa#EPSILON}) read on the transition
 */
public record TransitionKey(String state, String symbol) { }
