package nfa2dfa;

/**
 * Base class for errors raised when an automaton description breaks one of
 * its invariants.
 *
 * Failures are deterministic: the same input always fails the same way, and
 * no input is ever mutated before the failure is raised.
 */
public class AutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 4181902211758323395L;

  public AutomatonException(String message) {
    super(message);
  }
}
