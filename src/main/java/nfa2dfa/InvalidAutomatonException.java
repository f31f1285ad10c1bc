package nfa2dfa;

/**
 * Structural problem in a raw automaton description (missing, blank or
 * duplicated entries).
 */
public class InvalidAutomatonException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -5012873090143477719L;

  public InvalidAutomatonException(String message) {
    super(message);
  }
}
