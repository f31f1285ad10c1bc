package nfa2dfa;

/**
 * A state identifier was referenced that is not in the declared state set.
 */
public class InvalidStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -2687342315521954071L;

  /**
   * Offending state identifier.
   */
  public final String state;

  public InvalidStateException(String state, String context) {
    super(context + ": state '" + state + "' is not declared");
    this.state = state;
  }
}
