package nfa2dfa;

/**
 * A symbol showed up where it is not allowed. This covers the epsilon symbol
 * being declared as part of an alphabet as well as transitions on symbols
 * outside of the alphabet.
 */
public class InvalidSymbolException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 7733350948201126504L;

  /**
   * Offending symbol.
   */
  public final String symbol;

  public InvalidSymbolException(String symbol, String message) {
    super(message);
    this.symbol = symbol;
  }
}
