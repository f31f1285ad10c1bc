package nfa2dfa.tool;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.text.ParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nfa2dfa.AutomatonException;
import nfa2dfa.Conversion;
import nfa2dfa.EpsilonNfa;
import nfa2dfa.TransitionTable;

/**
 * Converts automaton description files. For each of them, prints the
 * transition tables of the input automaton, the epsilon-free NFA and the DFA,
 * then the DOT source of the epsilon-free NFA and of the DFA.
 */
public class ConverterMain {

  private static final Logger LOG = LoggerFactory.getLogger(ConverterMain.class);

  int converted = 0;
  int failed = 0;

  private final PrintStream out;

  ConverterMain(PrintStream out) {
    this.out = out;
  }

  public static void main(String[] automatonFiles) {
    if (automatonFiles.length == 0) {
      System.err.println("Usage: ConverterMain <automaton-file>...");
      System.exit(2);
    }

    final var main = new ConverterMain(System.out);
    for (String automatonFile : automatonFiles) {
      main.processFile(automatonFile);
    }

    LOG.info("CONVERTED: {}, FAILED: {}", main.converted, main.failed);
    if (main.failed > 0) {
      System.exit(1);
    }
  }

  /**
   * Convert a single file, reporting rather than propagating any failure.
   *
   * @param automatonFile filepath to the automaton description
   * @return whether the conversion succeeded
   */
  boolean processFile(String automatonFile) {
    final EpsilonNfa nfa;
    try (var reader = new AutomatonFileReader(automatonFile)) {
      nfa = reader.readAutomaton();
    } catch (FileNotFoundException err) {
      LOG.error("Failed to open file {}: {}", automatonFile, err.getMessage());
      failed++;
      return false;
    } catch (IOException | ParseException | AutomatonException err) {
      LOG.error("Invalid automaton in {}: {}", automatonFile, err.getMessage());
      failed++;
      return false;
    }

    final var conversion = Conversion.convert(nfa);
    LOG.info(
      "Converted {}: {} NFA states to {} DFA states",
      automatonFile,
      nfa.states.size(),
      conversion.dfa().states.size()
    );

    out.println(TransitionTable.of(nfa).render());
    out.println();
    out.println(TransitionTable.of(conversion.epsilonFreeNfa()).render());
    out.println();
    out.println(TransitionTable.of(conversion.dfa()).render());
    out.println();
    out.println(conversion.epsilonFreeNfa().dotGraph("nfa"));
    out.println(conversion.dfa().dotGraph("dfa"));
    converted++;
    return true;
  }
}
