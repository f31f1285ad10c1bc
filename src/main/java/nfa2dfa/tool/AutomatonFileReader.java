package nfa2dfa.tool;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import nfa2dfa.EpsilonNfa;
import nfa2dfa.TransitionKey;

/**
 * Reads an automaton description from a text file.
 *
 * Skips over comment lines and blank lines. Every other line is either a
 * header ({@code states:}, {@code alphabet:}, {@code start:},
 * {@code finals:}) followed by a comma-separated list, or a transition of the
 * form {@code q0, a -> q1, q2}. Epsilon transitions use {@code ε} as symbol.
 */
public class AutomatonFileReader implements Closeable {

  private static final Pattern HEADER = Pattern.compile("^(states|alphabet|start|finals)\\s*:(.*)$");

  private static final Pattern TRANSITION = Pattern.compile("^([^,]+),([^,]+)->(.*)$");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public AutomatonFileReader(String filePath) throws IOException {
    this.reader = new BufferedReader(new FileReader(filePath, StandardCharsets.UTF_8));
    this.filePath = filePath;
  }

  public AutomatonFileReader(Reader reader, String filePath) {
    this.reader = new BufferedReader(reader);
    this.filePath = filePath;
  }

  /**
   * Read the next meaningful line from the input.
   *
   * @return trimmed line, or {@code null} at the end of the input
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      }
      line = line.strip();
      if (line.startsWith("//") || line.isEmpty()) {
        continue; // Not a valid line
      }
      break;
    }

    return line;
  }

  /**
   * Read the whole input and validate the automaton it describes.
   *
   * @return validated automaton
   * @throws ParseException if a line is malformed or a header is repeated
   * @throws nfa2dfa.AutomatonException if the description is not a valid automaton
   */
  public EpsilonNfa readAutomaton() throws IOException, ParseException {
    List<String> states = null;
    List<String> alphabet = null;
    String start = null;
    List<String> finals = null;
    final Map<TransitionKey, Set<String>> transitions = new LinkedHashMap<>();

    String line;
    while ((line = readLine()) != null) {
      final Matcher header = HEADER.matcher(line);
      final Matcher transition = TRANSITION.matcher(line);

      if (header.matches()) {
        final List<String> values = parseList(header.group(2));
        switch (header.group(1)) {
          case "states":
            states = requireUnset(states, "states", values);
            break;
          case "alphabet":
            alphabet = requireUnset(alphabet, "alphabet", values);
            break;
          case "finals":
            finals = requireUnset(finals, "finals", values);
            break;
          default:
            if (start != null) {
              throw new ParseException(describe("duplicate 'start' header"), lineNumber);
            } else if (values.size() != 1) {
              throw new ParseException(describe("expected exactly one start state"), lineNumber);
            }
            start = values.get(0);
            break;
        }
      } else if (transition.matches()) {
        final String from = transition.group(1).strip();
        final String symbol = transition.group(2).strip();
        if (from.isEmpty() || symbol.isEmpty()) {
          throw new ParseException(describe("transition needs a state and a symbol"), lineNumber);
        }
        transitions
          .computeIfAbsent(new TransitionKey(from, symbol), k -> new LinkedHashSet<>())
          .addAll(parseList(transition.group(3)));
      } else {
        throw new ParseException(describe("unrecognized line '" + line + "'"), lineNumber);
      }
    }

    if (states == null) {
      throw new ParseException(describe("missing 'states' header"), lineNumber);
    } else if (start == null) {
      throw new ParseException(describe("missing 'start' header"), lineNumber);
    }

    return EpsilonNfa.validate(
      states,
      alphabet == null ? List.of() : alphabet,
      start,
      finals == null ? List.of() : finals,
      transitions
    );
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getFilePath() {
    return filePath;
  }

  private List<String> requireUnset(List<String> current, String header, List<String> values) throws ParseException {
    if (current != null) {
      throw new ParseException(describe("duplicate '" + header + "' header"), lineNumber);
    }
    return values;
  }

  private String describe(String message) {
    return message + " (at " + filePath + ":" + lineNumber + ")";
  }

  /**
   * Split a comma-separated list, trimming entries and dropping empty ones.
   *
   * @param raw comma separated values
   * @return non-empty entries in order
   */
  static List<String> parseList(String raw) {
    return Arrays
      .stream(raw.split(","))
      .map(String::strip)
      .filter(s -> !s.isEmpty())
      .collect(Collectors.toCollection(ArrayList::new));
  }
}
