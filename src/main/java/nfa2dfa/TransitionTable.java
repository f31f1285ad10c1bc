package nfa2dfa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Transition table of an automaton, as plain text cells.
 *
 * The first column holds the state, prefixed with {@code →} for the start
 * state and suffixed with {@code *} for accepting states. Every other column
 * is one symbol. Missing transitions are shown as {@code φ}.
 *
 * @param header column titles
 * @param rows one row of cells per state, each as wide as the header
 */
public record TransitionTable(List<String> header, List<List<String>> rows) {

  /**
   * Cell shown for a missing transition.
   */
  public static final String NO_TRANSITION = "φ";

  public TransitionTable {
    header = List.copyOf(header);
    rows = rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
  }

  /**
   * Table of an automaton with epsilon transitions, with an extra {@code ε}
   * column after the alphabet.
   *
   * @param nfa automaton
   * @return transition table, one row per state in declaration order
   */
  public static TransitionTable of(EpsilonNfa nfa) {
    final var symbols = new ArrayList<String>(nfa.alphabet);
    symbols.add(EpsilonNfa.EPSILON);
    return nfaTable(nfa, symbols, nfa.transitions, nfa.finalStates::contains);
  }

  /**
   * @param nfa epsilon-free automaton
   * @return transition table, one row per state in declaration order
   */
  public static TransitionTable of(EpsilonFreeNfa nfa) {
    return nfaTable(nfa.source, nfa.source.alphabet, nfa.transitions, nfa::isAccepting);
  }

  /**
   * @param dfa subset construction output
   * @return transition table, one row per composite state in discovery order
   */
  public static TransitionTable of(SubsetDfa dfa) {
    final var rows = new ArrayList<List<String>>(dfa.states.size());
    for (StateSet state : dfa.states) {
      final var row = new ArrayList<String>(dfa.alphabet.size() + 1);
      row.add(rowLabel(
        CanonicalLabel.render(dfa.label(state)),
        state.equals(dfa.initialState),
        dfa.finalStates.contains(state)
      ));
      for (String symbol : dfa.alphabet) {
        row.add(dfa
          .transition(state, symbol)
          .map(target -> CanonicalLabel.render(dfa.label(target)))
          .orElse(NO_TRANSITION));
      }
      rows.add(row);
    }
    return new TransitionTable(headerFor(dfa.alphabet), rows);
  }

  private static TransitionTable nfaTable(
    EpsilonNfa arena,
    List<String> symbols,
    List<Map<String, StateSet>> relation,
    IntPredicate accepting
  ) {
    final var rows = new ArrayList<List<String>>(relation.size());
    for (int state = 0; state < relation.size(); state++) {
      final var row = new ArrayList<String>(symbols.size() + 1);
      row.add(rowLabel(arena.stateName(state), state == arena.initialState, accepting.test(state)));
      for (String symbol : symbols) {
        final StateSet targets = relation.get(state).get(symbol);
        row.add(targets == null ? NO_TRANSITION : String.join(",", arena.label(targets)));
      }
      rows.add(row);
    }
    return new TransitionTable(headerFor(symbols), rows);
  }

  private static List<String> headerFor(List<String> symbols) {
    final var header = new ArrayList<String>(symbols.size() + 1);
    header.add("State");
    header.addAll(symbols);
    return header;
  }

  private static String rowLabel(String state, boolean initial, boolean accepting) {
    return (initial ? "→" : "") + state + (accepting ? "*" : "");
  }

  /**
   * Render the table with aligned columns, eg.
   *
   * <pre>
   * State | a  | b
   * ------+----+---
   * →q0   | q1 | φ
   * q1*   | φ  | q0
   * </pre>
   *
   * @return table text, lines separated by {@code \n}, without trailing newline
   */
  public String render() {
    final int[] widths = new int[header.size()];
    for (List<String> line : allLines()) {
      for (int column = 0; column < widths.length; column++) {
        widths[column] = Math.max(widths[column], width(line.get(column)));
      }
    }

    final var lines = new ArrayList<String>(rows.size() + 2);
    lines.add(renderLine(header, widths));
    lines.add(
      Arrays
        .stream(widths)
        .mapToObj(w -> "-".repeat(w))
        .collect(Collectors.joining("-+-"))
    );
    for (List<String> row : rows) {
      lines.add(renderLine(row, widths));
    }
    return String.join("\n", lines);
  }

  private List<List<String>> allLines() {
    final var lines = new ArrayList<List<String>>(rows.size() + 1);
    lines.add(header);
    lines.addAll(rows);
    return Collections.unmodifiableList(lines);
  }

  private static String renderLine(List<String> cells, int[] widths) {
    final var builder = new StringBuilder();
    for (int column = 0; column < widths.length; column++) {
      if (column > 0) {
        builder.append(" | ");
      }
      final String cell = cells.get(column);
      builder.append(cell).append(" ".repeat(widths[column] - width(cell)));
    }
    return builder.toString().stripTrailing();
  }

  private static int width(String cell) {
    return cell.codePointCount(0, cell.length());
  }
}
