package nfa2dfa.tool;

import java.io.FileNotFoundException;
import java.io.StringReader;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import nfa2dfa.Conversion;
import nfa2dfa.EpsilonNfa;
import nfa2dfa.InvalidStateException;
import nfa2dfa.StateSet;
import nfa2dfa.SubsetDfa;

public class AutomatonFileReaderTest {

  static String resourcePath(String name) throws Exception {
    return Path.of(AutomatonFileReaderTest.class.getResource(name).toURI()).toString();
  }

  private static EpsilonNfa read(String text) throws Exception {
    try (var reader = new AutomatonFileReader(new StringReader(text), "inline")) {
      return reader.readAutomaton();
    }
  }

  private static EpsilonNfa readResource(String name) throws Exception {
    try (var reader = new AutomatonFileReader(resourcePath(name))) {
      return reader.readAutomaton();
    }
  }

  @Test
  void readsFile() throws Exception {
    final EpsilonNfa nfa = readResource("/automata/epsilon-chain.txt");

    Assertions.assertEquals(List.of("q0", "q1", "q2", "q3"), nfa.states);
    Assertions.assertEquals(List.of("a", "b"), nfa.alphabet);
    Assertions.assertEquals("q0", nfa.stateName(nfa.initialState));
    Assertions.assertEquals(List.of("q2"), nfa.label(nfa.finalStates));
    Assertions.assertEquals(StateSet.of(2), nfa.transition(3, EpsilonNfa.EPSILON).orElseThrow());

    final SubsetDfa dfa = Conversion.convert(nfa).dfa();
    Assertions.assertEquals(
      List.of(List.of("q0"), List.of("q0", "q1"), List.of("q0", "q2", "q3")),
      dfa.states.stream().map(dfa::label).toList()
    );
    Assertions.assertEquals(1, dfa.finalStates.size());
    Assertions.assertTrue(dfa.finalStates.contains(nfa.stateSet(List.of("q0", "q2", "q3"))));
  }

  @Test
  void repeatedTransitionLinesAccumulate() throws Exception {
    final EpsilonNfa nfa = read(
      "states: p, q, r\n" +
      "alphabet: x\n" +
      "start: p\n" +
      "\n" +
      "  // indented comment\n" +
      "p, x -> q\n" +
      "p, x -> r,\n"
    );
    Assertions.assertEquals(StateSet.of(1, 2), nfa.transition(0, "x").orElseThrow());
    Assertions.assertTrue(nfa.finalStates.isEmpty());
  }

  @Test
  void malformedLines() {
    var err = Assertions.assertThrows(
      ParseException.class,
      () -> read("states: p\nstart: p\nthis is not a transition\n")
    );
    Assertions.assertEquals(3, err.getErrorOffset());

    err = Assertions.assertThrows(ParseException.class, () -> read("states: p\nstates: q\nstart: p\n"));
    Assertions.assertEquals(2, err.getErrorOffset());

    Assertions.assertThrows(ParseException.class, () -> read("states: p, q\nstart: p, q\n"));
    Assertions.assertThrows(ParseException.class, () -> read("start: p\n"));
    Assertions.assertThrows(ParseException.class, () -> read("states: p\n"));
  }

  @Test
  void invalidAutomaton() {
    final var err = Assertions.assertThrows(
      InvalidStateException.class,
      () -> readResource("/automata/undeclared-destination.txt")
    );
    Assertions.assertEquals("q9", err.state);
  }

  @Test
  void missingFile() {
    Assertions.assertThrows(FileNotFoundException.class, () -> new AutomatonFileReader("does/not/exist.txt"));
  }

  @Test
  void parseList() {
    Assertions.assertEquals(List.of("a", "b", "c"), AutomatonFileReader.parseList(" a,b ,, c ,"));
    Assertions.assertTrue(AutomatonFileReader.parseList("  ").isEmpty());
  }
}
