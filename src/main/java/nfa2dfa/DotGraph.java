package nfa2dfa;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Automata which can be rendered as Graphviz state diagrams.
 *
 * State names never appear as DOT identifiers: states are given the ids
 * {@code n0}, {@code n1}, ... in the order of {@link #vertices()}, and the
 * arrow into the start state comes from a separate {@code start} node. Names
 * only show up inside (escaped) labels.
 *
 * Compile the output using {@code dot -Tsvg fsm.dot > fsm.svg}.
 *
 * @param <V> states of the automaton
 * @param <E> symbols on the transitions
 */
public interface DotGraph<V, E> {

  /**
   * State in the diagram.
   *
   * @param id state
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Transition in the diagram.
   *
   * @param from state where the transition starts
   * @param to state where the transition ends
   * @param label symbol read on the transition
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the states, in the order they should be drawn.
   *
   * @return all states
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the transitions. Both ends of every edge must be among
   * {@link #vertices()}.
   *
   * @return all transitions
   */
  Stream<Edge<V, E>> edges();

  /**
   * State which the start arrow points to.
   *
   * @return start state
   */
  V initialVertex();

  /**
   * Render a transition symbol.
   *
   * @param symbol symbol on an edge
   * @return HTML label string
   */
  default String renderEdgeLabel(E symbol) {
    return escapeHtml(symbol.toString());
  }

  /**
   * Render a state label.
   *
   * @param state state of the automaton
   * @return HTML label string
   */
  default String renderVertexLabel(V state) {
    return escapeHtml(state.toString());
  }

  /**
   * Render the automaton into its DOT source.
   *
   * Parallel transitions between the same two states are drawn as a single
   * edge whose label lists the symbols in order.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph \"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\" {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  start [shape = none, label = <>];\n");

    // States
    final Map<V, String> ids = new LinkedHashMap<>();
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = "n" + ids.size();
      ids.put(vertex.id(), id);
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + ", label = <" + renderVertexLabel(vertex.id()) + ">];\n");
    }

    builder.append("  start -> " + idOf(ids, initialVertex()) + ";\n");

    // Transitions, with the symbols of parallel edges collected together
    final Map<List<String>, List<String>> labels = new LinkedHashMap<>();
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      labels
        .computeIfAbsent(List.of(idOf(ids, edge.from()), idOf(ids, edge.to())), k -> new ArrayList<>())
        .add(renderEdgeLabel(edge.label()));
    }
    for (var entry : labels.entrySet()) {
      final List<String> ends = entry.getKey();
      builder.append("  " + ends.get(0) + " -> " + ends.get(1) + " [label = <" + String.join(", ", entry.getValue()) + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Escape text so that it can be placed inside an HTML-like label.
   *
   * @param str raw text
   * @return text with HTML special characters replaced by entities
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
  }

  private static <V> String idOf(Map<V, String> ids, V vertex) {
    final String id = ids.get(vertex);
    if (id == null) {
      throw new IllegalStateException("edge endpoint " + vertex + " is not a vertex of the graph");
    }
    return id;
  }
}
