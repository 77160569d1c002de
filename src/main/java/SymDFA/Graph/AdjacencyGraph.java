package SymDFA.Graph;

import java.util.Map;

/**
 * Explicit, table form of a finite automaton: a start state and one {@link StateEntry} per state.
 * Equality is structural, so two graphs are equal exactly when they have the same states, labels and edges.
 */
public record AdjacencyGraph<S, I, O>(S start, Map<S, StateEntry<S, I, O>> adjacency) {

  public int size() {
    return adjacency.size();
  }

  public StateEntry<S, I, O> entry(S state) {
    StateEntry<S, I, O> entry = adjacency.get(state);
    if (entry == null) {
      throw new IllegalArgumentException("Unknown state: " + state);
    }
    return entry;
  }
}
