package SymDFA.Graph;

import java.util.Map;

/**
 * One row of an adjacency graph: the state's label and its successor per symbol.
 */
public record StateEntry<S, I, O>(O label, Map<I, S> transitions) {
}
