package SymDFA.Graph;

import java.util.*;
import java.util.function.Function;

import SymDFA.SymbolicDFA;
import SymDFA.Model.AlphabetMismatchException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Conversion between lazy automata and their explicit {@link AdjacencyGraph} form.
 */
public class GraphConverter {
    private static final int MISSING_ELEMENT = -1;

    /**
     * Enumerate the reachable part of dfa, keeping its own state values.
     */
    public static <S, I, O> AdjacencyGraph<S, I, O> toGraph(SymbolicDFA<S, I, O> dfa) {
        return build(dfa, dfa.orderedStates(), dfa.orderedInputs(), Function.identity());
    }

    public static <S, I, O> AdjacencyGraph<Integer, I, O> toIndexedGraph(SymbolicDFA<S, I, O> dfa) {
        return toIndexedGraph(dfa, dfa.orderedInputs());
    }

    /**
     * Enumerate the reachable part of dfa with states renumbered 0..n-1 in depth-first discovery order
     * over inputOrder. The start state is always 0, so the result does not depend on how states were
     * represented, only on the automaton's structure.
     */
    public static <S, I, O> AdjacencyGraph<Integer, I, O> toIndexedGraph(SymbolicDFA<S, I, O> dfa,
                                                                         List<I> inputOrder) {
        checkOrder(dfa, inputOrder);
        final List<S> order = discoveryOrder(dfa, inputOrder);

        final Object2IntMap<S> index = new Object2IntOpenHashMap<>();
        index.defaultReturnValue(MISSING_ELEMENT);
        for (S s : order) {
            index.put(s, index.size());
        }
        return build(dfa, order, inputOrder, index::getInt);
    }

    private static <S, K, I, O> AdjacencyGraph<K, I, O> build(SymbolicDFA<S, I, O> dfa, List<S> order,
                                                            List<I> inputOrder, Function<S, K> key) {
        final Map<K, StateEntry<K, I, O>> adjacency = new LinkedHashMap<>();
        for (S s : order) {
            final Map<I, K> transitions = new LinkedHashMap<>();
            for (I a : inputOrder) {
                transitions.put(a, key.apply(dfa.getTransitionFunction().apply(s, a)));
            }
            adjacency.put(key.apply(s), new StateEntry<>(dfa.getLabelFunction().apply(s), transitions));
        }
        return new AdjacencyGraph<>(key.apply(dfa.getStart()), adjacency);
    }

    /**
     * Build a table-backed automaton. Its alphabet is every symbol appearing in the graph,
     * its outputs every label appearing in it.
     */
    public static <S, I, O> SymbolicDFA<S, I, O> fromGraph(AdjacencyGraph<S, I, O> graph) {
        final Set<I> inputs = new LinkedHashSet<>();
        final Set<O> outputs = new LinkedHashSet<>();
        for (StateEntry<S, I, O> entry : graph.adjacency().values()) {
            inputs.addAll(entry.transitions().keySet());
            outputs.add(entry.label());
        }
        return new SymbolicDFA<>(
            graph.start(),
            s -> graph.entry(s).label(),
            (s, c) -> {
                S succ = graph.entry(s).transitions().get(c);
                if (succ == null) {
                    throw new IllegalArgumentException("No transition from " + s + " on " + c);
                }
                return succ;
            },
            inputs,
            outputs);
    }

    /**
     * inputOrder must list every symbol of the dfa's alphabet exactly once.
     */
    public static <I> void checkOrder(SymbolicDFA<?, I, ?> dfa, Collection<I> inputOrder) {
        final Set<I> inputs = dfa.getInputs();
        if (inputs != null
            && inputOrder.size() == inputs.size()
            && new HashSet<>(inputOrder).equals(inputs)) {
            return;
        }
        throw new AlphabetMismatchException("Input order " + inputOrder + " is not an ordering of " + inputs);
    }

    private static <S, I> List<S> discoveryOrder(SymbolicDFA<S, I, ?> dfa, List<I> inputOrder) {
        if (inputOrder.equals(dfa.orderedInputs())) {
            return dfa.orderedStates(); // cached
        }
        final Set<S> visited = new LinkedHashSet<>();
        final Deque<S> stack = new ArrayDeque<>();
        stack.push(dfa.getStart());
        while (!stack.isEmpty()) {
            S curr = stack.pop();
            if (!visited.add(curr)) {
                continue;
            }
            for (I a : inputOrder) {
                stack.push(dfa.getTransitionFunction().apply(curr, a));
            }
        }
        return new ArrayList<>(visited);
    }
}
