package SymDFA.Graph;

import java.util.ArrayDeque;
import java.util.Deque;

import SymDFA.SymbolicDFA;
import SymDFA.Model.NotBooleanException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges lazy acceptors and AutomataLib's explicit {@link CompactDFA}.
 */
public class CompactConverter {
    private static final Logger logger = LoggerFactory.getLogger(CompactConverter.class);
    private static final int MISSING_ELEMENT = -1;

    /**
     * Explore the reachable part of dfa into a CompactDFA over alphabet.
     * @param dfa - Boolean acceptor with a declared alphabet
     * @param alphabet - the dfa's input symbols, in the order the CompactDFA should index them
     * @return complete CompactDFA; the initial state is state 0
     * @param <S> - state type of the lazy acceptor
     * @param <I> - input symbol type
     */
    public static <S, I> CompactDFA<I> toCompact(SymbolicDFA<S, I, ?> dfa, Alphabet<I> alphabet) {
        if (!dfa.isBoolean()) {
            throw new NotBooleanException("Conversion to CompactDFA");
        }
        GraphConverter.checkOrder(dfa, alphabet);

        final CompactDFA<I> out = new CompactDFA<>(alphabet);
        final Object2IntMap<S> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(MISSING_ELEMENT);
        final Deque<ExploreRecord<S>> stack = new ArrayDeque<>();

        S init = dfa.getStart();
        int initOut = out.addInitialState(accepts(dfa, init));
        outStateMap.put(init, initOut);
        stack.push(new ExploreRecord<>(init, initOut));

        while (!stack.isEmpty()) {
            ExploreRecord<S> curr = stack.pop();
            for (I sym : alphabet) {
                S succ = dfa.getTransitionFunction().apply(curr.inputState(), sym);
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(accepts(dfa, succ));
                    outStateMap.put(succ, outSucc);
                    stack.push(new ExploreRecord<>(succ, outSucc));
                }
                out.setTransition(curr.outputAddress(), alphabet.getSymbolIndex(sym), outSucc);
            }
        }
        logger.debug("Explored {} states into a CompactDFA", out.size());
        return out;
    }

    /**
     * View a complete CompactDFA as a lazy acceptor, starting at its initial state.
     */
    public static <I> SymbolicDFA<Integer, I, Boolean> fromCompact(CompactDFA<I> compact) {
        Integer init = compact.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("CompactDFA has no initial state");
        }
        return fromCompact(compact, init);
    }

    public static <I> SymbolicDFA<Integer, I, Boolean> fromCompact(CompactDFA<I> compact, int start) {
        return SymbolicDFA.of(
            start,
            s -> compact.isAccepting(s),
            (s, c) -> {
                Integer succ = compact.getSuccessor(s, c);
                if (succ == null) {
                    throw new IllegalArgumentException("CompactDFA is partial: no transition from " + s + " on " + c);
                }
                return succ;
            },
            compact.getInputAlphabet());
    }

    private static <S> boolean accepts(SymbolicDFA<S, ?, ?> dfa, S state) {
        return Boolean.TRUE.equals(dfa.getLabelFunction().apply(state));
    }

    private record ExploreRecord<S>(S inputState, int outputAddress) { }
}
