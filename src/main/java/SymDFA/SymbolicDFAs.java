package SymDFA;

import java.util.Collection;

import SymDFA.Graph.CompactConverter;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;

/**
 * Ready-made acceptors and adapters from AutomataLib's explicit automata.
 */
public class SymbolicDFAs {

    /**
     * Single state acceptor of every word over inputs.
     */
    public static <I> SymbolicDFA<Integer, I, Boolean> universal(Collection<? extends I> inputs) {
        return constant(inputs, true);
    }

    /**
     * Single state acceptor of no word at all.
     */
    public static <I> SymbolicDFA<Integer, I, Boolean> empty(Collection<? extends I> inputs) {
        return constant(inputs, false);
    }

    private static <I> SymbolicDFA<Integer, I, Boolean> constant(Collection<? extends I> inputs, boolean accepting) {
        return SymbolicDFA.of(0, s -> accepting, (s, c) -> s, inputs);
    }

    public static <I> SymbolicDFA<Integer, I, Boolean> fromCompact(CompactDFA<I> dfa) {
        return CompactConverter.fromCompact(dfa);
    }

    /**
     * Determinize nfa (completing it with a sink where needed) and view the result lazily.
     */
    public static <I> SymbolicDFA<Integer, I, Boolean> fromNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final CompactDFA<I> dfa = NFAs.determinize(nfa, alphabet, false, false);
        return CompactConverter.fromCompact(dfa);
    }
}
