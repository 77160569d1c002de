package SymDFA.Graph;

import SymDFA.SymbolicDFA;
import SymDFA.Model.NotBooleanException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Enumerates the reachable part into a {@link CompactDFA} and runs AutomataLib's Hopcroft minimization on it.
 */
public class HopcroftDFAMinimizer implements Minimizer {

    @Override
    public <I> SymbolicDFA<Integer, I, Boolean> minimize(SymbolicDFA<?, I, ?> dfa) {
        if (!dfa.isBoolean()) {
            throw new NotBooleanException("minimize");
        }
        final Alphabet<I> alphabet = Alphabets.fromCollection(dfa.orderedInputs());
        final CompactDFA<I> explicit = CompactConverter.toCompact(dfa, alphabet);
        final CompactDFA<I> minimal = HopcroftMinimizer.minimizeDFA(explicit, alphabet);
        return CompactConverter.fromCompact(minimal);
    }
}
