package SymDFA.Equality;

import java.util.List;
import java.util.Optional;

import SymDFA.SymbolicDFA;

/**
 * Decides language equivalence of two acceptors by looking for a word they disagree on.
 */
public interface EquivalenceOracle {
    /**
     * @param a - Boolean acceptor
     * @param b - Boolean acceptor over the same alphabet
     * @return a word accepted by exactly one of a and b, or empty if their languages coincide
     */
    <I> Optional<List<I>> findCounterexample(SymbolicDFA<?, I, ?> a, SymbolicDFA<?, I, ?> b);
}
