package SymDFA.Equality;

import java.util.List;
import java.util.Optional;

import SymDFA.SymbolicDFA;

/**
 * Searches the lazy product automata for accepting words, so only the part of the product reachable
 * before the first counterexample is ever built.
 */
public class ProductEquivalenceOracle implements EquivalenceOracle {

    @Override
    public <I> Optional<List<I>> findCounterexample(SymbolicDFA<?, I, ?> a, SymbolicDFA<?, I, ?> b) {
        return a.symmetricDifference(b).findAcceptingWord();
    }

    /**
     * @return a word accepted by smaller but not by bigger, or empty if smaller's language is a subset of bigger's
     */
    public <I> Optional<List<I>> findSubsetCounterexample(SymbolicDFA<?, I, ?> smaller, SymbolicDFA<?, I, ?> bigger) {
        return smaller.intersection(bigger.complement()).findAcceptingWord();
    }
}
