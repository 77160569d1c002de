package SymDFA.Graph;

import SymDFA.SymbolicDFA;

/**
 * Produces a language-equivalent acceptor with the fewest possible states.
 */
public interface Minimizer {
    /**
     * @param dfa - Boolean acceptor with a declared alphabet
     * @return minimal equivalent acceptor over the same alphabet, with integer states
     */
    <I> SymbolicDFA<Integer, I, Boolean> minimize(SymbolicDFA<?, I, ?> dfa);
}
