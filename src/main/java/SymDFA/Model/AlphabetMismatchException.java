package SymDFA.Model;

/**
 * Two automata (or an automaton and a symbol order) disagree on the input alphabet.
 */
public class AlphabetMismatchException extends SymbolicDFAException {
    public AlphabetMismatchException(String message) {
        super(message);
    }
}
