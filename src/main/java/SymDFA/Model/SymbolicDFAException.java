package SymDFA.Model;

/**
 * Base of all failures reported by symbolic DFA operations.
 * All of them are deterministic in their inputs, so none is worth retrying.
 */
public class SymbolicDFAException extends RuntimeException {
    public SymbolicDFAException(String message) {
        super(message);
    }

    public SymbolicDFAException(String message, Throwable cause) {
        super(message, cause);
    }
}
