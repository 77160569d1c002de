package SymDFA.Model;

/**
 * Operation is only defined for automata whose outputs are a subset of {true, false}.
 */
public class NotBooleanException extends SymbolicDFAException {
    public NotBooleanException(String operation) {
        super(operation + " only defined for Boolean output DFAs.");
    }
}
