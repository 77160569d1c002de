package SymDFA.Model;

/**
 * The label function produced a value outside the declared outputs.
 * The automaton definition itself is broken; there is nothing a caller can do to recover.
 */
public class InvalidOutputException extends SymbolicDFAException {
    public InvalidOutputException(Object state, Object output) {
        super("Label of state " + state + " is " + output + ", which is not a declared output.");
    }
}
