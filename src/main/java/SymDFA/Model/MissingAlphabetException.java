package SymDFA.Model;

public class MissingAlphabetException extends SymbolicDFAException {
    public MissingAlphabetException(String operation) {
        super(operation + " needs a declared, finite input alphabet.");
    }
}
