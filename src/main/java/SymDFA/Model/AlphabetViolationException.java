package SymDFA.Model;

/**
 * A symbol outside the declared input alphabet was fed to a simulation.
 */
public class AlphabetViolationException extends SymbolicDFAException {
    private final transient Object symbol;

    public AlphabetViolationException(Object symbol) {
        super("Symbol not in input alphabet: " + symbol);
        this.symbol = symbol;
    }

    public Object getSymbol() {
        return symbol;
    }
}
