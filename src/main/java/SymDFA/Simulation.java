package SymDFA;

import java.util.Objects;
import java.util.function.Function;

/**
 * Externally driven run of an automaton: the caller feeds one symbol at a time and gets back the
 * value observed at the state reached (the state itself, or its label).
 * A run never ends by itself and holds no resources; callers simply stop feeding it.
 *
 * @param <S> state type
 * @param <I> input symbol type
 * @param <V> observed value type
 */
public final class Simulation<S, I, V> {
    private final SymbolicDFA<S, I, ?> dfa;
    private final Function<? super S, ? extends V> view;
    private S state;

    Simulation(SymbolicDFA<S, I, ?> dfa, S from, Function<? super S, ? extends V> view) {
        this.dfa = dfa;
        this.view = view;
        this.state = Objects.requireNonNull(from, "from");
    }

    /**
     * @return value at the current state, before any further symbol is fed
     */
    public V current() {
        return view.apply(state);
    }

    /**
     * Consume exactly one symbol.
     * @return value at the state reached
     */
    public V feed(I symbol) {
        state = dfa.step(state, symbol);
        return view.apply(state);
    }

    public S getState() {
        return state;
    }
}
