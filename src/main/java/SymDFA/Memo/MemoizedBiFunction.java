package SymDFA.Memo;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

/**
 * Binary counterpart of {@link MemoizedFunction}, keyed by the (first, second) argument pair.
 * Used for transition functions, i.e. (state, symbol) -> state.
 */
public final class MemoizedBiFunction<A, B, R> implements BiFunction<A, B, R> {
    private final BiFunction<? super A, ? super B, ? extends R> function;
    private final ConcurrentMap<ArgumentPair<A, B>, R> cache = new ConcurrentHashMap<>();

    private MemoizedBiFunction(BiFunction<? super A, ? super B, ? extends R> function) {
        this.function = Objects.requireNonNull(function);
    }

    public static <A, B, R> MemoizedBiFunction<A, B, R> of(BiFunction<? super A, ? super B, ? extends R> function) {
        return new MemoizedBiFunction<>(function);
    }

    @Override
    public R apply(A first, B second) {
        final ArgumentPair<A, B> key = new ArgumentPair<>(
            Objects.requireNonNull(first, "first argument"), Objects.requireNonNull(second, "second argument"));
        R cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        R computed = Objects.requireNonNull(function.apply(first, second), "function returned null");
        R raced = cache.putIfAbsent(key, computed);
        return raced == null ? computed : raced;
    }

    public int size() {
        return cache.size();
    }

    private record ArgumentPair<A, B>(A first, B second) { }
}
