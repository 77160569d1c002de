package SymDFA.Memo;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Unbounded cache in front of a pure unary function, e.g. a state labeling.
 * <p>
 * The wrapped function is invoked outside of any map lock, so it may call other memoized functions
 * (or this one) while computing. Two threads missing the same key both compute it; since the function
 * is pure, whichever result is published first is kept.
 */
public final class MemoizedFunction<A, R> implements Function<A, R> {
    private final Function<? super A, ? extends R> function;
    private final ConcurrentMap<A, R> cache = new ConcurrentHashMap<>();

    private MemoizedFunction(Function<? super A, ? extends R> function) {
        this.function = Objects.requireNonNull(function);
    }

    public static <A, R> MemoizedFunction<A, R> of(Function<? super A, ? extends R> function) {
        return new MemoizedFunction<>(function);
    }

    @Override
    public R apply(A arg) {
        Objects.requireNonNull(arg, "argument");
        R cached = cache.get(arg);
        if (cached != null) {
            return cached;
        }
        R computed = Objects.requireNonNull(function.apply(arg), "function returned null");
        R raced = cache.putIfAbsent(arg, computed);
        return raced == null ? computed : raced;
    }

    /**
     * @return number of distinct arguments seen so far
     */
    public int size() {
        return cache.size();
    }
}
