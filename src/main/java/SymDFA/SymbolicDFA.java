package SymDFA;

import java.math.BigInteger;
import java.util.*;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import SymDFA.Codec.CanonicalCodec;
import SymDFA.Equality.EqualityOracle;
import SymDFA.Graph.GraphConverter;
import SymDFA.Memo.MemoizedBiFunction;
import SymDFA.Memo.MemoizedFunction;
import SymDFA.Model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic automaton given by a start state and two pure functions, a labeling (state -> output)
 * and a transition (state, symbol -> state). Nothing is enumerated up front: states come into existence
 * as they are queried, and both functions are memoized, so the state space may be huge or even infinite
 * as long as only the queried part is finite.
 * <p>
 * Exhaustive operations (reachable states, word search, combinators, canonical encoding) need a declared,
 * finite input alphabet. Without one, the automaton is only good for simulating explicit words.
 * <p>
 * Equality is language (output) equivalence, not equality of the representation; see {@link EqualityOracle}.
 *
 * @param <S> state type
 * @param <I> input symbol type
 * @param <O> output (label) type, {@code Boolean} for plain acceptors
 */
public final class SymbolicDFA<S, I, O> {
    private static final Logger logger = LoggerFactory.getLogger(SymbolicDFA.class);

    public static final Set<Boolean> BOOLEAN_OUTPUTS = Set.of(Boolean.TRUE, Boolean.FALSE);

    private final S start;
    private final MemoizedFunction<S, O> label;
    private final MemoizedBiFunction<S, I, S> transition;
    private final Set<I> inputs; // null if undeclared
    private final Set<O> outputs;

    // derived, computed at most once per thread race; all racers compute the same value
    private volatile List<I> orderedInputs;
    private volatile Reachable<S> reachable;
    private volatile Integer hash;

    /**
     * @param start - start state
     * @param label - labeling function, must be pure
     * @param transition - transition function, must be pure and total over inputs
     * @param inputs - input alphabet, or null if undeclared
     * @param outputs - admissible labels
     */
    public SymbolicDFA(S start,
                       Function<? super S, ? extends O> label,
                       BiFunction<? super S, ? super I, ? extends S> transition,
                       Collection<? extends I> inputs,
                       Collection<? extends O> outputs) {
        this(start,
            MemoizedFunction.of(label),
            MemoizedBiFunction.of(transition),
            inputs == null ? null : copyOf(inputs),
            copyOf(Objects.requireNonNull(outputs, "outputs")));
    }

    // shares already memoized functions, and with them their caches
    private SymbolicDFA(S start,
                        MemoizedFunction<S, O> label,
                        MemoizedBiFunction<S, I, S> transition,
                        Set<I> inputs,
                        Set<O> outputs) {
        this.start = Objects.requireNonNull(start, "start");
        this.label = label;
        this.transition = transition;
        this.inputs = inputs;
        this.outputs = outputs;
    }

    private static <T> Set<T> copyOf(Collection<? extends T> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /**
     * Acceptor over the given alphabet, outputs {true, false}.
     */
    public static <S, I> SymbolicDFA<S, I, Boolean> of(S start,
                                                       Function<? super S, Boolean> label,
                                                       BiFunction<? super S, ? super I, ? extends S> transition,
                                                       Collection<? extends I> inputs) {
        return new SymbolicDFA<>(start, label, transition, inputs, BOOLEAN_OUTPUTS);
    }

    /**
     * Acceptor without a declared alphabet; usable for simulation only.
     */
    public static <S, I> SymbolicDFA<S, I, Boolean> withoutAlphabet(S start,
                                                                    Function<? super S, Boolean> label,
                                                                    BiFunction<? super S, ? super I, ? extends S> transition) {
        return new SymbolicDFA<>(start, label, transition, null, BOOLEAN_OUTPUTS);
    }

    public S getStart() {
        return start;
    }

    /**
     * @return declared input alphabet, or null if none was declared
     */
    public Set<I> getInputs() {
        return inputs;
    }

    public boolean hasInputs() {
        return inputs != null;
    }

    public Set<O> getOutputs() {
        return outputs;
    }

    public Function<S, O> getLabelFunction() {
        return label;
    }

    public BiFunction<S, I, S> getTransitionFunction() {
        return transition;
    }

    public boolean isBoolean() {
        return BOOLEAN_OUTPUTS.containsAll(outputs);
    }

    void requireBoolean(String operation) {
        if (!isBoolean()) {
            throw new NotBooleanException(operation);
        }
    }

    private void checkSymbol(I symbol) {
        if (inputs != null && !inputs.contains(symbol)) {
            throw new AlphabetViolationException(symbol);
        }
    }

    // ---------------------------------------------------------------- simulation

    public Iterable<S> trace(Iterable<? extends I> word) {
        return trace(word, start);
    }

    /**
     * Lazy sequence of the states visited while reading word, beginning with from.
     * It has one more element than word has symbols.
     */
    public Iterable<S> trace(Iterable<? extends I> word, S from) {
        Objects.requireNonNull(from, "from");
        return () -> new Iterator<>() {
            private final Iterator<? extends I> symbols = word.iterator();
            private S state;
            private boolean started;

            @Override
            public boolean hasNext() {
                return !started || symbols.hasNext();
            }

            @Override
            public S next() {
                if (!started) {
                    started = true;
                    state = from;
                    return state;
                }
                I symbol = symbols.next();
                checkSymbol(symbol);
                state = transition.apply(state, symbol);
                return state;
            }
        };
    }

    public S transition(Iterable<? extends I> word) {
        return transition(word, start);
    }

    /**
     * State reached after reading word from the given state.
     */
    public S transition(Iterable<? extends I> word, S from) {
        S last = from;
        for (S s : trace(word, from)) {
            last = s;
        }
        return last;
    }

    public O label(Iterable<? extends I> word) {
        return label(word, start);
    }

    /**
     * Output of the state reached after reading word.
     * @throws InvalidOutputException if the label is not a declared output
     */
    public O label(Iterable<? extends I> word, S from) {
        S state = transition(word, from);
        O output = label.apply(state);
        if (!outputs.contains(output)) {
            throw new InvalidOutputException(state, output);
        }
        return output;
    }

    public List<O> transduce(Iterable<? extends I> word) {
        return transduce(word, start);
    }

    /**
     * Labels observed before each symbol is consumed; the label of the final state is not included.
     */
    public List<O> transduce(Iterable<? extends I> word, S from) {
        List<O> result = new ArrayList<>();
        Iterator<S> states = trace(word, from).iterator();
        S state = states.next();
        while (states.hasNext()) {
            result.add(label.apply(state));
            state = states.next();
        }
        return result;
    }

    public Simulation<S, I, S> runStates() {
        return runStates(start);
    }

    /**
     * Step-by-step simulation yielding the current state after each symbol.
     */
    public Simulation<S, I, S> runStates(S from) {
        return new Simulation<>(this, from, Function.identity());
    }

    public Simulation<S, I, O> runLabels() {
        return runLabels(start);
    }

    /**
     * Step-by-step simulation yielding the label of the current state after each symbol.
     */
    public Simulation<S, I, O> runLabels(S from) {
        return new Simulation<>(this, from, label);
    }

    S step(S state, I symbol) {
        checkSymbol(symbol);
        return transition.apply(state, symbol);
    }

    // ---------------------------------------------------------------- search

    /**
     * Input alphabet in a deterministic order: natural order if the symbols are mutually comparable,
     * identity hash order otherwise.
     */
    public List<I> orderedInputs() {
        List<I> result = orderedInputs;
        if (result == null) {
            if (inputs == null) {
                throw new MissingAlphabetException("Ordering inputs");
            }
            List<I> sorted = new ArrayList<>(inputs);
            try {
                sorted.sort(null); // respect inherent order
            } catch (ClassCastException e) {
                logger.debug("Inputs are not mutually comparable, ordering by identity: {}", e.getMessage());
                sorted.sort(Comparator.comparingInt(System::identityHashCode));
            }
            result = Collections.unmodifiableList(sorted);
            orderedInputs = result;
        }
        return result;
    }

    /**
     * @return all states reachable from the start state
     */
    public Set<S> states() {
        return reachable().set();
    }

    /**
     * Reachable states in depth-first discovery order, start state first.
     */
    public List<S> orderedStates() {
        return reachable().order();
    }

    private Reachable<S> reachable() {
        Reachable<S> result = reachable;
        if (result == null) {
            if (inputs == null) {
                throw new MissingAlphabetException("Computing reachable states");
            }
            final List<I> symbols = orderedInputs();
            final Set<S> visited = new LinkedHashSet<>();
            final Deque<S> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                S curr = stack.pop();
                if (!visited.add(curr)) {
                    continue;
                }
                for (I a : symbols) {
                    stack.push(transition.apply(curr, a));
                }
            }
            logger.debug("Explored {} reachable states", visited.size());
            result = new Reachable<>(List.copyOf(visited), Collections.unmodifiableSet(visited));
            reachable = result;
        }
        return result;
    }

    /**
     * Depth-first search for an accepting word, trying symbols in {@link #orderedInputs()} order.
     * The word returned is the first one found, which is not necessarily a shortest one;
     * see {@link #findShortestAcceptingWord()} for that.
     *
     * @return accepting word, or empty if no reachable state accepts
     */
    public Optional<List<I>> findAcceptingWord() {
        requireBoolean("findAcceptingWord");
        final List<I> symbols = orderedInputs();

        if (accepts(start)) {
            return Optional.of(List.of());
        }
        final Set<S> visited = new HashSet<>();
        final Deque<SearchFrame<S>> stack = new ArrayDeque<>();
        final List<I> word = new ArrayList<>();
        visited.add(start);
        stack.push(new SearchFrame<>(start));

        while (!stack.isEmpty()) {
            SearchFrame<S> frame = stack.peek();
            if (frame.nextSymbol == symbols.size()) {
                stack.pop();
                if (!stack.isEmpty()) {
                    word.remove(word.size() - 1); // drop the symbol that led into the finished state
                }
                continue;
            }
            I a = symbols.get(frame.nextSymbol++);
            S succ = transition.apply(frame.state, a);
            if (visited.contains(succ)) {
                continue;
            }
            word.add(a);
            if (accepts(succ)) {
                return Optional.of(List.copyOf(word));
            }
            visited.add(succ);
            stack.push(new SearchFrame<>(succ));
        }
        return Optional.empty();
    }

    /**
     * Breadth-first search for a minimum length accepting word; ties go to the word that is smallest
     * in {@link #orderedInputs()} order.
     */
    public Optional<List<I>> findShortestAcceptingWord() {
        requireBoolean("findShortestAcceptingWord");
        final List<I> symbols = orderedInputs();

        final Set<S> visited = new HashSet<>();
        final Deque<SearchRecord<S, I>> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(SearchRecord.root(start));
        while (!queue.isEmpty()) {
            SearchRecord<S, I> curr = queue.poll();
            if (accepts(curr.state())) {
                LinkedList<I> word = new LinkedList<>();
                for (SearchRecord<S, I> r = curr; r.parent() != null; r = r.parent()) {
                    word.addFirst(r.symbol());
                }
                return Optional.of(List.copyOf(word));
            }
            for (I a : symbols) {
                S succ = transition.apply(curr.state(), a);
                if (visited.add(succ)) {
                    queue.add(curr.step(a, succ));
                }
            }
        }
        return Optional.empty();
    }

    private boolean accepts(S state) {
        return Boolean.TRUE.equals(label.apply(state));
    }

    // ---------------------------------------------------------------- boolean algebra

    /**
     * Same automaton with every label negated.
     */
    public SymbolicDFA<S, I, Boolean> complement() {
        requireBoolean("complement");
        Set<Boolean> negated = new LinkedHashSet<>();
        for (O o : outputs) {
            negated.add(!(Boolean) o);
        }
        final MemoizedFunction<S, Boolean> negatedLabel = MemoizedFunction.of(s -> !(Boolean) label.apply(s));
        return new SymbolicDFA<S, I, Boolean>(start, negatedLabel, transition, inputs, Collections.unmodifiableSet(negated));
    }

    public <T> SymbolicDFA<StatePair<S, T>, I, Boolean> union(SymbolicDFA<T, I, ?> other) {
        return combine(other, Boolean::logicalOr);
    }

    public <T> SymbolicDFA<StatePair<S, T>, I, Boolean> intersection(SymbolicDFA<T, I, ?> other) {
        return combine(other, Boolean::logicalAnd);
    }

    public <T> SymbolicDFA<StatePair<S, T>, I, Boolean> symmetricDifference(SymbolicDFA<T, I, ?> other) {
        return combine(other, Boolean::logicalXor);
    }

    /**
     * Lazy product automaton, labeled by op applied to the labels of the component states.
     * @throws NotBooleanException if either operand is not Boolean
     * @throws AlphabetMismatchException if the operands' alphabets differ
     */
    public <T> SymbolicDFA<StatePair<S, T>, I, Boolean> combine(SymbolicDFA<T, I, ?> other,
                                                                 BinaryOperator<Boolean> op) {
        requireBoolean("Boolean combination");
        other.requireBoolean("Boolean combination");
        if (!Objects.equals(inputs, other.inputs)) {
            throw new AlphabetMismatchException("Boolean combination requires shared inputs: "
                + inputs + " vs " + other.inputs);
        }
        final Function<T, ?> otherLabel = other.label;
        final BiFunction<T, I, T> otherTransition = other.transition;

        Set<Boolean> combinedOutputs = new LinkedHashSet<>();
        for (Object o : outputs) {
            combinedOutputs.add((Boolean) o);
        }
        for (Object o : other.outputs) {
            combinedOutputs.add((Boolean) o);
        }
        return new SymbolicDFA<>(
            new StatePair<>(start, other.start),
            s -> op.apply((Boolean) label.apply(s.left()), (Boolean) otherLabel.apply(s.right())),
            (s, c) -> new StatePair<>(transition.apply(s.left(), c), otherTransition.apply(s.right(), c)),
            inputs,
            combinedOutputs);
    }

    // ---------------------------------------------------------------- normal forms

    /**
     * Reindexed copy with states 0..n-1 in depth-first discovery order, backed by an explicit table.
     */
    public SymbolicDFA<Integer, I, O> normalize() {
        return GraphConverter.fromGraph(GraphConverter.toIndexedGraph(this));
    }

    /**
     * Canonical integer of this acceptor under the natural input order.
     */
    public BigInteger toInt() {
        return CanonicalCodec.toInt(this);
    }

    public BigInteger toInt(List<I> inputOrder) {
        return CanonicalCodec.toInt(this, inputOrder);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolicDFA<?, ?, ?> other)) {
            return false;
        }
        return EqualityOracle.standard().equal(this, other);
    }

    @Override
    public int hashCode() {
        Integer result = hash;
        if (result == null) {
            result = EqualityOracle.standard().hash(this);
            hash = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return "SymbolicDFA{start=" + start + ", inputs=" + inputs + ", outputs=" + outputs + "}";
    }

    private record Reachable<S>(List<S> order, Set<S> set) { }

    private static final class SearchFrame<S> {
        final S state;
        int nextSymbol;

        SearchFrame(S state) {
            this.state = state;
        }
    }
}
