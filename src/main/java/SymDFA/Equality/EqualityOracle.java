package SymDFA.Equality;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

import SymDFA.SymbolicDFA;
import SymDFA.Codec.CanonicalCodec;
import SymDFA.Graph.GraphConverter;
import SymDFA.Graph.HopcroftDFAMinimizer;
import SymDFA.Graph.Minimizer;
import SymDFA.Model.SymbolicDFAException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equality and hashing of automata by behaviour rather than representation.
 * <p>
 * Acceptors are equal when no word distinguishes them, and hash to their canonical encoding.
 * Automata with other outputs are compared (and hashed) through their reindexed reachable tables.
 * Automata without a declared alphabet cannot be explored, so for them only identity counts.
 */
public class EqualityOracle {
    private static final Logger logger = LoggerFactory.getLogger(EqualityOracle.class);
    private static final EqualityOracle STANDARD =
        new EqualityOracle(new HopcroftDFAMinimizer(), new ProductEquivalenceOracle());

    private final Minimizer minimizer;
    private final EquivalenceOracle equivalence;

    public EqualityOracle(Minimizer minimizer, EquivalenceOracle equivalence) {
        this.minimizer = minimizer;
        this.equivalence = equivalence;
    }

    /**
     * The oracle behind {@link SymbolicDFA#equals(Object)} and {@link SymbolicDFA#hashCode()}.
     */
    public static EqualityOracle standard() {
        return STANDARD;
    }

    public int hash(SymbolicDFA<?, ?, ?> dfa) {
        if (!dfa.hasInputs()) {
            return System.identityHashCode(dfa);
        }
        try {
            return canonicalHash(dfa);
        } catch (SymbolicDFAException e) {
            logger.debug("No canonical encoding, hashing the normalized form: {}", e.getMessage());
            return GraphConverter.toIndexedGraph(dfa).hashCode();
        }
    }

    private <I> int canonicalHash(SymbolicDFA<?, I, ?> dfa) {
        return CanonicalCodec.toInt(dfa, dfa.orderedInputs(), minimizer).hashCode();
    }

    /**
     * Acceptors are compared by language, everything else by reindexed table. An acceptor never equals
     * an automaton with wider outputs, even one that only ever emits true and false, since the two are
     * hashed differently.
     */
    public boolean equal(SymbolicDFA<?, ?, ?> a, SymbolicDFA<?, ?, ?> b) {
        if (a == b) {
            return true;
        }
        if (!a.hasInputs() || !b.hasInputs() || !a.getInputs().equals(b.getInputs())) {
            return false;
        }
        if (a.isBoolean() != b.isBoolean()) {
            return false;
        }
        if (a.isBoolean()) {
            return equivalent(a, b);
        }
        return GraphConverter.toIndexedGraph(a).equals(GraphConverter.toIndexedGraph(b));
    }

    private <I> boolean equivalent(SymbolicDFA<?, I, ?> a, SymbolicDFA<?, ?, ?> b) {
        return equivalence.findCounterexample(a, overInputs(b, a.getInputs())).isEmpty();
    }

    /**
     * View acceptor b over inputs, an alphabet equal to its own as a set; symbols are matched by equals.
     */
    private static <T, J, I> SymbolicDFA<T, I, Boolean> overInputs(SymbolicDFA<T, J, ?> b, Set<I> inputs) {
        final Map<Object, J> own = new HashMap<>();
        for (J j : b.getInputs()) {
            own.put(j, j);
        }
        final Function<T, ?> label = b.getLabelFunction();
        final BiFunction<T, J, T> transition = b.getTransitionFunction();
        return SymbolicDFA.of(
            b.getStart(),
            s -> Boolean.TRUE.equals(label.apply(s)),
            (s, c) -> transition.apply(s, own.get(c)),
            inputs);
    }
}
