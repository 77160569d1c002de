package SymDFA.Codec;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;

import SymDFA.SymbolicDFA;
import SymDFA.Graph.AdjacencyGraph;
import SymDFA.Graph.GraphConverter;
import SymDFA.Graph.HopcroftDFAMinimizer;
import SymDFA.Graph.Minimizer;
import SymDFA.Model.AlphabetMismatchException;
import SymDFA.Model.MalformedEncodingException;
import SymDFA.Model.NotBooleanException;
import SymDFA.Model.SymbolicDFAException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical integer encoding of Boolean acceptors.
 * <p>
 * The acceptor is minimized and its states renumbered 0..n-1 (start = 0). Then, most significant bit first:
 * <ol>
 *   <li>a 1 sentinel, so that leading zero fields survive the conversion to an integer;</li>
 *   <li>state width {@code sb} in unary (sb ones, one zero), then n-1 in sb bits if sb > 0;</li>
 *   <li>input width {@code ib} in unary, then m-1 in ib bits;</li>
 *   <li>a selection bit: 1 if the rejecting states are listed (accepting states are the majority), else 0;</li>
 *   <li>if sb > 0: the listed set's size minus one, then each member, sb bits each;</li>
 *   <li>(state, symbol index, target) triples of sb, ib and sb bits for every transition that is not a
 *       self-loop, in ascending (state, symbol) order, up to the end of the encoding.</li>
 * </ol>
 * where {@code sb = ceil(log2 n)} and {@code ib = ceil(log2 m)}, both 0 below 2.
 * Decoding needs the same symbol order that was used for encoding. Only the alphabet size is recorded,
 * so a permuted order is not detected: it silently decodes to a different automaton.
 * <p>
 * Decoding never allocates by the recorded state count: labels and transitions are looked up in tables
 * holding only what the encoding lists, and every other transition is a self-loop.
 */
public class CanonicalCodec {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalCodec.class);
    private static final Minimizer DEFAULT_MINIMIZER = new HopcroftDFAMinimizer();
    private static final int MAX_FIELD_BITS = 31;
    private static final int MISSING_ELEMENT = -1;
    // largest alphabet fromInt(BigInteger) materializes as 0..m-1
    public static final int MAX_DEFAULT_INPUTS = 1 << 20;

    public static int bitsNeeded(int n) {
        return n < 2 ? 0 : Integer.SIZE - Integer.numberOfLeadingZeros(n - 1);
    }

    public static <I> BigInteger toInt(SymbolicDFA<?, I, ?> dfa) {
        return toInt(dfa, dfa.orderedInputs());
    }

    public static <I> BigInteger toInt(SymbolicDFA<?, I, ?> dfa, List<I> inputOrder) {
        return toInt(dfa, inputOrder, DEFAULT_MINIMIZER);
    }

    /**
     * @param dfa - Boolean acceptor with a declared, non-empty alphabet
     * @param inputOrder - every input symbol exactly once; symbol indices in the encoding refer to it
     * @param minimizer - reduces dfa to its minimal form before encoding
     * @return canonical encoding
     */
    public static <I> BigInteger toInt(SymbolicDFA<?, I, ?> dfa, List<I> inputOrder, Minimizer minimizer) {
        checkEncodable(dfa, inputOrder);
        return toIntOfMinimal(minimizer.minimize(dfa), inputOrder);
    }

    /**
     * Encode an acceptor that is already minimal, e.g. one returned by a {@link Minimizer}.
     * A non-minimal argument yields a valid encoding that is not the canonical one.
     */
    public static <I> BigInteger toIntOfMinimal(SymbolicDFA<?, I, ?> minimal, List<I> inputOrder) {
        checkEncodable(minimal, inputOrder);
        final AdjacencyGraph<Integer, I, ?> graph = GraphConverter.toIndexedGraph(minimal, inputOrder);
        final int n = graph.size();
        final int m = inputOrder.size();

        final IntList accepting = new IntArrayList();
        final IntList rejecting = new IntArrayList();
        for (int s = 0; s < n; s++) {
            (Boolean.TRUE.equals(graph.entry(s).label()) ? accepting : rejecting).add(s);
        }

        final int stateBits = bitsNeeded(n);
        final int inputBits = bitsNeeded(m);

        final BitBuffer encoding = new BitBuffer();
        encoding.appendBit(true);
        encoding.appendUnary(stateBits);
        if (stateBits > 0) {
            encoding.appendBits(n - 1, stateBits);
        }
        encoding.appendUnary(inputBits);
        encoding.appendBits(m - 1, inputBits);

        // list whichever set is smaller; ties go to the accepting set
        final boolean invert = 2 * accepting.size() >= n + 1;
        final IntList indices = invert ? rejecting : accepting;
        encoding.appendBit(invert);
        if (stateBits > 0) {
            if (indices.isEmpty()) {
                throw new SymbolicDFAException("Minimizer returned " + n + " states that all share one label");
            }
            encoding.appendBits(indices.size() - 1, stateBits);
            for (int idx : indices) {
                encoding.appendBits(idx, stateBits);
            }
        }

        for (int s = 0; s < n; s++) {
            for (int i = 0; i < m; i++) {
                int t = graph.entry(s).transitions().get(inputOrder.get(i));
                if (t == s) {
                    continue; // stuttering transitions are implicit
                }
                encoding.appendBits(s, stateBits);
                encoding.appendBits(i, inputBits);
                encoding.appendBits(t, stateBits);
            }
        }
        logger.debug("Encoded {} states over {} symbols into {} bits", n, m, encoding.length());
        return encoding.toBigInteger();
    }

    private static <I> void checkEncodable(SymbolicDFA<?, I, ?> dfa, List<I> inputOrder) {
        if (!dfa.isBoolean()) {
            throw new NotBooleanException("Canonical encoding");
        }
        GraphConverter.checkOrder(dfa, inputOrder);
        if (inputOrder.isEmpty()) {
            throw new SymbolicDFAException("Canonical encoding needs at least one input symbol");
        }
    }

    /**
     * Decode over the symbols 0..m-1, m being the alphabet size recorded in the encoding.
     * @throws SymbolicDFAException if m exceeds {@link #MAX_DEFAULT_INPUTS}; pass the symbols explicitly then
     */
    public static SymbolicDFA<Integer, Integer, Boolean> fromInt(BigInteger encoding) {
        final Header header = parse(encoding);
        final int m = header.inputCount();
        if (m > MAX_DEFAULT_INPUTS) {
            throw new SymbolicDFAException("Encoding has " + m + " input symbols, too many to enumerate as 0.."
                + (m - 1));
        }
        final IntList inputs = new IntArrayList(m);
        for (int i = 0; i < m; i++) {
            inputs.add(i);
        }
        return build(header, inputs);
    }

    /**
     * @param inputs - symbols in the order used when encoding
     * @throws MalformedEncodingException if the encoding is invalid or records a different alphabet size
     */
    public static <I> SymbolicDFA<Integer, I, Boolean> fromInt(BigInteger encoding, List<I> inputs) {
        if (new HashSet<>(inputs).size() != inputs.size()) {
            throw new AlphabetMismatchException("Duplicate symbols in " + inputs);
        }
        final Header header = parse(encoding);
        if (header.inputCount() != inputs.size()) {
            throw new MalformedEncodingException("Encoding has " + header.inputCount() + " input symbols, but "
                + inputs.size() + " were supplied");
        }
        return build(header, inputs);
    }

    private static Header parse(BigInteger value) {
        if (value == null || value.signum() <= 0) {
            throw new MalformedEncodingException("Encoding must be a positive integer, got " + value);
        }
        final BitBuffer encoding = BitBuffer.fromBigInteger(value);
        encoding.readBit(); // sentinel

        final int stateBits = readWidth(encoding, "state");
        final int n = stateBits > 0 ? (int) encoding.readBits(stateBits) + 1 : 1;
        if (bitsNeeded(n) != stateBits) {
            throw new MalformedEncodingException(n + " states recorded with " + stateBits + " bits per state");
        }
        final int inputBits = readWidth(encoding, "input");
        final int m = (int) encoding.readBits(inputBits) + 1;
        if (bitsNeeded(m) != inputBits) {
            throw new MalformedEncodingException(m + " inputs recorded with " + inputBits + " bits per input");
        }

        final boolean invert = encoding.readBit();
        final IntSet indices = new IntOpenHashSet();
        final IntList triples = new IntArrayList();

        if (encoding.remaining() == 0) {
            if (n != 1) {
                throw new MalformedEncodingException("Encoding ends after the header, but records " + n + " states");
            }
            return new Header(n, m, invert, indices, triples);
        }
        if (stateBits == 0) {
            throw new MalformedEncodingException(encoding.remaining() + " trailing bits after a single-state header");
        }

        final int count = (int) encoding.readBits(stateBits) + 1;
        for (int k = 0; k < count; k++) {
            indices.add(readIndex(encoding, stateBits, n, "state"));
        }

        final int tripleWidth = 2 * stateBits + inputBits;
        while (encoding.remaining() != 0) {
            if (encoding.remaining() < tripleWidth) {
                throw new MalformedEncodingException("Truncated transition: " + encoding.remaining() + " bits left");
            }
            triples.add(readIndex(encoding, stateBits, n, "source state"));
            triples.add(readIndex(encoding, inputBits, m, "input"));
            triples.add(readIndex(encoding, stateBits, n, "target state"));
        }
        return new Header(n, m, invert, indices, triples);
    }

    private static int readWidth(BitBuffer encoding, String field) {
        final int width = encoding.readUnary();
        if (width > MAX_FIELD_BITS) {
            throw new MalformedEncodingException("Unsupported " + field + " width: " + width + " bits");
        }
        return width;
    }

    private static int readIndex(BitBuffer encoding, int width, int bound, String field) {
        final int idx = (int) encoding.readBits(width);
        if (idx >= bound) {
            throw new MalformedEncodingException(field + " index " + idx + " out of range [0, " + bound + ")");
        }
        return idx;
    }

    private static <I> SymbolicDFA<Integer, I, Boolean> build(Header header, List<I> inputs) {
        final Object2IntMap<I> symbolIndex = new Object2IntOpenHashMap<>(inputs.size());
        symbolIndex.defaultReturnValue(MISSING_ELEMENT);
        for (I a : inputs) {
            symbolIndex.put(a, symbolIndex.size());
        }
        final IntList triples = header.transitions();
        final Long2IntMap table = new Long2IntOpenHashMap(triples.size() / 3);
        table.defaultReturnValue(MISSING_ELEMENT);
        for (int k = 0; k < triples.size(); k += 3) {
            table.put(key(triples.getInt(k), triples.getInt(k + 1)), triples.getInt(k + 2));
        }
        logger.debug("Decoded {} states, {} listed transitions", header.stateCount(), table.size());
        return SymbolicDFA.of(
            0,
            s -> header.accepting(s),
            (s, c) -> {
                int t = table.get(key(s, symbolIndex.getInt(c)));
                return t == MISSING_ELEMENT ? s : t; // absent pairs are self-loops
            },
            inputs);
    }

    private static long key(int state, int symbol) {
        return ((long) state << Integer.SIZE) | (symbol & 0xFFFFFFFFL);
    }

    /**
     * Parsed form of an encoding; transitions are flattened (source, input, target) triples.
     */
    private record Header(int stateCount, int inputCount, boolean invert, IntSet indices, IntList transitions) {
        boolean accepting(int state) {
            return indices.contains(state) ^ invert;
        }
    }
}
