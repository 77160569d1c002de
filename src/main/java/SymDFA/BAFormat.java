package SymDFA;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import SymDFA.Graph.CompactConverter;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * Reading and writing automata in the BA format, via AutomataLib's parser and writer.
 * BA format described here: https://languageinclusion.org/doku.php?id=tools
 */
public class BAFormat {

    public static CompactNFA<String> readNFA(InputStream is) throws IOException, FormatException {
        return BAParsers.nfa().readModel(is).model;
    }

    /**
     * Load a BA file and determinize it into a lazy acceptor over the file's symbols.
     */
    public static SymbolicDFA<Integer, String, Boolean> readDFA(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return SymbolicDFAs.fromNFA(readNFA(is));
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * Write the reachable part of dfa, with its symbols in natural order.
     */
    public static <I> void writeDFA(OutputStream os, SymbolicDFA<?, I, ?> dfa) throws IOException {
        final Alphabet<I> alphabet = Alphabets.fromCollection(dfa.orderedInputs());
        final CompactDFA<I> compact = CompactConverter.toCompact(dfa, alphabet);
        new BAWriter<I>().writeModel(os, compact, alphabet);
    }

    static <I> void writeDFA(String filename, SymbolicDFA<?, I, ?> dfa) {
        try (OutputStream os = new FileOutputStream(filename)) {
            writeDFA(os, dfa);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
