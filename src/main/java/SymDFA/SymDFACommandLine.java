package SymDFA;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import SymDFA.Codec.CanonicalCodec;
import SymDFA.Graph.AdjacencyGraph;
import SymDFA.Graph.GraphConverter;
import SymDFA.Graph.HopcroftDFAMinimizer;

public class SymDFACommandLine {
  private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  public static void main(String[] args) {
    String baOutput = null;
    List<String> order = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      } else if ("--order".equalsIgnoreCase(arg) || "--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(); // exits
        }
        String value = args[++i]; // consume the value
        if ("--order".equalsIgnoreCase(arg)) {
          order = splitSymbols(value);
        } else {
          baOutput = value;
        }
      } else if (arg.startsWith("-") && !isInteger(arg)) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }
    String command = positional.get(0).toLowerCase();
    switch (command) {
      case "encode" -> {
        if (positional.size() != 2) {
          printUsageAndExit();
        }
        SymbolicDFA<Integer, String, Boolean> dfa = BAFormat.readDFA(positional.get(1));
        encode(dfa, order, baOutput);
      }
      case "decode" -> {
        if (positional.size() > 3) {
          printUsageAndExit();
        }
        BigInteger encoding = new BigInteger(positional.get(1));
        if (positional.size() == 3) {
          decode(encoding, splitSymbols(positional.get(2)));
        } else {
          decode(encoding, null);
        }
      }
      default -> printUsageAndExit();
    }
  }

  private static void printUsageAndExit() {
    System.out.println("SymDFA [--debug] [--order <symbols>] [--writeBA <BA output file>] encode <BA input file>");
    System.out.println("SymDFA [--debug] decode <integer> [<symbols>]");
    System.out.println("[--debug] : Debug logging");
    System.out.println("[--order <symbols>] : Comma separated symbol order for the encoding (default: sorted)");
    System.out.println("[--writeBA <BA output file>] : Write the minimized DFA to the specified output file");
    System.out.println();
    System.out.println("encode : determinize and minimize the automaton, print its canonical integer");
    System.out.println("decode : print the automaton encoded by the integer, over <symbols> or 0..m-1");
    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format).");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  static <S> BigInteger encode(SymbolicDFA<S, String, Boolean> dfa, List<String> order) {
    return encode(dfa, order, null);
  }

  /**
   * Print size, canonical integer and a shortest accepting word of dfa.
   * @param dfa - acceptor to encode
   * @param order - symbol order, or null for the natural order
   * @param baOutput - file to write the minimized DFA to, or null
   * @return canonical integer
   */
  static <S> BigInteger encode(SymbolicDFA<S, String, Boolean> dfa, List<String> order, String baOutput) {
    List<String> inputOrder = order == null ? dfa.orderedInputs() : order;
    System.out.println("Reachable states: " + dfa.states().size());
    System.out.println("Alphabet size: " + inputOrder.size());

    long before = System.currentTimeMillis();
    SymbolicDFA<Integer, String, Boolean> minimal = new HopcroftDFAMinimizer().minimize(dfa);
    BigInteger encoding = CanonicalCodec.toIntOfMinimal(minimal, inputOrder);
    long after = System.currentTimeMillis();
    System.out.println("Minimized states: " + minimal.states().size());
    System.out.println("Canonical integer: " + encoding);
    System.out.println("Encoding bits: " + encoding.bitLength());
    System.out.println("Encoding duration: " + ((after - before) / 1000f) + "s");

    Optional<List<String>> word = minimal.findShortestAcceptingWord();
    System.out.println("Shortest accepting word: " + word.map(Object::toString).orElse("none"));

    if (baOutput != null) {
      System.out.println("Writing minimized DFA to file: " + baOutput);
      BAFormat.writeDFA(baOutput, minimal);
    }
    return encoding;
  }

  /**
   * Print the automaton an integer encodes.
   * @param encoding - canonical integer
   * @param symbols - symbols in encoding order, or null for 0..m-1
   * @return the decoded automaton's indexed table
   */
  static AdjacencyGraph<Integer, ?, Boolean> decode(BigInteger encoding, List<String> symbols) {
    AdjacencyGraph<Integer, ?, Boolean> graph = symbols == null
        ? GraphConverter.toIndexedGraph(CanonicalCodec.fromInt(encoding))
        : GraphConverter.toIndexedGraph(CanonicalCodec.fromInt(encoding, symbols));
    System.out.println("States: " + graph.size());
    graph.adjacency().forEach((state, row) ->
        System.out.println("  " + state + (row.label() ? " (accepting)" : "") + ": " + row.transitions()));
    return graph;
  }

  private static List<String> splitSymbols(String csv) {
    return Arrays.asList(csv.split(","));
  }

  private static boolean isInteger(String arg) {
    try {
      new BigInteger(arg);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
