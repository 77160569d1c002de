package SymDFA.Graph;

import SymDFA.RandomDFAs;
import SymDFA.SymbolicDFA;
import SymDFA.SymbolicDFAs;
import SymDFA.Words;
import SymDFA.Model.NotBooleanException;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class HopcroftDFAMinimizerTest {
  private final Minimizer minimizer = new HopcroftDFAMinimizer();

  @Test
  void testMinimize() {
    // counts a's mod 6 but only parity is observable
    SymbolicDFA<Integer, String, Boolean> mod6 =
        SymbolicDFA.of(0, s -> s % 2 == 0, (s, c) -> c.equals("a") ? (s + 1) % 6 : s, List.of("a", "b"));
    SymbolicDFA<Integer, String, Boolean> minimal = minimizer.minimize(mod6);
    Assertions.assertEquals(2, minimal.states().size());
    Assertions.assertEquals(mod6.getInputs(), minimal.getInputs());
    for (List<String> word : Words.upTo(List.of("a", "b"), 6)) {
      Assertions.assertEquals(mod6.label(word), minimal.label(word));
    }
  }

  @Test
  void testIdempotent() {
    for (int seed = 0; seed < 10; seed++) {
      CompactDFA<Integer> compact = RandomDFAs.getRandomAutomaton(seed, 20);
      SymbolicDFA<Integer, Integer, Boolean> once = minimizer.minimize(SymbolicDFAs.fromCompact(compact));
      SymbolicDFA<Integer, Integer, Boolean> twice = minimizer.minimize(once);
      int expected = HopcroftMinimizer.minimizeDFA(compact, compact.getInputAlphabet()).size();
      Assertions.assertEquals(expected, once.states().size());
      Assertions.assertEquals(expected, twice.states().size());
      Assertions.assertEquals(GraphConverter.toIndexedGraph(once), GraphConverter.toIndexedGraph(twice));
    }
  }

  @Test
  void testSingleStates() {
    Assertions.assertEquals(Set.of(0), minimizer.minimize(SymbolicDFAs.universal(List.of('x'))).states());
    SymbolicDFA<Integer, Character, Boolean> neverAccepts =
        SymbolicDFA.of(0, s -> false, (s, c) -> (s + 1) % 7, List.of('x', 'y'));
    Assertions.assertEquals(1, minimizer.minimize(neverAccepts).states().size());
  }

  @Test
  void testNotBoolean() {
    SymbolicDFA<Integer, Integer, Integer> moore = new SymbolicDFA<>(0, s -> s, (s, c) -> s, List.of(0), Set.of(0));
    Assertions.assertThrows(NotBooleanException.class, () -> minimizer.minimize(moore));
  }
}
