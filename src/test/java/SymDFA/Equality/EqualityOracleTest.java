package SymDFA.Equality;

import SymDFA.SymbolicDFA;
import SymDFA.SymbolicDFAs;
import SymDFA.Graph.HopcroftDFAMinimizer;
import SymDFA.Graph.Minimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class EqualityOracleTest {
  private static final List<String> AB = List.of("a", "b");

  private static SymbolicDFA<Integer, String, Boolean> evenLength() {
    return SymbolicDFA.of(0, s -> s == 0, (s, c) -> 1 - s, AB);
  }

  /** Same language as evenLength, but counting mod 4. */
  private static SymbolicDFA<Integer, String, Boolean> evenLengthMod4() {
    return SymbolicDFA.of(0, s -> s % 2 == 0, (s, c) -> (s + 1) % 4, AB);
  }

  @Test
  void testStandardEquality() {
    Assertions.assertEquals(evenLength(), evenLengthMod4());
    Assertions.assertEquals(evenLength().hashCode(), evenLengthMod4().hashCode());
    Assertions.assertNotEquals(evenLength(), evenLength().complement());
    Assertions.assertEquals(evenLength(), evenLength().complement().complement());

    // the product of a language with itself is the language
    Assertions.assertEquals(evenLength(), evenLength().intersection(evenLengthMod4()));
    Assertions.assertEquals(SymbolicDFAs.empty(AB), evenLength().symmetricDifference(evenLengthMod4()));
    Assertions.assertEquals(SymbolicDFAs.universal(AB), evenLength().union(evenLength().complement()));
  }

  @Test
  void testHashSetDeduplicates() {
    Set<SymbolicDFA<?, String, Boolean>> set = new HashSet<>();
    set.add(evenLength());
    set.add(evenLengthMod4());
    set.add(evenLength().complement());
    set.add(evenLength().intersection(evenLength()));
    Assertions.assertEquals(2, set.size());
  }

  @Test
  void testDifferentAlphabets() {
    SymbolicDFA<Integer, String, Boolean> abc = SymbolicDFA.of(0, s -> s == 0, (s, c) -> 1 - s, List.of("a", "b", "c"));
    Assertions.assertNotEquals(evenLength(), abc);
    Assertions.assertNotEquals(SymbolicDFAs.universal(AB), SymbolicDFAs.universal(List.of("a")));
  }

  @Test
  void testWithoutAlphabet() {
    SymbolicDFA<Integer, String, Boolean> free = SymbolicDFA.withoutAlphabet(0, s -> s == 0, (s, c) -> 1 - s);
    SymbolicDFA<Integer, String, Boolean> twin = SymbolicDFA.withoutAlphabet(0, s -> s == 0, (s, c) -> 1 - s);
    Assertions.assertEquals(free, free);
    Assertions.assertNotEquals(free, twin);
    Assertions.assertNotEquals(free, evenLength());
    Assertions.assertEquals(System.identityHashCode(free), free.hashCode());
  }

  @Test
  void testNonBoolean() {
    SymbolicDFA<Integer, String, String> parity =
        new SymbolicDFA<>(0, s -> s == 0 ? "even" : "odd", (s, c) -> 1 - s, AB, Set.of("even", "odd"));
    SymbolicDFA<Integer, String, String> parityMod4 =
        new SymbolicDFA<>(0, s -> s % 2 == 0 ? "even" : "odd", (s, c) -> (s + 1) % 4, AB, Set.of("even", "odd"));
    SymbolicDFA<Integer, String, String> shifted =
        new SymbolicDFA<>(3, s -> s == 3 ? "even" : "odd", (s, c) -> 7 - s, AB, Set.of("even", "odd"));
    Assertions.assertEquals(parity, shifted);
    Assertions.assertEquals(parity.hashCode(), shifted.hashCode());
    // not minimized: structural comparison only
    Assertions.assertNotEquals(parity, parityMod4);
    Assertions.assertNotEquals(parity, evenLength());
  }

  @Test
  void testAcceptorNeverEqualsWiderOutputs() {
    SymbolicDFA<Integer, String, Boolean> plain = evenLength();
    SymbolicDFA<Integer, String, Object> wider =
        new SymbolicDFA<>(0, s -> s == 0, (s, c) -> 1 - s, AB, Set.of(true, false, "unknown"));
    SymbolicDFA<Integer, String, Object> widerShifted =
        new SymbolicDFA<>(5, s -> s == 5, (s, c) -> 11 - s, AB, Set.of(true, false, "unknown"));
    Assertions.assertNotEquals(plain, wider);
    Assertions.assertNotEquals(wider, plain);
    Assertions.assertEquals(wider, widerShifted);
    Assertions.assertFalse(new HashSet<>(List.of(plain)).contains(wider));
    Assertions.assertTrue(new HashSet<>(List.of(wider)).contains(widerShifted));
  }

  @Test
  void testEqualImpliesSameHash() {
    SymbolicDFA<Integer, String, Object> wider =
        new SymbolicDFA<>(0, s -> s == 0, (s, c) -> 1 - s, AB, Set.of(true, false, "unknown"));
    SymbolicDFA<Integer, String, Object> widerShifted =
        new SymbolicDFA<>(5, s -> s == 5, (s, c) -> 11 - s, AB, Set.of(true, false, "unknown"));
    SymbolicDFA<Integer, String, String> parity =
        new SymbolicDFA<>(0, s -> s == 0 ? "even" : "odd", (s, c) -> 1 - s, AB, Set.of("even", "odd"));
    List<SymbolicDFA<?, String, ?>> all = new ArrayList<>();
    all.add(evenLength());
    all.add(evenLengthMod4());
    all.add(evenLength().complement());
    all.add(evenLength().intersection(evenLengthMod4()));
    all.add(wider);
    all.add(widerShifted);
    all.add(parity);
    all.add(SymbolicDFAs.universal(AB));
    all.add(SymbolicDFAs.empty(AB));
    for (SymbolicDFA<?, String, ?> x : all) {
      for (SymbolicDFA<?, String, ?> y : all) {
        if (x.equals(y)) {
          Assertions.assertEquals(x.hashCode(), y.hashCode(), x + " equals " + y);
          Assertions.assertEquals(y, x);
        }
      }
    }
  }

  @Test
  void testSymbolTypesMayDiffer() {
    // same alphabet as a set, typed differently
    SymbolicDFA<Integer, Object, Boolean> objects = SymbolicDFA.of(0, s -> s == 0, (s, c) -> 1 - s, List.<Object>of("b", "a"));
    Assertions.assertEquals(evenLength(), objects);
    Assertions.assertEquals(objects, evenLengthMod4());
    Assertions.assertNotEquals(objects, evenLength().complement());
    Assertions.assertEquals(evenLength().hashCode(), objects.hashCode());
  }

  @Test
  void testCollaborators() {
    List<String> calls = new ArrayList<>();
    Minimizer minimizer = new Minimizer() {
      @Override
      public <I> SymbolicDFA<Integer, I, Boolean> minimize(SymbolicDFA<?, I, ?> dfa) {
        calls.add("minimize");
        return new HopcroftDFAMinimizer().minimize(dfa);
      }
    };
    EquivalenceOracle alwaysDiffer = new EquivalenceOracle() {
      @Override
      public <I> Optional<List<I>> findCounterexample(SymbolicDFA<?, I, ?> a, SymbolicDFA<?, I, ?> b) {
        calls.add("counterexample");
        return Optional.of(List.of());
      }
    };
    EqualityOracle oracle = new EqualityOracle(minimizer, alwaysDiffer);

    Assertions.assertFalse(oracle.equal(evenLength(), evenLengthMod4()));
    Assertions.assertEquals(List.of("counterexample"), calls);
    Assertions.assertEquals(EqualityOracle.standard().hash(evenLength()), oracle.hash(evenLengthMod4()));
    Assertions.assertEquals(List.of("counterexample", "minimize"), calls);

    SymbolicDFA<Integer, String, Boolean> x = evenLength();
    Assertions.assertTrue(oracle.equal(x, x));
    Assertions.assertEquals(2, calls.size());
  }
}
