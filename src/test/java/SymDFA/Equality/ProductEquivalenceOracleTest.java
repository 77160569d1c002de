package SymDFA.Equality;

import SymDFA.SymbolicDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

public class ProductEquivalenceOracleTest {
  private static final List<Integer> BINARY = List.of(0, 1);
  private final ProductEquivalenceOracle oracle = new ProductEquivalenceOracle();

  /** Words with at least n ones. */
  private static SymbolicDFA<Integer, Integer, Boolean> atLeastOnes(int n) {
    return SymbolicDFA.of(0, s -> s >= n, (s, c) -> Math.min(n, s + c), BINARY);
  }

  @Test
  void testCounterexample() {
    Optional<List<Integer>> word = oracle.findCounterexample(atLeastOnes(1), atLeastOnes(2));
    Assertions.assertEquals(Optional.of(List.of(1)), word);
    Assertions.assertEquals(Optional.empty(), oracle.findCounterexample(atLeastOnes(2), atLeastOnes(2)));
  }

  @Test
  void testSubset() {
    // at least two ones implies at least one
    Assertions.assertEquals(Optional.empty(), oracle.findSubsetCounterexample(atLeastOnes(2), atLeastOnes(1)));
    Optional<List<Integer>> word = oracle.findSubsetCounterexample(atLeastOnes(1), atLeastOnes(2));
    Assertions.assertTrue(word.isPresent());
    Assertions.assertTrue(atLeastOnes(1).label(word.get()));
    Assertions.assertFalse(atLeastOnes(2).label(word.get()));
  }
}
