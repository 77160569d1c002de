package SymDFA.Memo;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

public class MemoizedFunctionTest {
  @Test
  void testComputedOnce() {
    AtomicInteger calls = new AtomicInteger();
    MemoizedFunction<Integer, Integer> square = MemoizedFunction.of(x -> { calls.incrementAndGet(); return x * x; });
    Assertions.assertEquals(9, square.apply(3));
    Assertions.assertEquals(9, square.apply(3));
    Assertions.assertEquals(16, square.apply(4));
    Assertions.assertEquals(2, calls.get());
    Assertions.assertEquals(2, square.size());
  }

  @Test
  void testBiFunctionKeyedByBothArguments() {
    AtomicInteger calls = new AtomicInteger();
    MemoizedBiFunction<Integer, String, String> repeat =
        MemoizedBiFunction.of((n, s) -> { calls.incrementAndGet(); return s.repeat(n); });
    Assertions.assertEquals("abab", repeat.apply(2, "ab"));
    Assertions.assertEquals("ababab", repeat.apply(3, "ab"));
    Assertions.assertEquals("cc", repeat.apply(2, "c"));
    Assertions.assertEquals("abab", repeat.apply(2, "ab"));
    Assertions.assertEquals(3, calls.get());
    Assertions.assertEquals(3, repeat.size());
  }

  @Test
  void testRecursiveCalls() {
    // fib calls itself through the cache; must neither deadlock nor fail
    Function<Integer, Long>[] fib = new Function[1];
    fib[0] = MemoizedFunction.of(n -> n < 2 ? (long) n : fib[0].apply(n - 1) + fib[0].apply(n - 2));
    Assertions.assertEquals(12586269025L, fib[0].apply(50));
  }

  @Test
  void testNullsRejected() {
    MemoizedFunction<Integer, Integer> f = MemoizedFunction.of(x -> null);
    Assertions.assertThrows(NullPointerException.class, () -> f.apply(1));
    Assertions.assertThrows(NullPointerException.class, () -> f.apply(null));
    Assertions.assertEquals(0, f.size());
  }

  @Test
  void testConcurrentPopulation() throws Exception {
    final int keys = 2000;
    BiFunction<Integer, Integer, Integer> step = MemoizedBiFunction.of((s, c) -> (s * 31 + c) % 1009);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        results.add(pool.submit(() -> {
          for (int k = 0; k < keys; k++) {
            if (step.apply(k, k % 3) != (k * 31 + k % 3) % 1009) {
              return false;
            }
          }
          return true;
        }));
      }
      for (Future<Boolean> result : results) {
        Assertions.assertTrue(result.get());
      }
    } finally {
      pool.shutdown();
    }
    Assertions.assertEquals(keys, ((MemoizedBiFunction<Integer, Integer, Integer>) step).size());
  }
}
