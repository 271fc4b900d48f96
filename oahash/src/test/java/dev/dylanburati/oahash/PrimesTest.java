package dev.dylanburati.oahash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PrimesTest {
  @ParameterizedTest
  @CsvSource({
    "-5, 2",
    "0, 2",
    "1, 2",
    "2, 2",
    "3, 3",
    "4, 5",
    "7, 7",
    "8, 11",
    "14, 17",
    "24, 29",
    "100, 101",
    "7919, 7919",
    "65536, 65537",
  })
  void testAtLeast(int n, int expected) {
    assertEquals(expected, Primes.atLeast(n));
  }

  @Test void testAtLeastNearLimit() {
    assertEquals(Primes.MAX_PRIME, Primes.atLeast(Primes.MAX_PRIME));
    assertEquals(Primes.MAX_PRIME, Primes.atLeast(Primes.MAX_PRIME - 10));
    assertThrows(IllegalArgumentException.class, () -> Primes.atLeast(Primes.MAX_PRIME + 1));
  }

  @ParameterizedTest
  @ValueSource(ints = {2, 3, 5, 13, 25013, 1_000_003, 2147483629, 2147483647})
  void testIsPrime(int n) {
    assertTrue(Primes.isPrime(n));
  }

  @ParameterizedTest
  @ValueSource(ints = {-7, 0, 1, 4, 9, 25, 49, 121, 25021, 1_000_001, 2147483645})
  void testIsNotPrime(int n) {
    assertFalse(Primes.isPrime(n));
  }
}
