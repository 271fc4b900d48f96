package dev.dylanburati.oahash;

/**
 * Table sizing. Capacities are kept prime so that every stride in
 * {@code [1, tableSize)} visits every slot before returning to its start.
 */
public final class Primes {
  /** Largest prime that still fits in a Java array. */
  public static final int MAX_PRIME = 2147483629;

  private Primes() {}

  /**
   * Smallest prime {@code >= n}. Anything below 2 yields 2.
   *
   * @throws IllegalArgumentException if {@code n > MAX_PRIME}
   */
  public static int atLeast(int n) {
    if (n > MAX_PRIME) {
      throw new IllegalArgumentException("no prime table size >= " + n);
    }
    if (n <= 2) {
      return 2;
    }
    int candidate = (n % 2 == 0) ? n + 1 : n;
    while (!isPrime(candidate)) {
      candidate += 2;
    }
    return candidate;
  }

  public static boolean isPrime(int n) {
    if (n < 2) {
      return false;
    }
    if (n < 4) {
      return true;
    }
    if (n % 2 == 0 || n % 3 == 0) {
      return false;
    }
    // 6k +/- 1; long arithmetic so i * i can't overflow near MAX_PRIME
    for (long i = 5; i * i <= n; i += 6) {
      if (n % i == 0 || n % (i + 2) == 0) {
        return false;
      }
    }
    return true;
  }
}
