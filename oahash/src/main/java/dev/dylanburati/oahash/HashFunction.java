package dev.dylanburati.oahash;

/**
 * Maps a key into {@code [0, range)}. Used both for the starting index of a probe
 * sequence ({@code range == tableSize}) and for the stride base of double hashing
 * ({@code range == tableSize - 1}).
 *
 * Implementations should be deterministic. The table reduces any returned value
 * into range with an unsigned remainder, so returning a raw hash is allowed.
 */
@FunctionalInterface
public interface HashFunction {
  int hash(String key, int range);
}
