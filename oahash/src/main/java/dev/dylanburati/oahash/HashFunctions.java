package dev.dylanburati.oahash;

import java.nio.charset.StandardCharsets;

/**
 * Ready-made {@link HashFunction}s. All of them hash the UTF-8 bytes of the key and
 * reduce with an unsigned remainder, so results are always in {@code [0, range)}.
 * Bytes are read as unsigned values, except by {@link #polynomial()}, which reads
 * them signed.
 */
public final class HashFunctions {
  private static final HashFunction SIMPLE = named("simple", HashFunctions::simpleImpl);
  private static final HashFunction RS = named("rs", HashFunctions::rsImpl);
  private static final HashFunction UNIVERSAL = named("universal", HashFunctions::universalImpl);
  private static final HashFunction PJW = named("pjw", HashFunctions::pjwImpl);
  private static final HashFunction POLYNOMIAL = named("polynomial", HashFunctions::polynomialImpl);

  private HashFunctions() {}

  /** Sum of the bytes. Anagrams collide; useful for building collisions on purpose. */
  public static HashFunction simple() {
    return SIMPLE;
  }

  /** Robert Sedgewick's multiplicative hash. */
  public static HashFunction rs() {
    return RS;
  }

  /** Multiplicative hash whose multiplier changes every byte. */
  public static HashFunction universal() {
    return UNIVERSAL;
  }

  /** P. J. Weinberger's shift-and-fold hash. */
  public static HashFunction pjw() {
    return PJW;
  }

  /** 31-multiplier polynomial, walking the bytes from the end. The default primary hash. */
  public static HashFunction polynomial() {
    return POLYNOMIAL;
  }

  /**
   * Looks up a built-in function by the name its {@code toString()} reports.
   *
   * @throws IllegalArgumentException if there is no function with that name
   */
  public static HashFunction byName(String name) {
    switch (name) {
      case "simple":
        return SIMPLE;
      case "rs":
        return RS;
      case "universal":
        return UNIVERSAL;
      case "pjw":
        return PJW;
      case "polynomial":
        return POLYNOMIAL;
      default:
        throw new IllegalArgumentException("unknown hash function: " + name);
    }
  }

  private interface BytesHash {
    int hashBytes(byte[] data);
  }

  private static HashFunction named(final String name, final BytesHash impl) {
    return new HashFunction() {
      @Override
      public int hash(String key, int range) {
        if (range <= 0) {
          throw new IllegalArgumentException("expected positive range");
        }
        return Integer.remainderUnsigned(impl.hashBytes(key.getBytes(StandardCharsets.UTF_8)), range);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  private static int simpleImpl(byte[] data) {
    int h = 0;
    for (byte b : data) {
      h += b & 0xFF;
    }
    return h;
  }

  private static int rsImpl(byte[] data) {
    int a = 63689;
    int h = 0;
    for (byte b : data) {
      h = h * a + (b & 0xFF);
      a *= 378551;
    }
    return h;
  }

  private static int universalImpl(byte[] data) {
    int a = 31415;
    int h = 0;
    for (byte b : data) {
      h = a * h + (b & 0xFF);
      a *= 27183;
    }
    return h;
  }

  private static int pjwImpl(byte[] data) {
    int h = 0;
    for (byte b : data) {
      h = (h << 4) + (b & 0xFF);
      int g = h & 0xF0000000;
      if (g != 0) {
        h ^= g >>> 24;
        h ^= g;
      }
    }
    return h;
  }

  private static int polynomialImpl(byte[] data) {
    int h = 1;
    for (int offset = data.length - 1; offset >= 0; offset--) {
      h = 31 * h + (int) data[offset];
    }
    return h;
  }
}
