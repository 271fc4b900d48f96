package dev.dylanburati.oahash;

import java.util.HashMap;
import java.util.Map;

public class Helpers {
  /**
   * Hash function that looks each key up in {@code pairs} (key, int, key, int, ...),
   * so tests can decide exactly where keys land.
   */
  public static HashFunction fixed(Object... pairs) {
    Map<String, Integer> table = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      table.put((String) pairs[i], (Integer) pairs[i + 1]);
    }
    return (key, range) -> table.get(key) % range;
  }

  public static SlotState stateAt(OAHashTable<?> t, int idx) {
    return t.slots().get(idx).getState();
  }

  public static String keyAt(OAHashTable<?> t, int idx) {
    return t.slots().get(idx).getKey();
  }
}
