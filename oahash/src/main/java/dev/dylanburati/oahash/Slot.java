package dev.dylanburati.oahash;

import java.util.Objects;

/**
 * Read-only copy of one slot, as returned by {@link OAHashTable#slots()}.
 *
 * {@code key} is null for unoccupied slots; tombstones keep the key they held.
 * {@code value} is only non-null for occupied slots.
 */
public final class Slot<V> {
  private final SlotState state;
  private final String key;
  private final V value;

  Slot(SlotState state, String key, V value) {
    this.state = state;
    this.key = key;
    this.value = value;
  }

  public SlotState getState() {
    return this.state;
  }

  public String getKey() {
    return this.key;
  }

  public V getValue() {
    return this.value;
  }

  public boolean isOccupied() {
    return this.state == SlotState.OCCUPIED;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Slot<?>)) {
      return false;
    }
    Slot<?> s = (Slot<?>) o;
    return this.state == s.state && Objects.equals(this.key, s.key) && Objects.equals(this.value, s.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.state, this.key, this.value);
  }

  @Override
  public String toString() {
    switch (this.state) {
      case OCCUPIED:
        return this.key + "=" + this.value;
      case DELETED:
        return "<deleted " + this.key + ">";
      default:
        return "<empty>";
    }
  }
}
