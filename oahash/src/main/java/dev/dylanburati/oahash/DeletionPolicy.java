package dev.dylanburati.oahash;

/**
 * What {@link OAHashTable#remove(String)} does with the slot it frees.
 */
public enum DeletionPolicy {
  /**
   * Free the slot and re-place every entry whose probe sequence ran through it,
   * so the table never contains tombstones.
   *
   * With linear probing only the run after the freed slot is touched. With a
   * secondary hash each key has its own stride, so a removal checks every
   * occupied slot and costs time linear in the table size.
   */
  PACK,
  /** Leave a {@link SlotState#DELETED} tombstone behind. */
  MARK
}
