package dev.dylanburati.oahash;

/**
 * Snapshot of a table's bookkeeping, taken by {@link OAHashTable#stats()}.
 */
public final class TableStats {
  private final int tableSize;
  private final int count;
  private final long probes;
  private final int expansions;
  private final HashFunction primaryHash;
  private final HashFunction secondaryHash;

  TableStats(int tableSize, int count, long probes, int expansions, HashFunction primaryHash, HashFunction secondaryHash) {
    this.tableSize = tableSize;
    this.count = count;
    this.probes = probes;
    this.expansions = expansions;
    this.primaryHash = primaryHash;
    this.secondaryHash = secondaryHash;
  }

  public int getTableSize() {
    return this.tableSize;
  }

  /** Number of occupied slots. Tombstones are not counted. */
  public int getCount() {
    return this.count;
  }

  /** Total probe steps taken by every operation since the table was created. */
  public long getProbes() {
    return this.probes;
  }

  public int getExpansions() {
    return this.expansions;
  }

  public double getLoadFactor() {
    return (double) this.count / (double) this.tableSize;
  }

  public HashFunction getPrimaryHash() {
    return this.primaryHash;
  }

  /** Null when the table probes linearly. */
  public HashFunction getSecondaryHash() {
    return this.secondaryHash;
  }

  @Override
  public String toString() {
    return String.format(
      "TableStats{tableSize=%d, count=%d, probes=%d, expansions=%d, loadFactor=%.3f, primaryHash=%s, secondaryHash=%s}",
      this.tableSize, this.count, this.probes, this.expansions, this.getLoadFactor(), this.primaryHash, this.secondaryHash
    );
  }
}
