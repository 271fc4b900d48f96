package dev.dylanburati.oahash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.dylanburati.oahash.OAHashTableException.ErrorCode.*;

/**
 * Open-addressing hash table from bounded-length strings to values, with a prime
 * capacity and a caller-chosen collision strategy.
 *
 * Each key's probe sequence starts at {@code primaryHash(key, tableSize)} and
 * advances by a fixed stride: 1 without a secondary hash (linear probing), or
 * {@code secondaryHash(key, tableSize - 1) + 1} with one (double hashing). The
 * table grows by {@code growthFactor} before an insert would push the load above
 * {@code maxLoadFactor}. Removed slots are either left as tombstones
 * ({@link DeletionPolicy#MARK}) or freed, with the entries that probed through
 * them moved back ({@link DeletionPolicy#PACK}).
 *
 * Every slot visited by any operation adds one to the probe counter reported by
 * {@link #stats()}.
 *
 * Instances are not thread-safe.
 */
public class OAHashTable<V> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(OAHashTable.class);
  // readIndex result when a full cycle finds neither the key nor a usable slot
  private static final int NO_SLOT = Integer.MIN_VALUE;

  private final TableConfig<V> config;
  private final HashFunction primaryHash;
  private final HashFunction secondaryHash;
  private final Consumer<? super V> releaser;

  // INVARIANT 0: states.length is prime, or the arrays are all null once closed
  // INVARIANT 1: states.length == keys.length == values.length
  // INVARIANT 2: keys[i] != null IFF states[i] != UNOCCUPIED
  //              values[i] is null unless states[i] == OCCUPIED
  private SlotState[] states;
  private String[] keys;
  private Object[] values;

  // INVARIANT 3: count == count [s | s in states, s == OCCUPIED]
  // INVARIANT 4: no state is DELETED under the PACK policy
  private int count;
  private long probes;
  private int expansions;

  public OAHashTable() {
    this(TableConfig.<V>defaults());
  }

  public OAHashTable(int initialTableSize) {
    this(TableConfig.<V>builder().initialTableSize(initialTableSize).build());
  }

  public OAHashTable(final TableConfig<V> config) {
    this.config = Objects.requireNonNull(config);
    this.primaryHash = config.getPrimaryHash();
    this.secondaryHash = config.getSecondaryHash();
    this.releaser = config.getReleaser();
    this.allocate(Primes.atLeast(config.getInitialTableSize()));
    this.count = 0;
    this.probes = 0;
    this.expansions = 0;
  }

  /**
   * Associates {@code value} with {@code key}. If the key is already present its
   * value is replaced and the previous value is handed to the releaser.
   *
   * @throws OAHashTableException {@code INVALID_KEY} if the key is null or too long;
   *   {@code OUT_OF_MEMORY} if no slot can be found or allocated
   */
  public void insert(String key, V value) {
    this.ensureOpen();
    if (key == null) {
      throw new OAHashTableException(INVALID_KEY, "Key cannot be null");
    }
    if (!this.fitsKeyLimit(key)) {
      throw new OAHashTableException(INVALID_KEY, "Key longer than " + this.config.getMaxKeyLength() + " bytes");
    }
    int idx = this.readIndex(key);
    if (idx >= 0) {
      V prev = castUnsafe(this.values[idx]);
      this.values[idx] = value;
      if (prev != value) {
        this.release(prev);
      }
      return;
    }
    if (this.growthRequired()) {
      // a growth factor close to 1 may need several steps
      do {
        this.grow();
      } while (this.growthRequired());
      idx = this.readIndex(key);
    }
    if (idx == NO_SLOT) {
      throw new OAHashTableException(OUT_OF_MEMORY, "Failed to insert item");
    }
    this.placeAt(-idx - 1, key, value);
  }

  /**
   * Removes {@code key}, handing its value to the releaser.
   *
   * @throws OAHashTableException {@code NOT_FOUND} if the key is null or not present
   */
  public void remove(String key) {
    this.ensureOpen();
    int idx = this.lookup(key);
    if (idx < 0) {
      throw new OAHashTableException(NOT_FOUND, "Key not in table");
    }
    this.release(castUnsafe(this.values[idx]));
    this.values[idx] = null;
    this.count--;
    if (this.config.getDeletionPolicy() == DeletionPolicy.PACK) {
      this.states[idx] = SlotState.UNOCCUPIED;
      this.keys[idx] = null;
      this.compact(idx);
    } else {
      // key stays for diagnostics, see Slot
      this.states[idx] = SlotState.DELETED;
    }
  }

  /**
   * Returns the value stored under {@code key}. Only the probe counter changes.
   *
   * @throws OAHashTableException {@code NOT_FOUND} if the key is null or not present
   */
  public V find(String key) {
    this.ensureOpen();
    int idx = this.lookup(key);
    if (idx < 0) {
      throw new OAHashTableException(NOT_FOUND, "Item not found in table");
    }
    return castUnsafe(this.values[idx]);
  }

  /** Same walk as {@link #find(String)}, without the exception. */
  public boolean contains(String key) {
    this.ensureOpen();
    return this.lookup(key) >= 0;
  }

  /**
   * Removes every entry, handing each value to the releaser. Capacity, probe count
   * and expansion count are kept.
   */
  public void clear() {
    this.ensureOpen();
    List<V> discarded = new ArrayList<>(this.count);
    for (int i = 0; i < this.states.length; i++) {
      if (this.states[i] == SlotState.OCCUPIED) {
        discarded.add(castUnsafe(this.values[i]));
      }
    }
    Arrays.fill(this.states, SlotState.UNOCCUPIED);
    Arrays.fill(this.keys, null);
    Arrays.fill(this.values, null);
    this.count = 0;
    for (V value : discarded) {
      this.release(value);
    }
  }

  /** Clears the table and drops its slot arrays. Later calls other than {@code close} fail. */
  @Override
  public void close() {
    if (this.states == null) {
      return;
    }
    this.clear();
    this.states = null;
    this.keys = null;
    this.values = null;
  }

  public TableStats stats() {
    this.ensureOpen();
    return new TableStats(this.states.length, this.count, this.probes, this.expansions, this.primaryHash, this.secondaryHash);
  }

  /** Copy of every slot in physical order, for diagnostics. */
  public List<Slot<V>> slots() {
    this.ensureOpen();
    List<Slot<V>> result = new ArrayList<>(this.states.length);
    for (int i = 0; i < this.states.length; i++) {
      result.add(new Slot<>(this.states[i], this.keys[i], castUnsafe(this.values[i])));
    }
    return Collections.unmodifiableList(result);
  }

  /** Visits the occupied slots in physical order. */
  public void forEach(BiConsumer<String, ? super V> action) {
    Objects.requireNonNull(action);
    this.ensureOpen();
    for (int i = 0; i < this.states.length; i++) {
      if (this.states[i] == SlotState.OCCUPIED) {
        action.accept(this.keys[i], castUnsafe(this.values[i]));
      }
    }
  }

  public int size() {
    this.ensureOpen();
    return this.count;
  }

  public boolean isEmpty() {
    return this.size() == 0;
  }

  public int tableSize() {
    this.ensureOpen();
    return this.states.length;
  }

  public TableConfig<V> config() {
    return this.config;
  }

  @SuppressWarnings("unchecked")
  private static <V> V castUnsafe(Object v) {
    return (V) v;
  }

  private void ensureOpen() {
    if (this.states == null) {
      throw new IllegalStateException("table is closed");
    }
  }

  private void allocate(int tableSize) {
    // INVARIANT 1 upheld; INVARIANT 2 upheld, all slots UNOCCUPIED with null keys
    this.states = new SlotState[tableSize];
    Arrays.fill(this.states, SlotState.UNOCCUPIED);
    this.keys = new String[tableSize];
    this.values = new Object[tableSize];
  }

  private void release(V value) {
    if (value != null && this.releaser != null) {
      this.releaser.accept(value);
    }
  }

  private boolean fitsKeyLimit(String key) {
    int limit = this.config.getMaxKeyLength();
    // UTF-8 never uses fewer bytes than UTF-16 chars
    if (key.length() > limit) {
      return false;
    }
    return key.getBytes(StandardCharsets.UTF_8).length <= limit;
  }

  private int homeIndex(String key, int tableSize) {
    return Integer.remainderUnsigned(this.primaryHash.hash(key, tableSize), tableSize);
  }

  private int stride(String key, int tableSize) {
    if (this.secondaryHash == null) {
      return 1;
    }
    // always in [1, tableSize - 1], which is coprime to a prime tableSize
    return Integer.remainderUnsigned(this.secondaryHash.hash(key, tableSize - 1), tableSize - 1) + 1;
  }

  static int next(int idx, int stride, int tableSize) {
    // idx + stride may wrap past Integer.MAX_VALUE when tableSize > 2^30; subtracting
    // tableSize wraps back, so n is exact in two's complement
    int n = idx + stride - tableSize;
    return n >= 0 ? n : n + tableSize;
  }

  /**
   * Walks the probe sequence for {@code key}, counting every step.
   *
   * Returns:
   * <ul>
   * <li> {@code index} when an occupied slot holds the key
   * <li> {@code -index - 1} when the walk ends without a match; the index refers to the
   *   first tombstone found if any, otherwise the unoccupied slot that ended the walk
   * <li> {@code NO_SLOT} when a full cycle finds neither
   * </ul>
   */
  private int readIndex(String key) {
    int tableSize = this.states.length;
    int start = this.homeIndex(key, tableSize);
    int stride = this.stride(key, tableSize);
    int h = start;
    int firstTombstone = -1;
    do {
      this.probes++;
      SlotState state = this.states[h];
      if (state == SlotState.UNOCCUPIED) {
        return firstTombstone >= 0 ? -firstTombstone - 1 : -h - 1;
      }
      if (state == SlotState.DELETED) {
        firstTombstone = firstTombstone < 0 ? h : firstTombstone;
      } else if (this.keys[h].equals(key)) {
        return h;
      }
      h = next(h, stride, tableSize);
    } while (h != start);
    return firstTombstone >= 0 ? -firstTombstone - 1 : NO_SLOT;
  }

  // index of key, or -1 for null, over-long and absent keys
  private int lookup(String key) {
    if (key == null || !this.fitsKeyLimit(key)) {
      return -1;
    }
    int idx = this.readIndex(key);
    return idx >= 0 ? idx : -1;
  }

  /** INVARIANTS 2 and 3 upheld WHEN states[idx] != OCCUPIED prior to calling */
  private void placeAt(int idx, String key, Object value) {
    this.states[idx] = SlotState.OCCUPIED;
    this.keys[idx] = key;
    this.values[idx] = value;
    this.count++;
  }

  /**
   * Places an entry whose key is known to be absent, without checking the load.
   * Shared by growth and compaction. Returns the slot it landed in.
   */
  private int place(String key, Object value) {
    int idx = this.readIndex(key);
    if (idx >= 0) {
      throw new IllegalStateException("duplicate key while re-placing entries");
    }
    if (idx == NO_SLOT) {
      throw new OAHashTableException(OUT_OF_MEMORY, "Failed to re-place item");
    }
    this.placeAt(-idx - 1, key, value);
    return -idx - 1;
  }

  private boolean growthRequired() {
    int tableSize = this.states.length;
    double maxLoadFactor = this.config.getMaxLoadFactor();
    if (maxLoadFactor == 1.0) {
      return this.count == tableSize;
    }
    return (double) (this.count + 1) / tableSize > maxLoadFactor;
  }

  private void grow() {
    int oldSize = this.states.length;
    if (oldSize >= Primes.MAX_PRIME) {
      throw new OAHashTableException(OUT_OF_MEMORY, "Cannot grow table beyond " + oldSize + " slots");
    }
    double requested = Math.ceil(oldSize * this.config.getGrowthFactor());
    int newSize = Primes.atLeast((int) Math.min(requested, (double) Primes.MAX_PRIME));
    logger.debug("Growing table from {} to {} slots ({} entries)", oldSize, newSize, this.count);

    SlotState[] oldStates = this.states;
    String[] oldKeys = this.keys;
    Object[] oldValues = this.values;
    this.allocate(newSize);
    this.count = 0;
    this.expansions++;
    // tombstones are dropped here
    for (int src = 0; src < oldSize; src++) {
      if (oldStates[src] == SlotState.OCCUPIED) {
        this.place(oldKeys[src], oldValues[src]);
      }
    }
  }

  // PACK only: restore findability of every entry after slot `vacated` was freed
  private void compact(int vacated) {
    if (this.secondaryHash == null) {
      this.compactCluster(vacated);
    } else {
      this.compactCrossing(vacated);
    }
  }

  /**
   * With stride 1, the entries that may have probed through the freed slot are
   * exactly the run that follows it. Each is lifted and re-placed in order, which
   * backfills the freed slot and every slot vacated along the way.
   */
  private void compactCluster(int vacated) {
    int tableSize = this.states.length;
    int run = 0;
    for (int h = next(vacated, 1, tableSize); h != vacated && this.states[h] != SlotState.UNOCCUPIED; h = next(h, 1, tableSize)) {
      run++;
    }
    logger.trace("Compacting {} slots after slot {}", run, vacated);
    int h = vacated;
    for (int i = 0; i < run; i++) {
      h = next(h, 1, tableSize);
      this.relocate(h);
    }
  }

  /**
   * With double hashing each key has its own stride, so the entries that probed
   * through a hole can sit anywhere. Every entry whose own sequence passes the hole
   * before reaching its slot is re-placed; the slot it leaves is a new hole and is
   * handled the same way. Each move shortens the moved entry's probe path, so this
   * terminates.
   */
  private void compactCrossing(int vacated) {
    int tableSize = this.states.length;
    Deque<Integer> holes = new ArrayDeque<>();
    holes.push(vacated);
    while (!holes.isEmpty()) {
      int hole = holes.pop();
      for (int j = 0; j < tableSize && this.states[hole] == SlotState.UNOCCUPIED; j++) {
        if (this.states[j] == SlotState.OCCUPIED && this.crosses(j, hole)) {
          logger.trace("Moving entry at slot {} across hole {}", j, hole);
          if (this.relocate(j) != j) {
            holes.push(j);
          }
        }
      }
    }
  }

  // true when the probe sequence of keys[idx] passes through `hole` before reaching idx
  private boolean crosses(int idx, int hole) {
    int tableSize = this.states.length;
    String key = this.keys[idx];
    int stride = this.stride(key, tableSize);
    int h = this.homeIndex(key, tableSize);
    for (int step = 0; step < tableSize && h != idx; step++) {
      if (h == hole) {
        return true;
      }
      h = next(h, stride, tableSize);
    }
    return false;
  }

  /** Lifts the entry at {@code idx} and places it again. Returns where it landed. */
  private int relocate(int idx) {
    String key = this.keys[idx];
    Object value = this.values[idx];
    this.states[idx] = SlotState.UNOCCUPIED;
    this.keys[idx] = null;
    this.values[idx] = null;
    this.count--;
    return this.place(key, value);
  }
}
