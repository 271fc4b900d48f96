package dev.dylanburati.oahash;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable settings for an {@link OAHashTable}. Create one with {@link #builder()}.
 *
 * <pre>
 * TableConfig&lt;Resource&gt; config = TableConfig.&lt;Resource&gt;builder()
 *     .initialTableSize(7)
 *     .secondaryHash(HashFunctions.pjw())
 *     .deletionPolicy(DeletionPolicy.PACK)
 *     .releaser(Resource::close)
 *     .build();
 * </pre>
 */
public final class TableConfig<V> {
  public static final int DEFAULT_INITIAL_TABLE_SIZE = 17;
  public static final double DEFAULT_MAX_LOAD_FACTOR = 0.5;
  public static final double DEFAULT_GROWTH_FACTOR = 2.0;
  public static final DeletionPolicy DEFAULT_DELETION_POLICY = DeletionPolicy.MARK;
  public static final int DEFAULT_MAX_KEY_LENGTH = 31;

  private final int initialTableSize;
  private final HashFunction primaryHash;
  private final HashFunction secondaryHash;
  private final double maxLoadFactor;
  private final double growthFactor;
  private final DeletionPolicy deletionPolicy;
  private final int maxKeyLength;
  private final Consumer<? super V> releaser;

  private TableConfig(Builder<V> b) {
    this.initialTableSize = b.initialTableSize;
    this.primaryHash = b.primaryHash;
    this.secondaryHash = b.secondaryHash;
    this.maxLoadFactor = b.maxLoadFactor;
    this.growthFactor = b.growthFactor;
    this.deletionPolicy = b.deletionPolicy;
    this.maxKeyLength = b.maxKeyLength;
    this.releaser = b.releaser;
  }

  public static <V> Builder<V> builder() {
    return new Builder<>();
  }

  /** A config with every setting at its default. */
  public static <V> TableConfig<V> defaults() {
    return new Builder<V>().build();
  }

  /** Requested size; the table rounds it up to a prime. */
  public int getInitialTableSize() {
    return this.initialTableSize;
  }

  public HashFunction getPrimaryHash() {
    return this.primaryHash;
  }

  /** Null for linear probing. */
  public HashFunction getSecondaryHash() {
    return this.secondaryHash;
  }

  public double getMaxLoadFactor() {
    return this.maxLoadFactor;
  }

  public double getGrowthFactor() {
    return this.growthFactor;
  }

  public DeletionPolicy getDeletionPolicy() {
    return this.deletionPolicy;
  }

  /** Longest accepted key, in UTF-8 bytes. */
  public int getMaxKeyLength() {
    return this.maxKeyLength;
  }

  /** Null when values need no cleanup. */
  public Consumer<? super V> getReleaser() {
    return this.releaser;
  }

  /** Copies every setting into a new builder. */
  public Builder<V> toBuilder() {
    return new Builder<V>()
      .initialTableSize(this.initialTableSize)
      .primaryHash(this.primaryHash)
      .secondaryHash(this.secondaryHash)
      .maxLoadFactor(this.maxLoadFactor)
      .growthFactor(this.growthFactor)
      .deletionPolicy(this.deletionPolicy)
      .maxKeyLength(this.maxKeyLength)
      .releaser(this.releaser);
  }

  public static final class Builder<V> {
    private int initialTableSize = DEFAULT_INITIAL_TABLE_SIZE;
    private HashFunction primaryHash = HashFunctions.polynomial();
    private HashFunction secondaryHash = null;
    private double maxLoadFactor = DEFAULT_MAX_LOAD_FACTOR;
    private double growthFactor = DEFAULT_GROWTH_FACTOR;
    private DeletionPolicy deletionPolicy = DEFAULT_DELETION_POLICY;
    private int maxKeyLength = DEFAULT_MAX_KEY_LENGTH;
    private Consumer<? super V> releaser = null;

    private Builder() {}

    public Builder<V> initialTableSize(int initialTableSize) {
      this.initialTableSize = initialTableSize;
      return this;
    }

    public Builder<V> primaryHash(HashFunction primaryHash) {
      this.primaryHash = primaryHash;
      return this;
    }

    /** Enables double hashing. Pass null for linear probing. */
    public Builder<V> secondaryHash(HashFunction secondaryHash) {
      this.secondaryHash = secondaryHash;
      return this;
    }

    public Builder<V> maxLoadFactor(double maxLoadFactor) {
      this.maxLoadFactor = maxLoadFactor;
      return this;
    }

    public Builder<V> growthFactor(double growthFactor) {
      this.growthFactor = growthFactor;
      return this;
    }

    public Builder<V> deletionPolicy(DeletionPolicy deletionPolicy) {
      this.deletionPolicy = deletionPolicy;
      return this;
    }

    public Builder<V> maxKeyLength(int maxKeyLength) {
      this.maxKeyLength = maxKeyLength;
      return this;
    }

    /** Called with each value the table discards: on remove, overwrite, clear and close. */
    public Builder<V> releaser(Consumer<? super V> releaser) {
      this.releaser = releaser;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     * @throws NullPointerException if the primary hash or deletion policy is null
     */
    public TableConfig<V> build() {
      if (this.initialTableSize < 0) {
        throw new IllegalArgumentException("expected non-negative initialTableSize");
      }
      if (this.initialTableSize > Primes.MAX_PRIME) {
        throw new IllegalArgumentException("initialTableSize too large");
      }
      Objects.requireNonNull(this.primaryHash, "primaryHash");
      Objects.requireNonNull(this.deletionPolicy, "deletionPolicy");
      // negated comparisons so NaN is rejected too
      if (!(this.maxLoadFactor > 0.0 && this.maxLoadFactor <= 1.0)) {
        throw new IllegalArgumentException("expected maxLoadFactor in (0, 1], got " + this.maxLoadFactor);
      }
      if (!(this.growthFactor > 1.0) || Double.isInfinite(this.growthFactor)) {
        throw new IllegalArgumentException("expected finite growthFactor > 1, got " + this.growthFactor);
      }
      if (this.maxKeyLength < 1) {
        throw new IllegalArgumentException("expected positive maxKeyLength");
      }
      return new TableConfig<>(this);
    }
  }
}
