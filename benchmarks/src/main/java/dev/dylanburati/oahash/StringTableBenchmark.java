package dev.dylanburati.oahash;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Insert, look up and remove a fixed key set. The {@code OAHashTable} runs cover
 * both deletion policies with and without a secondary hash; HashMap and fastutil
 * are the baselines.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
public class StringTableBenchmark {
  // packDouble removals scan the whole table, so sizes stay moderate
  @Param({"1000", "20000"})
  public int keyCount;

  @Param({"0.5", "0.9"})
  public double maxLoadFactor;

  private List<String> keys;

  @Setup(Level.Trial)
  public void setUp() {
    // keys stay within the default 31-byte limit
    Random r = new Random(0L);
    this.keys = new ArrayList<>(this.keyCount);
    for (int i = 0; i < this.keyCount; i++) {
      this.keys.add(Long.toString(r.nextLong() & Long.MAX_VALUE, 36) + i);
    }
  }

  @Benchmark
  public void markLinear(Blackhole bh) {
    bh.consume(this.churn(DeletionPolicy.MARK, null));
  }

  @Benchmark
  public void markDouble(Blackhole bh) {
    bh.consume(this.churn(DeletionPolicy.MARK, HashFunctions.pjw()));
  }

  @Benchmark
  public void packLinear(Blackhole bh) {
    bh.consume(this.churn(DeletionPolicy.PACK, null));
  }

  @Benchmark
  public void packDouble(Blackhole bh) {
    bh.consume(this.churn(DeletionPolicy.PACK, HashFunctions.pjw()));
  }

  @Benchmark
  public void hashMap(Blackhole bh) {
    Map<String, Integer> m = new HashMap<>();
    for (int i = 0; i < this.keys.size(); i++) {
      m.put(this.keys.get(i), i);
    }
    long sum = 0;
    for (String k : this.keys) {
      sum += m.get(k);
    }
    for (int i = 0; i < this.keys.size(); i += 2) {
      m.remove(this.keys.get(i));
    }
    bh.consume(sum + m.size());
  }

  @Benchmark
  public void object2IntMap(Blackhole bh) {
    Object2IntOpenHashMap<String> m = new Object2IntOpenHashMap<>();
    for (int i = 0; i < this.keys.size(); i++) {
      m.put(this.keys.get(i), i);
    }
    long sum = 0;
    for (String k : this.keys) {
      sum += m.getInt(k);
    }
    for (int i = 0; i < this.keys.size(); i += 2) {
      m.removeInt(this.keys.get(i));
    }
    bh.consume(sum + m.size());
  }

  private long churn(DeletionPolicy policy, HashFunction secondary) {
    OAHashTable<Integer> t = new OAHashTable<>(TableConfig.<Integer>builder()
      .primaryHash(HashFunctions.universal())
      .secondaryHash(secondary)
      .maxLoadFactor(this.maxLoadFactor)
      .deletionPolicy(policy)
      .build());
    for (int i = 0; i < this.keys.size(); i++) {
      t.insert(this.keys.get(i), i);
    }
    long sum = 0;
    for (String k : this.keys) {
      sum += t.find(k);
    }
    // half the keys removed, then looked up again through any tombstones
    for (int i = 0; i < this.keys.size(); i += 2) {
      t.remove(this.keys.get(i));
    }
    for (int i = 1; i < this.keys.size(); i += 2) {
      sum += t.find(this.keys.get(i));
    }
    return sum + t.stats().getProbes();
  }
}
