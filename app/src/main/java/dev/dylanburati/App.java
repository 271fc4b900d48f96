package dev.dylanburati;

import dev.dylanburati.oahash.DeletionPolicy;
import dev.dylanburati.oahash.HashFunctions;
import dev.dylanburati.oahash.OAHashTable;
import dev.dylanburati.oahash.TableConfig;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a simulated word count through an {@link OAHashTable}, checks the result
 * against fastutil, and prints the table statistics.
 *
 * Usage: {@code App [pack|mark] [primaryHash] [secondaryHash|-] [words]}
 */
public class App {
  private static final Logger logger = LoggerFactory.getLogger(App.class);
  private static final int MAX_WORD_LEN = 32;

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01, similar to English.
    // Inverse of the cdf, with the maximum of x set to 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return i >= 0 ? i : -i - 1;
  }

  /**
   * Counts {@code words} generated words in both maps. Every eighth word also removes
   * a word seen earlier, so deletions are exercised alongside growth.
   */
  public static void wordcount(OAHashTable<Integer> table, Object2IntOpenHashMap<String> reference, int words) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[MAX_WORD_LEN];
    Random r = new Random(0L);
    String last = null;
    for (int i = 0; i < words; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      String word = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
      int count = table.contains(word) ? table.find(word) : 0;
      table.insert(word, count + 1);
      reference.addTo(word, 1);

      if (i % 8 == 7 && last != null && table.contains(last)) {
        table.remove(last);
        reference.removeInt(last);
      }
      last = word;
    }
  }

  /** Returns the number of keys whose count differs between the two maps. */
  public static int verify(OAHashTable<Integer> table, Object2IntMap<String> reference) {
    int mismatches = 0;
    if (table.size() != reference.size()) {
      logger.error("Size mismatch: table has {}, reference has {}", table.size(), reference.size());
      mismatches++;
    }
    for (Object2IntMap.Entry<String> e : reference.object2IntEntrySet()) {
      if (!table.contains(e.getKey()) || table.find(e.getKey()) != e.getIntValue()) {
        logger.error("Count mismatch for {}", e.getKey());
        mismatches++;
      }
    }
    return mismatches;
  }

  public static void main(String[] args) {
    DeletionPolicy policy = DeletionPolicy.valueOf((args.length > 0 ? args[0] : "mark").toUpperCase(Locale.ROOT));
    String primary = args.length > 1 ? args[1] : "polynomial";
    String secondary = args.length > 2 ? args[2] : "-";
    int words = args.length > 3 ? Integer.parseInt(args[3]) : 1_000_000;

    TableConfig<Integer> config = TableConfig.<Integer>builder()
      .primaryHash(HashFunctions.byName(primary))
      .secondaryHash(secondary.equals("-") ? null : HashFunctions.byName(secondary))
      .deletionPolicy(policy)
      .maxKeyLength(MAX_WORD_LEN)
      .build();
    logger.info("Counting {} words with policy={}, primary={}, secondary={}", words, policy, primary, secondary);

    long start = System.nanoTime();
    int mismatches;
    try (OAHashTable<Integer> table = new OAHashTable<>(config)) {
      Object2IntOpenHashMap<String> reference = new Object2IntOpenHashMap<>();
      wordcount(table, reference, words);
      mismatches = verify(table, reference);
      System.out.println("Size: " + table.size());
      System.out.println(table.stats());
      System.out.format("Probes per word: %.3f%n", (double) table.stats().getProbes() / words);
    }
    System.out.format("Elapsed: %d ms%n", (System.nanoTime() - start) / 1_000_000);

    if (mismatches > 0) {
      logger.error("{} mismatches against the reference map", mismatches);
      System.exit(1);
    }
  }
}
