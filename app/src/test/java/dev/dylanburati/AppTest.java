package dev.dylanburati;

import dev.dylanburati.oahash.DeletionPolicy;
import dev.dylanburati.oahash.HashFunctions;
import dev.dylanburati.oahash.OAHashTable;
import dev.dylanburati.oahash.TableConfig;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {
  @ParameterizedTest
  @EnumSource(DeletionPolicy.class)
  void testWordcountMatchesReference(DeletionPolicy policy) {
    OAHashTable<Integer> table = new OAHashTable<>(TableConfig.<Integer>builder()
      .initialTableSize(7)
      .primaryHash(HashFunctions.pjw())
      .secondaryHash(HashFunctions.rs())
      .deletionPolicy(policy)
      .maxKeyLength(32)
      .build());
    Object2IntOpenHashMap<String> reference = new Object2IntOpenHashMap<>();
    App.wordcount(table, reference, 5_000);
    assertFalse(reference.isEmpty());
    assertEquals(0, App.verify(table, reference));
    assertTrue(table.stats().getExpansions() > 0);
  }
}
