package com.mk.fx.qa.codepage.execution.store;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  private final InMemoryKeyValueStore<String, Integer> store = new InMemoryKeyValueStore<>();

  @Test
  void put_replacesExistingValue() {
    store.put("a", 1);
    store.put("a", 2);

    assertEquals(2, store.get("a").orElseThrow());
    assertEquals(1, store.size());
    assertTrue(store.get("missing").isEmpty());
  }

  @Test
  void put_rejectsNulls() {
    assertThrows(NullPointerException.class, () -> store.put(null, 1));
    assertThrows(NullPointerException.class, () -> store.put("a", null));
  }

  @Test
  void list_filtersAndSnapshots() {
    store.put("a", 1);
    store.put("b", 2);
    store.put("c", 3);

    var all = store.list();
    store.put("d", 4);

    assertEquals(Set.of(1, 2, 3), new HashSet<>(all));
    assertEquals(Set.of(2, 4), new HashSet<>(store.list(v -> v % 2 == 0)));
  }

  @Test
  void delete_reportsWhetherKeyExisted() {
    store.put("a", 1);

    assertTrue(store.delete("a"));
    assertFalse(store.delete("a"));
  }

  @Test
  void deleteIf_countsRemoved() {
    for (int i = 0; i < 10; i++) {
      store.put("k" + i, i);
    }

    assertEquals(5, store.deleteIf(v -> v < 5));
    assertEquals(5, store.size());
    assertTrue(store.list().stream().allMatch(v -> v >= 5));
  }
}
