package com.mk.fx.qa.codepage.execution.store;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/** Process-local {@link KeyValueStore}; contents are lost on restart. */
public class InMemoryKeyValueStore<K, V> implements KeyValueStore<K, V> {

  private final Map<K, V> values = new ConcurrentHashMap<>();

  @Override
  public Optional<V> get(K key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(K key, V value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  @Override
  public List<V> list() {
    return List.copyOf(values.values());
  }

  @Override
  public List<V> list(Predicate<? super V> filter) {
    return values.values().stream().filter(filter).toList();
  }

  @Override
  public boolean delete(K key) {
    return values.remove(key) != null;
  }

  @Override
  public int deleteIf(Predicate<? super V> filter) {
    var removed = new AtomicInteger();
    values
        .values()
        .removeIf(
            value -> {
              if (filter.test(value)) {
                removed.incrementAndGet();
                return true;
              }
              return false;
            });
    return removed.get();
  }

  @Override
  public int size() {
    return values.size();
  }
}
