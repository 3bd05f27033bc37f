package com.mk.fx.qa.codepage.execution.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keyed storage used by the services instead of ad hoc shared maps. The in-memory implementation
 * is the only one shipped; a durable one can replace it behind the same methods.
 */
public interface KeyValueStore<K, V> {

  Optional<V> get(K key);

  void put(K key, V value);

  List<V> list();

  List<V> list(Predicate<? super V> filter);

  boolean delete(K key);

  /** Removes every value matching the filter and returns how many were removed. */
  int deleteIf(Predicate<? super V> filter);

  int size();
}
