package com.mk.fx.qa.codepage.execution.reporting;

import com.google.common.collect.EvictingQueue;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded ring of recent results per {@link ResultKey}; when a ring is full the oldest result is
 * dropped.
 *
 * <p>Each ring is guarded by its own monitor, so writers for different project versions never
 * contend.
 */
class ResultHistory {

  private final int capacity;
  private final Map<ResultKey, EvictingQueue<ExecutionResult>> rings = new ConcurrentHashMap<>();

  ResultHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity must be > 0");
    }
    this.capacity = capacity;
  }

  ResultKey add(ExecutionResult result) {
    var key = new ResultKey(result.projectId(), result.versionId());
    var ring = rings.computeIfAbsent(key, k -> EvictingQueue.create(capacity));
    synchronized (ring) {
      ring.add(result);
    }
    return key;
  }

  /** Oldest first. */
  List<ExecutionResult> snapshot(ResultKey key) {
    var ring = rings.get(key);
    if (ring == null) {
      return List.of();
    }
    synchronized (ring) {
      return List.copyOf(ring);
    }
  }

  /** Removes results created before the cutoff and returns how many were removed. */
  int removeCreatedBefore(Instant cutoff) {
    var removed = 0;
    for (var ring : rings.values()) {
      synchronized (ring) {
        var before = ring.size();
        ring.removeIf(r -> r.createdAt().isBefore(cutoff));
        removed += before - ring.size();
      }
    }
    return removed;
  }

  int keyCount() {
    return (int) rings.values().stream().filter(ring -> !snapshotOf(ring).isEmpty()).count();
  }

  int totalResults() {
    return rings.values().stream().mapToInt(ring -> snapshotOf(ring).size()).sum();
  }

  Optional<Instant> oldest() {
    return rings.values().stream()
        .flatMap(ring -> snapshotOf(ring).stream())
        .map(ExecutionResult::createdAt)
        .min(Instant::compareTo);
  }

  Optional<Instant> newest() {
    return rings.values().stream()
        .flatMap(ring -> snapshotOf(ring).stream())
        .map(ExecutionResult::createdAt)
        .max(Instant::compareTo);
  }

  private static List<ExecutionResult> snapshotOf(EvictingQueue<ExecutionResult> ring) {
    synchronized (ring) {
      return List.copyOf(ring);
    }
  }
}
