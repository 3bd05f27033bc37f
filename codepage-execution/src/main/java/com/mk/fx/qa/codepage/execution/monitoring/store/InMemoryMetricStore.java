package com.mk.fx.qa.codepage.execution.monitoring.store;

import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Process-local {@link MetricStore}; contents are lost on restart. */
public class InMemoryMetricStore implements MetricStore {

  private final List<Metric> metrics = new ArrayList<>();

  @Override
  public synchronized void append(List<Metric> batch) {
    metrics.addAll(batch);
  }

  @Override
  public synchronized int pruneOlderThan(Instant cutoff) {
    var before = metrics.size();
    metrics.removeIf(m -> m.timestamp().isBefore(cutoff));
    return before - metrics.size();
  }

  @Override
  public synchronized List<Metric> snapshot() {
    return List.copyOf(metrics);
  }

  @Override
  public synchronized int size() {
    return metrics.size();
  }
}
