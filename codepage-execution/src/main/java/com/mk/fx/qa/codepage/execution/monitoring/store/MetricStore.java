package com.mk.fx.qa.codepage.execution.monitoring.store;

import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import java.time.Instant;
import java.util.List;

/** Retained window of flushed metrics. */
public interface MetricStore {

  /**
   * Stores a batch; either every metric of the batch is stored or none is.
   *
   * @throws MetricStoreException if the store is unavailable
   */
  void append(List<Metric> batch);

  /** Removes metrics with a timestamp before the cutoff and returns how many were removed. */
  int pruneOlderThan(Instant cutoff);

  List<Metric> snapshot();

  int size();
}
