package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import java.time.Instant;
import java.util.List;

/** Source of the recent metrics a rule is evaluated against. */
@FunctionalInterface
public interface MetricWindow {

  /** Metrics with the given name and a timestamp at or after {@code since}, newest first. */
  List<Metric> recent(String metricName, Instant since);
}
