package com.mk.fx.qa.codepage.execution.monitoring;

import java.time.Instant;
import lombok.Builder;

/**
 * Selects metrics for {@link MetricsService#query}. Null fields do not filter.
 *
 * @param from inclusive lower bound on the timestamp
 * @param to inclusive upper bound on the timestamp
 * @param limit maximum number of metrics returned, {@value #DEFAULT_LIMIT} when not positive
 */
@Builder
public record MetricFilter(MetricKind kind, String name, Instant from, Instant to, int limit) {

  public static final int DEFAULT_LIMIT = 1000;

  public MetricFilter {
    limit = limit <= 0 ? DEFAULT_LIMIT : limit;
  }

  public static MetricFilter all() {
    return new MetricFilter(null, null, null, null, DEFAULT_LIMIT);
  }

  public boolean matches(Metric metric) {
    return (kind == null || metric.kind() == kind)
        && (name == null || metric.name().equals(name))
        && (from == null || !metric.timestamp().isBefore(from))
        && (to == null || !metric.timestamp().isAfter(to));
  }
}
