package com.mk.fx.qa.codepage.execution.monitoring;

import java.time.Instant;

/** Statistics over the metrics of a time window; all zero when the window is empty. */
public record MetricSummary(
    int totalMetrics,
    double averageValue,
    double minValue,
    double maxValue,
    Instant windowStart,
    Instant windowEnd) {}
