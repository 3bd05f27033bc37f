package com.mk.fx.qa.codepage.execution.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable telemetry sample.
 *
 * @param metadata free-form labels; may hold null values, never null itself
 */
public record Metric(
    String id,
    MetricKind kind,
    String name,
    double value,
    String unit,
    Instant timestamp,
    Map<String, Object> metadata) {

  public Metric {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(timestamp, "timestamp");
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
