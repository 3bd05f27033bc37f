package com.mk.fx.qa.codepage.execution.monitoring.alert;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Operator-defined condition over a named metric, evaluated on a rolling window of {@code
 * windowMinutes}. Immutable; updates produce a new instance.
 */
@Builder(toBuilder = true)
public record AlertRule(
    String id,
    String name,
    AlertRuleType type,
    String metricName,
    AlertCondition condition,
    double threshold,
    int windowMinutes,
    boolean active,
    List<String> channels,
    Instant createdAt,
    Instant updatedAt) {

  public static final int MIN_WINDOW_MINUTES = 1;
  public static final int MAX_WINDOW_MINUTES = 1440;

  public AlertRule {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }
}
