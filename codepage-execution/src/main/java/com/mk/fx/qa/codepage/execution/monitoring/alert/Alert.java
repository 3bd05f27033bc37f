package com.mk.fx.qa.codepage.execution.monitoring.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fired rule. Immutable; state changes produce a new instance.
 *
 * @param occurrences how many evaluations fired while this alert was open
 * @param resolvedAt set exactly when {@code resolved} is true
 */
public record Alert(
    String id,
    String ruleId,
    String ruleName,
    AlertSeverity severity,
    String message,
    double triggerValue,
    double threshold,
    Map<String, Object> metadata,
    boolean resolved,
    Instant createdAt,
    Instant lastTriggeredAt,
    int occurrences,
    Instant resolvedAt) {

  public Alert {
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Another firing while open: new trigger value, merged metadata, severity never lowered. */
  Alert refire(
      double newTriggerValue,
      AlertSeverity newSeverity,
      String newMessage,
      Map<String, Object> extraMetadata,
      Instant at) {
    var merged = new LinkedHashMap<>(metadata);
    merged.putAll(extraMetadata);
    return new Alert(
        id,
        ruleId,
        ruleName,
        severity.max(newSeverity),
        newMessage,
        newTriggerValue,
        threshold,
        merged,
        false,
        createdAt,
        at,
        occurrences + 1,
        null);
  }

  Alert resolve(Instant at) {
    return new Alert(
        id,
        ruleId,
        ruleName,
        severity,
        message,
        triggerValue,
        threshold,
        metadata,
        true,
        createdAt,
        lastTriggeredAt,
        occurrences,
        at);
  }
}
