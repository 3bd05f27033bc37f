package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AlertSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Grades how far the trigger value is from the threshold, relative to the threshold: at least 2
   * is critical, at least 1 high, at least 0.5 medium, anything else low. A zero threshold has no
   * scale, so any non-zero trigger value is critical.
   */
  public static AlertSeverity of(double triggerValue, double threshold) {
    if (threshold == 0) {
      return triggerValue == 0 ? LOW : CRITICAL;
    }
    var ratio = Math.abs(triggerValue - threshold) / Math.abs(threshold);
    if (ratio >= 2) {
      return CRITICAL;
    }
    if (ratio >= 1) {
      return HIGH;
    }
    if (ratio >= 0.5) {
      return MEDIUM;
    }
    return LOW;
  }

  public AlertSeverity max(AlertSeverity other) {
    return other != null && other.ordinal() > ordinal() ? other : this;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static AlertSeverity fromValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported severity: " + value));
  }
}
