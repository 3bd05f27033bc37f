package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AlertRuleType {
  /** Compares the raw value of the triggering metric. */
  THRESHOLD,
  /** Compares the deviation score of the triggering metric against the rest of the window. */
  ANOMALY,
  /** Compares the share of error-like metrics in the window. */
  ERROR_RATE;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static AlertRuleType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported rule type: " + value));
  }
}
