package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AlertCondition {
  GT("gt", "greater_than"),
  LT("lt", "less_than"),
  EQ("eq", "equals"),
  NEQ("neq", "not_equals");

  /** Values closer than this compare as equal. */
  static final double EPSILON = 0.001;

  private final String value;
  private final String longName;

  AlertCondition(String value, String longName) {
    this.value = value;
    this.longName = longName;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean test(double triggerValue, double threshold) {
    return switch (this) {
      case GT -> triggerValue > threshold;
      case LT -> triggerValue < threshold;
      case EQ -> Math.abs(triggerValue - threshold) < EPSILON;
      case NEQ -> Math.abs(triggerValue - threshold) >= EPSILON;
    };
  }

  @JsonCreator
  public static AlertCondition fromValue(String value) {
    return Arrays.stream(values())
        .filter(c -> c.value.equalsIgnoreCase(value) || c.longName.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported condition: " + value));
  }
}
