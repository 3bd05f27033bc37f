package com.mk.fx.qa.codepage.execution.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
  HEALTHY,
  WARNING,
  CRITICAL;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
