package com.mk.fx.qa.codepage.execution.monitoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum MetricKind {
  EXECUTION("execution", "codepage_execution"),
  API_RESPONSE("api_response", "api_response"),
  SYSTEM_RESOURCE("system_resource", "system_resource");

  private final String value;
  private final String alias;

  MetricKind(String value, String alias) {
    this.value = value;
    this.alias = alias;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Accepts the kind value, its legacy alias or the enum name, case-insensitively. */
  @JsonCreator
  public static MetricKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(
            kind ->
                kind.value.equalsIgnoreCase(value)
                    || kind.alias.equalsIgnoreCase(value)
                    || kind.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported metric kind: " + value));
  }
}
