package com.mk.fx.qa.codepage.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum ExecutionEnvironment {
  DEVELOPMENT,
  STAGING,
  PRODUCTION;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static ExecutionEnvironment fromValue(String value) {
    return Arrays.stream(values())
        .filter(env -> env.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported environment: " + value));
  }
}
