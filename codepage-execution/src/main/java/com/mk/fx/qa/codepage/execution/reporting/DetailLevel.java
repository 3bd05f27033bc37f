package com.mk.fx.qa.codepage.execution.reporting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** How many of the underlying results a report embeds. */
public enum DetailLevel {
  BASIC,
  DETAILED,
  COMPREHENSIVE;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static DetailLevel fromValue(String value) {
    return Arrays.stream(values())
        .filter(level -> level.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported detail level: " + value));
  }
}
