package com.mk.fx.qa.codepage.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal status of a sandboxed execution. */
public enum ExecutionStatus {
  PASSED,
  FAILED,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
