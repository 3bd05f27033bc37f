package com.mk.fx.qa.codepage.execution.mockapi;

import lombok.Getter;

/** Raised when a script issues more mock API calls than its execution allows. */
@Getter
public class ApiCallLimitExceededException extends RuntimeException {

  private final int limit;
  private final ApiOperation operation;

  public ApiCallLimitExceededException(int limit, ApiOperation operation) {
    super("API call limit exceeded (" + limit + ")");
    this.limit = limit;
    this.operation = operation;
  }
}
