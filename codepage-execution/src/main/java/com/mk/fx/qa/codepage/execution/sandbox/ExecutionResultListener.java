package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.model.ExecutionResult;

/** Receives every result produced by the {@link ExecutionEngine}, after the run has ended. */
public interface ExecutionResultListener {

  void onResult(ExecutionResult result);
}
