package com.mk.fx.qa.codepage.execution.model;

import com.mk.fx.qa.codepage.execution.mockapi.ApiCallRecord;
import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one sandboxed execution. Produced exactly once per run.
 *
 * <p>{@code status == PASSED} always comes with an empty error list; {@code FAILED}/{@code ERROR}
 * always with at least one error. {@code apiCallCount} equals {@code apiCalls.size()}.
 */
public record ExecutionResult(
    String id,
    String projectId,
    String versionId,
    ExecutionEnvironment environment,
    ExecutionStatus status,
    long executionTimeMs,
    long peakMemoryBytes,
    int apiCallCount,
    List<ExecutionError> errors,
    PerformanceMetrics performanceMetrics,
    List<String> logs,
    List<ApiCallRecord> apiCalls,
    Instant createdAt,
    Instant completedAt) {

  public ExecutionResult {
    errors = List.copyOf(errors);
    logs = List.copyOf(logs);
    apiCalls = List.copyOf(apiCalls);
    if (status == ExecutionStatus.PASSED && !errors.isEmpty()) {
      throw new IllegalArgumentException("A passed execution cannot carry errors");
    }
    if (status != ExecutionStatus.PASSED && errors.isEmpty()) {
      throw new IllegalArgumentException("A " + status.value() + " execution needs an error");
    }
  }

  /** True when the run ended in error or carries any error. */
  public boolean hasErrors() {
    return status == ExecutionStatus.ERROR || !errors.isEmpty();
  }
}
