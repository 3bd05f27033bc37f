package com.mk.fx.qa.codepage.execution.model;

import java.util.Objects;

/**
 * Immutable limits applied to one execution.
 *
 * @param timeoutMs wall-clock ceiling for the run including pending continuations
 * @param memoryLimitBytes ceiling for sampled memory
 * @param apiCallLimit maximum number of mock API calls
 * @param environment environment the codepage is tested for
 */
public record ExecutionConfig(
    long timeoutMs, long memoryLimitBytes, int apiCallLimit, ExecutionEnvironment environment) {

  public static final long MAX_TIMEOUT_MS = 300_000;

  public ExecutionConfig {
    Objects.requireNonNull(environment, "environment");
    if (timeoutMs <= 0 || timeoutMs > MAX_TIMEOUT_MS) {
      throw new IllegalArgumentException(
          "timeoutMs must be between 1 and " + MAX_TIMEOUT_MS + " but was " + timeoutMs);
    }
    if (memoryLimitBytes <= 0) {
      throw new IllegalArgumentException("memoryLimitBytes must be > 0");
    }
    if (apiCallLimit < 0) {
      throw new IllegalArgumentException("apiCallLimit must be >= 0");
    }
  }

  /** Returns a config where every non-null override replaces the corresponding value. */
  public ExecutionConfig merge(ExecutionConfigOverrides overrides) {
    if (overrides == null) {
      return this;
    }
    return new ExecutionConfig(
        overrides.getTimeoutMs() != null ? overrides.getTimeoutMs() : timeoutMs,
        overrides.getMemoryLimitBytes() != null ? overrides.getMemoryLimitBytes() : memoryLimitBytes,
        overrides.getApiCallLimit() != null ? overrides.getApiCallLimit() : apiCallLimit,
        overrides.getEnvironment() != null ? overrides.getEnvironment() : environment);
  }
}
