package com.mk.fx.qa.codepage.execution.model;

/**
 * Per-run performance figures computed when the result is built.
 *
 * @param executionTimeMs wall-clock duration of the run
 * @param memoryUsage peak sampled memory in bytes, 0 when nothing was sampled
 * @param apiCallCount completed mock API calls
 * @param avgApiResponseTimeMs mean call duration, 0 when no calls were made
 */
public record PerformanceMetrics(
    long executionTimeMs, long memoryUsage, int apiCallCount, double avgApiResponseTimeMs) {}
