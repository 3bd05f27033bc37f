package com.mk.fx.qa.codepage.execution.sandbox;

/**
 * Engine-wide counters.
 *
 * @param activeTests runs currently in flight
 * @param totalMockDataSets fixture data sets available to the mock API
 * @param averageExecutionTimeMs mean elapsed time of the runs in flight
 * @param averageMemoryUsage mean peak memory of the runs in flight
 * @param completedExecutions runs finished since start-up
 * @param pendingExecutions runs waiting for a worker
 */
public record ExecutionStats(
    int activeTests,
    int totalMockDataSets,
    double averageExecutionTimeMs,
    double averageMemoryUsage,
    long completedExecutions,
    int pendingExecutions) {}
