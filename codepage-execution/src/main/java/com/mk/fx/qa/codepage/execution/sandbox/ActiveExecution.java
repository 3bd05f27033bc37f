package com.mk.fx.qa.codepage.execution.sandbox;

import java.time.Instant;

/** Read-only view of a run that has not produced its result yet. */
public record ActiveExecution(
    String testId,
    String projectId,
    String versionId,
    boolean started,
    Instant submittedAt,
    long elapsedMs,
    int apiCallCount,
    long peakMemoryBytes,
    int logLines) {

  static ActiveExecution of(ExecutionContext context) {
    var monitor = context.getMonitor();
    return new ActiveExecution(
        context.getTestId(),
        context.getProjectId(),
        context.getVersionId(),
        monitor.isStarted(),
        context.getCreatedAt(),
        monitor.elapsed().toMillis(),
        context.getApiCalls().size(),
        context.peakMemoryBytes(),
        context.getLogs().size());
  }
}
