package com.mk.fx.qa.codepage.execution.reporting;

import com.mk.fx.qa.codepage.execution.model.ExecutionError;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over the recent results of one project version. Derived data: it can be regenerated
 * at any time from the result history.
 */
public class TestReport {

  public String id;
  public String projectId;
  public String versionId;
  public DetailLevel detailLevel;
  public Instant generatedAt;

  public List<ExecutionResult> testResults;
  public Summary summary;
  public PerformanceAnalysis performanceAnalysis;
  public ErrorAnalysis errorAnalysis;
  public List<String> recommendations;

  public static class Summary {
    public int totalTests;
    public int passedTests;
    public int failedTests;
    public int errorTests;
    /** Fraction of passed runs, 0..1. */
    public double successRate;
    public long averageExecutionTimeMs;
    public long totalExecutionTimeMs;
    public long averageMemoryUsage;
    public long totalApiCalls;
  }

  public static class PerformanceAnalysis {
    public Distribution executionTimeDistribution;
    public Distribution memoryUsageDistribution;
    public ApiPerformance apiPerformance;
    public List<String> performanceIssues;

    static PerformanceAnalysis empty() {
      var p = new PerformanceAnalysis();
      p.executionTimeDistribution = new Distribution();
      p.memoryUsageDistribution = new Distribution();
      p.apiPerformance = new ApiPerformance();
      p.apiPerformance.slowestCalls = List.of();
      p.performanceIssues = List.of();
      return p;
    }
  }

  public static class Distribution {
    public long min;
    public long max;
    public long average;
    public long median;
    public long p95;
  }

  public static class ApiPerformance {
    public long totalCalls;
    public long averageResponseTimeMs;
    public List<SlowCall> slowestCalls;
  }

  public static class SlowCall {
    public String executionId;
    public String method;
    public long responseTimeMs;
    public Instant timestamp;
  }

  public static class ErrorAnalysis {
    /** Error count per kind label. */
    public Map<String, Long> errorsByKind;
    public List<CommonError> commonErrors;
    public List<ErrorTrend> errorTrends;
    public List<ExecutionError> criticalErrors;

    static ErrorAnalysis empty() {
      var e = new ErrorAnalysis();
      e.errorsByKind = Map.of();
      e.commonErrors = List.of();
      e.errorTrends = List.of();
      e.criticalErrors = List.of();
      return e;
    }
  }

  public static class CommonError {
    public String message;
    public long count;
    public List<String> affectedTests;
  }

  public static class ErrorTrend {
    public Instant hourStart;
    public long errorCount;
    /** Fraction of runs in the hour that ended in error, 0..1. */
    public double errorRate;
  }
}
