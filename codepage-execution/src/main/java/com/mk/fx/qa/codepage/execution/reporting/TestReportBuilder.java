package com.mk.fx.qa.codepage.execution.reporting;

import com.mk.fx.qa.codepage.execution.mockapi.ApiCallRecord;
import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionError;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.model.ExecutionStatus;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToLongFunction;

final class TestReportBuilder {

  static final long SLOW_P95_EXECUTION_MS = 10_000;
  static final long HIGH_P95_MEMORY_BYTES = 100L * 1024 * 1024;
  static final long SLOW_API_AVERAGE_MS = 1_000;
  static final long HIGH_AVERAGE_MEMORY_BYTES = 50L * 1024 * 1024;
  static final long SLOW_AVERAGE_EXECUTION_MS = 5_000;
  static final long HIGH_API_LATENCY_MS = 500;
  static final int MESSAGE_KEY_LENGTH = 100;
  static final int TOP_COMMON_ERRORS = 10;
  static final int TOP_CRITICAL_ERRORS = 5;
  static final int TOP_SLOW_CALLS = 5;

  private final int detailedResultsIncluded;

  TestReportBuilder(int detailedResultsIncluded) {
    this.detailedResultsIncluded = detailedResultsIncluded;
  }

  /**
   * Builds a report over a non-empty list of results, oldest first.
   *
   * <p>Recommendations are derived from the full analysis even when the options leave the
   * performance or error sections empty.
   */
  TestReport build(
      String reportId,
      ResultKey key,
      List<ExecutionResult> results,
      ReportOptions options,
      Instant generatedAt) {
    if (results.isEmpty()) {
      throw new IllegalArgumentException("Cannot build a report without results");
    }
    var r = new TestReport();

    r.id = reportId;
    r.projectId = key.projectId();
    r.versionId = key.versionId();
    r.detailLevel = options.detailLevel();
    r.generatedAt = generatedAt;
    r.testResults = embeddedResults(results, options.detailLevel());

    var summary = summarize(results);
    var performance = analysePerformance(results);
    var errors = analyseErrors(results);

    r.summary = summary;
    r.performanceAnalysis =
        options.includePerformanceAnalysis() ? performance : TestReport.PerformanceAnalysis.empty();
    r.errorAnalysis = options.includeErrorAnalysis() ? errors : TestReport.ErrorAnalysis.empty();
    r.recommendations =
        options.includeRecommendations()
            ? recommend(summary, performance, errors)
            : List.of();
    return r;
  }

  private List<ExecutionResult> embeddedResults(List<ExecutionResult> results, DetailLevel level) {
    return switch (level) {
      case BASIC -> List.of();
      case DETAILED -> List.copyOf(
          results.subList(Math.max(0, results.size() - detailedResultsIncluded), results.size()));
      case COMPREHENSIVE -> List.copyOf(results);
    };
  }

  // summary

  TestReport.Summary summarize(List<ExecutionResult> results) {
    var s = new TestReport.Summary();
    s.totalTests = results.size();
    s.passedTests = countStatus(results, ExecutionStatus.PASSED);
    s.failedTests = countStatus(results, ExecutionStatus.FAILED);
    s.errorTests = countStatus(results, ExecutionStatus.ERROR);
    s.successRate = s.totalTests == 0 ? 0.0 : (double) s.passedTests / s.totalTests;
    s.totalExecutionTimeMs = results.stream().mapToLong(ExecutionResult::executionTimeMs).sum();
    s.averageExecutionTimeMs = roundedMean(results, ExecutionResult::executionTimeMs);
    s.averageMemoryUsage = roundedMean(results, ExecutionResult::peakMemoryBytes);
    s.totalApiCalls = results.stream().mapToLong(ExecutionResult::apiCallCount).sum();
    return s;
  }

  private static int countStatus(List<ExecutionResult> results, ExecutionStatus status) {
    return (int) results.stream().filter(r -> r.status() == status).count();
  }

  // performance

  TestReport.PerformanceAnalysis analysePerformance(List<ExecutionResult> results) {
    var p = new TestReport.PerformanceAnalysis();
    p.executionTimeDistribution = distribution(results, ExecutionResult::executionTimeMs);
    p.memoryUsageDistribution = distribution(results, ExecutionResult::peakMemoryBytes);

    var api = new TestReport.ApiPerformance();
    api.totalCalls = results.stream().mapToLong(ExecutionResult::apiCallCount).sum();
    var weightedLatency =
        results.stream()
            .mapToDouble(
                r -> r.performanceMetrics().avgApiResponseTimeMs() * r.apiCallCount())
            .sum();
    api.averageResponseTimeMs =
        api.totalCalls == 0 ? 0L : Math.round(weightedLatency / api.totalCalls);
    api.slowestCalls = slowestCalls(results);
    p.apiPerformance = api;

    List<String> issues = new ArrayList<>();
    if (p.executionTimeDistribution.p95 > SLOW_P95_EXECUTION_MS) {
      issues.add("95th percentile execution time exceeds 10 seconds");
    }
    if (p.memoryUsageDistribution.p95 > HIGH_P95_MEMORY_BYTES) {
      issues.add("95th percentile memory usage exceeds 100MB");
    }
    if (api.averageResponseTimeMs > SLOW_API_AVERAGE_MS) {
      issues.add("Average API response time exceeds 1 second");
    }
    p.performanceIssues = List.copyOf(issues);
    return p;
  }

  private static TestReport.Distribution distribution(
      List<ExecutionResult> results, ToLongFunction<ExecutionResult> metric) {
    long[] values = results.stream().mapToLong(metric).toArray();
    var d = new TestReport.Distribution();
    if (values.length == 0) {
      return d;
    }
    d.min = Arrays.stream(values).min().orElse(0L);
    d.max = Arrays.stream(values).max().orElse(0L);
    d.average = Math.round(Arrays.stream(values).average().orElse(0.0));
    d.median = Math.round(Percentiles.median(values));
    d.p95 = Percentiles.nearestRank(values, 95);
    return d;
  }

  private static List<TestReport.SlowCall> slowestCalls(List<ExecutionResult> results) {
    record Call(String executionId, ApiCallRecord call) {}
    return results.stream()
        .flatMap(r -> r.apiCalls().stream().map(c -> new Call(r.id(), c)))
        .sorted(Comparator.comparingLong((Call c) -> c.call().durationMs()).reversed())
        .limit(TOP_SLOW_CALLS)
        .map(
            c -> {
              var slow = new TestReport.SlowCall();
              slow.executionId = c.executionId();
              slow.method = c.call().method();
              slow.responseTimeMs = c.call().durationMs();
              slow.timestamp = c.call().timestamp();
              return slow;
            })
        .toList();
  }

  // errors

  TestReport.ErrorAnalysis analyseErrors(List<ExecutionResult> results) {
    Map<ErrorKind, Long> byKind = new EnumMap<>(ErrorKind.class);
    Map<String, TestReport.CommonError> byMessage = new LinkedHashMap<>();
    List<ExecutionError> critical = new ArrayList<>();

    for (ExecutionResult result : results) {
      for (ExecutionError error : result.errors()) {
        byKind.merge(error.kind(), 1L, Long::sum);

        var messageKey = truncate(error.message());
        var common =
            byMessage.computeIfAbsent(
                messageKey,
                m -> {
                  var c = new TestReport.CommonError();
                  c.message = m;
                  c.affectedTests = new ArrayList<>();
                  return c;
                });
        common.count++;
        common.affectedTests.add(result.id());

        if (error.isCritical() && critical.size() < TOP_CRITICAL_ERRORS) {
          critical.add(error);
        }
      }
    }

    var e = new TestReport.ErrorAnalysis();
    Map<String, Long> labelled = new LinkedHashMap<>();
    byKind.forEach((kind, count) -> labelled.put(kind.label(), count));
    e.errorsByKind = labelled;
    e.commonErrors =
        byMessage.values().stream()
            .sorted(Comparator.comparingLong((TestReport.CommonError c) -> c.count).reversed())
            .limit(TOP_COMMON_ERRORS)
            .toList();
    e.errorTrends = hourlyTrend(results);
    e.criticalErrors = List.copyOf(critical);
    return e;
  }

  private static List<TestReport.ErrorTrend> hourlyTrend(List<ExecutionResult> results) {
    Map<Instant, long[]> buckets = new TreeMap<>();
    for (ExecutionResult result : results) {
      var hour = result.createdAt().truncatedTo(ChronoUnit.HOURS);
      var counts = buckets.computeIfAbsent(hour, h -> new long[2]);
      counts[0]++;
      if (result.hasErrors()) {
        counts[1]++;
      }
    }
    List<TestReport.ErrorTrend> trend = new ArrayList<>();
    buckets.forEach(
        (hour, counts) -> {
          var t = new TestReport.ErrorTrend();
          t.hourStart = hour;
          t.errorCount = counts[1];
          t.errorRate = counts[0] == 0 ? 0.0 : (double) counts[1] / counts[0];
          trend.add(t);
        });
    return List.copyOf(trend);
  }

  private static String truncate(String message) {
    var text = message == null ? "" : message;
    return text.length() <= MESSAGE_KEY_LENGTH ? text : text.substring(0, MESSAGE_KEY_LENGTH);
  }

  // recommendations

  List<String> recommend(
      TestReport.Summary summary,
      TestReport.PerformanceAnalysis performance,
      TestReport.ErrorAnalysis errors) {
    List<String> out = new ArrayList<>();

    if (summary.successRate < 0.8) {
      out.add(
          "Test success rate is below 80%. Review and fix failing tests to improve reliability.");
    } else if (summary.successRate < 0.95) {
      out.add(
          "Test success rate could be improved. Consider investigating intermittent failures.");
    }

    if (performance.executionTimeDistribution.average > SLOW_AVERAGE_EXECUTION_MS) {
      out.add(
          "Average execution time exceeds 5 seconds. Consider optimizing codepage logic or"
              + " reducing API calls.");
    }

    if (performance.memoryUsageDistribution.average > HIGH_AVERAGE_MEMORY_BYTES
        || performance.memoryUsageDistribution.p95 > HIGH_P95_MEMORY_BYTES) {
      out.add(
          "Memory usage is high. Review memory-intensive operations and consider optimization.");
    }

    if (performance.apiPerformance.averageResponseTimeMs > HIGH_API_LATENCY_MS) {
      out.add(
          "API response times are high. Consider caching frequently accessed data or optimizing"
              + " queries.");
    }

    if (!errors.criticalErrors.isEmpty()) {
      out.add(
          "Critical errors detected. Prioritize fixing ReferenceError, TypeError, timeout and"
              + " memory issues.");
    }

    if (!errors.commonErrors.isEmpty()
        && errors.commonErrors.get(0).count > summary.totalTests * 0.1) {
      var top = errors.commonErrors.get(0);
      out.add(
          "Most common error affects "
              + top.count
              + " tests. Focus on resolving: \""
              + top.message
              + "\"");
    }

    if (summary.totalApiCalls > summary.totalTests * 20L) {
      out.add(
          "High API call volume detected. Consider batching operations or implementing caching.");
    }

    if (summary.totalTests < 10) {
      out.add(
          "Consider adding more comprehensive test cases to improve coverage and reliability.");
    }
    return List.copyOf(out);
  }

  private static long roundedMean(
      List<ExecutionResult> results, ToLongFunction<ExecutionResult> metric) {
    return Math.round(results.stream().mapToLong(metric).average().orElse(0.0));
  }
}
