package com.mk.fx.qa.codepage.execution.reporting;

import static com.mk.fx.qa.codepage.execution.reporting.TestResults.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestReportBuilderTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:15:00Z");
  private static final ResultKey KEY = new ResultKey(PROJECT, VERSION);

  private final TestReportBuilder builder = new TestReportBuilder(2);

  private TestReport build(List<ExecutionResult> results, ReportOptions options) {
    return builder.build("report-1", KEY, results, options, T0.plusSeconds(3600));
  }

  @Test
  void build_rejectsEmptyResults() {
    assertThrows(
        IllegalArgumentException.class, () -> build(List.of(), ReportOptions.defaults()));
  }

  @Test
  void summary_countsStatusesAndRate() {
    var results =
        List.of(
            passed("r1", 100, 1_000, T0),
            passed("r2", 200, 2_000, T0),
            passed("r3", 300, 3_000, T0),
            error("r4", ErrorKind.TYPE_ERROR, "x is null", T0));

    var report = build(results, ReportOptions.defaults());

    assertEquals(4, report.summary.totalTests);
    assertEquals(3, report.summary.passedTests);
    assertEquals(1, report.summary.errorTests);
    assertEquals(0, report.summary.failedTests);
    assertEquals(0.75, report.summary.successRate, 1e-9);
    assertEquals(700, report.summary.totalExecutionTimeMs);
    assertEquals(175, report.summary.averageExecutionTimeMs);
  }

  @Test
  void performance_distributionAndWeightedApiLatency() {
    var results =
        List.of(
            passed("r1", 100, 1_000, T0, 100, 300),
            passed("r2", 200, 2_000, T0, 600),
            passed("r3", 300, 3_000, T0),
            passed("r4", 400, 4_000, T0));

    var perf = build(results, ReportOptions.defaults()).performanceAnalysis;

    assertEquals(100, perf.executionTimeDistribution.min);
    assertEquals(400, perf.executionTimeDistribution.max);
    assertEquals(250, perf.executionTimeDistribution.average);
    assertEquals(250, perf.executionTimeDistribution.median);
    assertEquals(400, perf.executionTimeDistribution.p95);
    assertEquals(3, perf.apiPerformance.totalCalls);
    assertEquals(333, perf.apiPerformance.averageResponseTimeMs);
    assertEquals(600, perf.apiPerformance.slowestCalls.get(0).responseTimeMs);
    assertEquals("r2", perf.apiPerformance.slowestCalls.get(0).executionId);
    assertTrue(perf.performanceIssues.isEmpty());
  }

  @Test
  void performance_flagsSlowP95() {
    var results = List.of(passed("r1", 12_000, 1_000, T0));

    var perf = build(results, ReportOptions.defaults()).performanceAnalysis;

    assertEquals(List.of("95th percentile execution time exceeds 10 seconds"), perf.performanceIssues);
  }

  @Test
  void errors_groupedByKindAndMessage() {
    var results =
        List.of(
            error("r1", ErrorKind.TYPE_ERROR, "x is null", T0),
            error("r2", ErrorKind.TYPE_ERROR, "x is null", T0),
            error("r3", ErrorKind.SYNTAX_ERROR, "missing ;", T0),
            passed("r4", 100, 1_000, T0));

    var errors = build(results, ReportOptions.defaults()).errorAnalysis;

    assertEquals(2L, errors.errorsByKind.get("TypeError"));
    assertEquals(1L, errors.errorsByKind.get("SyntaxError"));
    assertEquals("x is null", errors.commonErrors.get(0).message);
    assertEquals(2, errors.commonErrors.get(0).count);
    assertEquals(List.of("r1", "r2"), errors.commonErrors.get(0).affectedTests);
    assertEquals(2, errors.criticalErrors.size());
  }

  @Test
  void errors_longMessagesShareTruncatedKey() {
    var prefix = "m".repeat(TestReportBuilder.MESSAGE_KEY_LENGTH);
    var results =
        List.of(
            error("r1", ErrorKind.ERROR, prefix + "-first", T0),
            error("r2", ErrorKind.ERROR, prefix + "-second", T0));

    var errors = build(results, ReportOptions.defaults()).errorAnalysis;

    assertEquals(1, errors.commonErrors.size());
    assertEquals(prefix, errors.commonErrors.get(0).message);
  }

  @Test
  void errors_hourlyTrend() {
    var results =
        List.of(
            passed("r1", 100, 1_000, T0),
            error("r2", ErrorKind.ERROR, "boom", T0.plusSeconds(60)),
            error("r3", ErrorKind.ERROR, "boom", T0.plusSeconds(3_600)));

    var trend = build(results, ReportOptions.defaults()).errorAnalysis.errorTrends;

    assertEquals(2, trend.size());
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), trend.get(0).hourStart);
    assertEquals(1, trend.get(0).errorCount);
    assertEquals(0.5, trend.get(0).errorRate, 1e-9);
    assertEquals(1.0, trend.get(1).errorRate, 1e-9);
  }

  @Test
  void detailLevel_controlsEmbeddedResults() {
    var results =
        List.of(
            passed("r1", 100, 1_000, T0),
            passed("r2", 100, 1_000, T0),
            passed("r3", 100, 1_000, T0));

    var basic = build(results, new ReportOptions(true, true, true, DetailLevel.BASIC));
    var detailed = build(results, new ReportOptions(true, true, true, DetailLevel.DETAILED));
    var full = build(results, new ReportOptions(true, true, true, DetailLevel.COMPREHENSIVE));

    assertTrue(basic.testResults.isEmpty());
    assertEquals(List.of("r2", "r3"), detailed.testResults.stream().map(ExecutionResult::id).toList());
    assertEquals(3, full.testResults.size());
  }

  @Test
  void disabledSectionsAreEmptyButStillDriveRecommendations() {
    var results = List.of(error("r1", ErrorKind.TYPE_ERROR, "x is null", T0));

    var report = build(results, new ReportOptions(false, false, true, DetailLevel.BASIC));

    assertTrue(report.errorAnalysis.commonErrors.isEmpty());
    assertTrue(report.errorAnalysis.errorsByKind.isEmpty());
    assertTrue(report.performanceAnalysis.performanceIssues.isEmpty());
    assertTrue(report.recommendations.stream().anyMatch(r -> r.startsWith("Critical errors")));
  }

  @Test
  void recommendations_fixedOrder() {
    List<ExecutionResult> results = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      results.add(error("e" + i, ErrorKind.REFERENCE_ERROR, "foo is not defined", T0));
    }
    results.add(passed("p1", 6_000, 250L * 1024 * 1024, T0, 900));

    var recommendations = build(results, ReportOptions.defaults()).recommendations;

    assertEquals(6, recommendations.size());
    assertTrue(recommendations.get(0).startsWith("Test success rate is below 80%"));
    assertTrue(recommendations.get(1).startsWith("Memory usage is high"));
    assertTrue(recommendations.get(2).startsWith("API response times are high"));
    assertTrue(recommendations.get(3).startsWith("Critical errors detected"));
    assertTrue(recommendations.get(4).startsWith("Most common error affects 3 tests"));
    assertTrue(recommendations.get(5).startsWith("Consider adding more"));
  }

  @Test
  void recommendations_disabledGivesEmptyList() {
    var report =
        build(
            List.of(passed("r1", 100, 1_000, T0)),
            new ReportOptions(true, true, false, DetailLevel.DETAILED));

    assertTrue(report.recommendations.isEmpty());
  }
}
