package com.mk.fx.qa.codepage.execution.reporting;

import com.mk.fx.qa.codepage.execution.cfg.ReportingCfg;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.sandbox.ExecutionResultListener;
import com.mk.fx.qa.codepage.execution.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps recent execution results per project version and aggregates them into {@link TestReport}s.
 *
 * <p>Every result produced by the engine is recorded; a result that ended in error immediately
 * regenerates the report for its project version.
 */
@Slf4j
@Service
public class TestReportingService implements ExecutionResultListener {

  private final ResultHistory history;
  private final KeyValueStore<String, TestReport> reports;
  private final TestReportBuilder builder;
  private final Clock clock;

  public TestReportingService(
      ReportingCfg properties, KeyValueStore<String, TestReport> reports, Clock clock) {
    this.history = new ResultHistory(properties.getHistorySize());
    this.reports = reports;
    this.builder = new TestReportBuilder(properties.getDetailedResultsIncluded());
    this.clock = clock;
    log.info(
        "TestReportingService initialised with historySize={}", properties.getHistorySize());
  }

  @Override
  public void onResult(ExecutionResult result) {
    record(result);
  }

  public void record(ExecutionResult result) {
    var key = history.add(result);
    log.debug("Result {} recorded for {} ({})", result.id(), key, result.status().value());
    if (result.hasErrors()) {
      generate(key.projectId(), key.versionId(), ReportOptions.defaults())
          .ifPresent(r -> log.info("Report {} regenerated after failed run {}", r.id, result.id()));
    }
  }

  /**
   * Builds and stores a report over the recorded results of a project version.
   *
   * @return empty when no results have been recorded for the project version
   */
  public Optional<TestReport> generate(String projectId, String versionId, ReportOptions options) {
    var key = new ResultKey(projectId, versionId);
    var results = history.snapshot(key);
    if (results.isEmpty()) {
      log.warn("No test results found for {}", key);
      return Optional.empty();
    }
    var reportId = "report-" + UUID.randomUUID();
    var effective = options != null ? options : ReportOptions.defaults();
    var report = builder.build(reportId, key, results, effective, clock.instant());
    reports.put(reportId, report);
    log.info(
        "Report {} generated for {}: tests={} successRate={}",
        reportId,
        key,
        report.summary.totalTests,
        String.format("%.2f", report.summary.successRate));
    return Optional.of(report);
  }

  public Optional<TestReport> get(String reportId) {
    return reports.get(reportId);
  }

  /** Reports of a project, newest first. */
  public List<TestReport> projectReports(String projectId) {
    return reports.list(r -> r.projectId.equals(projectId)).stream()
        .sorted(Comparator.comparing((TestReport r) -> r.generatedAt).reversed())
        .toList();
  }

  /** Recorded results of a project version, oldest first. */
  public List<ExecutionResult> results(String projectId, String versionId) {
    return history.snapshot(new ResultKey(projectId, versionId));
  }

  /**
   * Drops results created and reports generated more than {@code olderThanDays} days ago.
   *
   * @return number of results and reports removed
   */
  public int deleteOlderThan(int olderThanDays) {
    if (olderThanDays < 0) {
      throw new IllegalArgumentException("olderThanDays must be >= 0");
    }
    var cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
    var removedResults = history.removeCreatedBefore(cutoff);
    var removedReports = reports.deleteIf(r -> r.generatedAt.isBefore(cutoff));
    log.info(
        "Cleaned up {} results and {} reports older than {}", removedResults, removedReports, cutoff);
    return removedResults + removedReports;
  }

  public ReportingStats stats() {
    var totalResults = history.totalResults();
    var keys = history.keyCount();
    Instant oldest = history.oldest().orElse(null);
    Instant newest = history.newest().orElse(null);
    return new ReportingStats(
        totalResults,
        reports.size(),
        oldest,
        newest,
        keys == 0 ? 0L : Math.round((double) totalResults / keys));
  }
}
