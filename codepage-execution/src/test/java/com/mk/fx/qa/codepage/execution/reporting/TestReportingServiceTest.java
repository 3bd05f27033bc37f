package com.mk.fx.qa.codepage.execution.reporting;

import static com.mk.fx.qa.codepage.execution.reporting.TestResults.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.codepage.execution.cfg.ReportingCfg;
import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.store.InMemoryKeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestReportingServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final InMemoryKeyValueStore<String, TestReport> reports = new InMemoryKeyValueStore<>();

  private TestReportingService service(int historySize) {
    ReportingCfg cfg = new ReportingCfg();
    cfg.setHistorySize(historySize);
    return new TestReportingService(cfg, reports, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void generate_withoutResultsIsEmpty() {
    var service = service(10);

    assertTrue(service.generate("nope", "v1", ReportOptions.defaults()).isEmpty());
    assertEquals(0, reports.size());
  }

  @Test
  void generate_storesReportRetrievableById() {
    var service = service(10);
    service.record(passed("r1", 100, 1_000, NOW));

    var report = service.generate(PROJECT, VERSION, null).orElseThrow();

    assertTrue(report.id.startsWith("report-"));
    assertEquals(NOW, report.generatedAt);
    assertEquals(DetailLevel.DETAILED, report.detailLevel);
    assertSame(report, service.get(report.id).orElseThrow());
  }

  @Test
  void record_keepsOnlyMostRecentResults() {
    var service = service(3);
    for (int i = 0; i < 5; i++) {
      service.record(passed("r" + i, 100, 1_000, NOW.plusSeconds(i)));
    }

    var ids = service.results(PROJECT, VERSION).stream().map(ExecutionResult::id).toList();

    assertEquals(List.of("r2", "r3", "r4"), ids);
    assertEquals(3, service.stats().totalResults());
  }

  @Test
  void record_failedResultRegeneratesReport() {
    var service = service(10);
    service.record(passed("r1", 100, 1_000, NOW));
    assertEquals(0, reports.size());

    service.record(error("r2", ErrorKind.TYPE_ERROR, "boom", NOW));

    assertEquals(1, reports.size());
    var report = service.projectReports(PROJECT).get(0);
    assertEquals(2, report.summary.totalTests);
    assertEquals(1, report.summary.errorTests);
  }

  @Test
  void onResult_recordsLikeRecord() {
    var service = service(10);

    service.onResult(passed("r1", 100, 1_000, NOW));

    assertEquals(1, service.results(PROJECT, VERSION).size());
  }

  @Test
  void deleteOlderThan_removesOldResultsAndReports() {
    var service = service(10);
    service.record(passed("old", 100, 1_000, NOW.minus(Duration.ofDays(40))));
    service.record(passed("new", 100, 1_000, NOW.minus(Duration.ofDays(1))));
    var stale = service.generate(PROJECT, VERSION, ReportOptions.defaults()).orElseThrow();
    stale.generatedAt = NOW.minus(Duration.ofDays(35));

    var removed = service.deleteOlderThan(30);

    assertEquals(2, removed);
    assertEquals(
        List.of("new"),
        service.results(PROJECT, VERSION).stream().map(ExecutionResult::id).toList());
    assertTrue(service.get(stale.id).isEmpty());
  }

  @Test
  void deleteOlderThan_rejectsNegativeDays() {
    assertThrows(IllegalArgumentException.class, () -> service(10).deleteOlderThan(-1));
  }

  @Test
  void stats_reportsBounds() {
    var service = service(10);
    service.record(passed("a", 100, 1_000, NOW.minusSeconds(60)));
    service.record(passed("b", 100, 1_000, NOW));

    var stats = service.stats();

    assertEquals(2, stats.totalResults());
    assertEquals(NOW.minusSeconds(60), stats.oldestResult());
    assertEquals(NOW, stats.newestResult());
    assertEquals(2, stats.averageResultsPerProject());
  }
}
