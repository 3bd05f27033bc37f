package com.mk.fx.qa.codepage.execution.resource;

import com.mk.fx.qa.codepage.execution.dto.DeletionResponse;
import com.mk.fx.qa.codepage.execution.dto.ReportRequest;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.reporting.DetailLevel;
import com.mk.fx.qa.codepage.execution.reporting.ReportOptions;
import com.mk.fx.qa.codepage.execution.reporting.ReportingStats;
import com.mk.fx.qa.codepage.execution.reporting.TestReport;
import com.mk.fx.qa.codepage.execution.reporting.TestReportingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Reports", description = "Endpoints for aggregated test reports over execution results")
@RestController
@RequestMapping("/api/reports")
@Validated
@RequiredArgsConstructor
public class ReportController {

  private final TestReportingService reportingService;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Reports
  // -----------------------------------------------------
  @Operation(
      summary = "Generate report",
      description = "Aggregates the recorded results of a project version into a new report.")
  @PostMapping("/{projectId}/{versionId}")
  public ResponseEntity<?> generate(
      @PathVariable String projectId,
      @PathVariable String versionId,
      @RequestBody(required = false) ReportRequest request) {
    return reportingService
        .generate(projectId, versionId, toOptions(request))
        .<ResponseEntity<?>>map(responseFactory::created)
        .orElseGet(
            () ->
                responseFactory.notFound(
                    "No test results found for " + projectId + "/" + versionId));
  }

  @Operation(summary = "Get report", description = "Returns a stored report.")
  @GetMapping("/{reportId}")
  public ResponseEntity<?> get(@PathVariable String reportId) {
    return reportingService
        .get(reportId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Report {} not found", reportId);
              return responseFactory.notFound("Report not found: " + reportId);
            });
  }

  @Operation(summary = "Project reports", description = "Reports of a project, newest first.")
  @GetMapping("/projects/{projectId}")
  public ResponseEntity<List<TestReport>> projectReports(@PathVariable String projectId) {
    return ResponseEntity.ok(reportingService.projectReports(projectId));
  }

  // -----------------------------------------------------
  // Results & housekeeping
  // -----------------------------------------------------
  @Operation(summary = "Recorded results", description = "Results kept for a project version.")
  @GetMapping("/results/{projectId}/{versionId}")
  public ResponseEntity<List<ExecutionResult>> results(
      @PathVariable String projectId, @PathVariable String versionId) {
    return ResponseEntity.ok(reportingService.results(projectId, versionId));
  }

  @Operation(summary = "Reporting statistics", description = "Returns result and report counts.")
  @GetMapping("/stats")
  public ResponseEntity<ReportingStats> stats() {
    return ResponseEntity.ok(reportingService.stats());
  }

  @Operation(
      summary = "Delete old data",
      description = "Removes results and reports older than the given number of days.")
  @DeleteMapping("/results")
  public ResponseEntity<DeletionResponse> deleteOld(
      @RequestParam(defaultValue = "30") @PositiveOrZero int olderThanDays) {
    var deleted = reportingService.deleteOlderThan(olderThanDays);
    return ResponseEntity.ok(
        new DeletionResponse(deleted, "Removed data older than " + olderThanDays + " days"));
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------
  private ReportOptions toOptions(ReportRequest request) {
    if (request == null) {
      return ReportOptions.defaults();
    }
    return new ReportOptions(
        !Boolean.FALSE.equals(request.getIncludePerformanceAnalysis()),
        !Boolean.FALSE.equals(request.getIncludeErrorAnalysis()),
        !Boolean.FALSE.equals(request.getIncludeRecommendations()),
        request.getDetailLevel() == null ? null : DetailLevel.fromValue(request.getDetailLevel()));
  }
}
