package com.mk.fx.qa.codepage.execution.resource;

import com.mk.fx.qa.codepage.execution.dto.CancellationResponse;
import com.mk.fx.qa.codepage.execution.dto.ExecutionSubmissionRequest;
import com.mk.fx.qa.codepage.execution.dto.MockDataUpdate;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.sandbox.ActiveExecution;
import com.mk.fx.qa.codepage.execution.sandbox.ExecutionEngine;
import com.mk.fx.qa.codepage.execution.sandbox.ExecutionStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Executions",
    description = "Endpoints for running codepage scripts in the sandbox and managing mock data")
@RestController
@RequestMapping("/api/executions")
@Validated
@RequiredArgsConstructor
public class ExecutionController {

  private final ExecutionEngine executionEngine;
  private final ExecutionMapper executionMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Execution
  // -----------------------------------------------------
  @Operation(
      summary = "Execute a codepage",
      description = "Runs the script in the sandbox and returns its result once it has ended.")
  @PostMapping
  public ResponseEntity<ExecutionResult> execute(
      @Valid @RequestBody ExecutionSubmissionRequest request) {
    log.info("Received execution for project={} version={}", request.getProjectId(), request.getVersionId());
    var result = executionEngine.execute(executionMapper.toDomain(request));
    return ResponseEntity.ok(result);
  }

  @Operation(summary = "Active executions", description = "Lists runs that have not ended yet.")
  @GetMapping("/active")
  public ResponseEntity<List<ActiveExecution>> activeExecutions() {
    return ResponseEntity.ok(executionEngine.activeExecutions());
  }

  @Operation(summary = "Cancel execution", description = "Abandons an active run.")
  @DeleteMapping("/{testId}")
  public ResponseEntity<?> cancel(@PathVariable String testId) {
    if (!executionEngine.cancel(testId)) {
      log.warn("Execution {} not active", testId);
      return responseFactory.notFound("No active execution: " + testId);
    }
    return ResponseEntity.ok(new CancellationResponse(testId, true, "Cancellation requested"));
  }

  @Operation(summary = "Execution statistics", description = "Returns engine statistics.")
  @GetMapping("/stats")
  public ResponseEntity<ExecutionStats> stats() {
    return ResponseEntity.ok(executionEngine.stats());
  }

  // -----------------------------------------------------
  // Mock data
  // -----------------------------------------------------
  @Operation(summary = "Mock data", description = "Returns every mock data set.")
  @GetMapping("/mock-data")
  public ResponseEntity<Map<String, List<Map<String, Object>>>> mockData() {
    return ResponseEntity.ok(executionEngine.getMockData());
  }

  @Operation(summary = "Mock data set", description = "Returns one mock data set.")
  @GetMapping("/mock-data/{key}")
  public ResponseEntity<?> mockData(@PathVariable String key) {
    return executionEngine
        .getMockData(key)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Mock data set {} not found", key);
              return responseFactory.notFound("Mock data set not found: " + key);
            });
  }

  @Operation(summary = "Replace mock data set", description = "Replaces the records of a set.")
  @PutMapping("/mock-data/{key}")
  public ResponseEntity<List<Map<String, Object>>> updateMockData(
      @PathVariable String key, @Valid @RequestBody MockDataUpdate update) {
    executionEngine.updateMockData(key, update.getRecords());
    return ResponseEntity.ok(update.getRecords());
  }
}
