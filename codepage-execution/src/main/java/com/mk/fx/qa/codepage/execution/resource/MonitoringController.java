package com.mk.fx.qa.codepage.execution.resource;

import com.mk.fx.qa.codepage.execution.dto.AlertRuleRequest;
import com.mk.fx.qa.codepage.execution.dto.AlertRuleUpdateRequest;
import com.mk.fx.qa.codepage.execution.dto.MetricRecordRequest;
import com.mk.fx.qa.codepage.execution.monitoring.HealthSnapshot;
import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import com.mk.fx.qa.codepage.execution.monitoring.MetricFilter;
import com.mk.fx.qa.codepage.execution.monitoring.MetricKind;
import com.mk.fx.qa.codepage.execution.monitoring.MetricSummary;
import com.mk.fx.qa.codepage.execution.monitoring.MetricsService;
import com.mk.fx.qa.codepage.execution.monitoring.SystemHealthService;
import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertEngine;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Monitoring", description = "Endpoints for metrics, alert rules, alerts and health")
@RestController
@RequestMapping("/api/monitoring")
@Validated
@RequiredArgsConstructor
public class MonitoringController {

  private final MetricsService metricsService;
  private final AlertEngine alertEngine;
  private final SystemHealthService healthService;
  private final AlertRuleMapper alertRuleMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Metrics
  // -----------------------------------------------------
  @Operation(summary = "Record metric", description = "Records a metric and evaluates alert rules.")
  @PostMapping("/metrics")
  public ResponseEntity<Metric> recordMetric(@Valid @RequestBody MetricRecordRequest request) {
    var metric =
        metricsService.record(
            MetricKind.fromValue(request.getType()),
            request.getName(),
            request.getValue(),
            request.getUnit(),
            request.getMetadata());
    return responseFactory.created(metric);
  }

  @Operation(summary = "Query metrics", description = "Returns matching metrics, newest first.")
  @GetMapping("/metrics")
  public ResponseEntity<List<Metric>> metrics(
      @RequestParam(required = false) String type,
      @RequestParam(required = false) String name,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(defaultValue = "1000") int limit) {
    var filter =
        MetricFilter.builder()
            .kind(type == null ? null : MetricKind.fromValue(type))
            .name(name)
            .from(from)
            .to(to)
            .limit(limit)
            .build();
    return ResponseEntity.ok(metricsService.query(filter));
  }

  @Operation(summary = "Metric summary", description = "Summarises metrics of a recent window.")
  @GetMapping("/metrics/summary")
  public ResponseEntity<MetricSummary> summary(
      @RequestParam(required = false) String type,
      @RequestParam(defaultValue = "60") int windowMinutes) {
    var kind = type == null ? null : MetricKind.fromValue(type);
    return ResponseEntity.ok(metricsService.summarize(kind, windowMinutes));
  }

  // -----------------------------------------------------
  // Alert rules
  // -----------------------------------------------------
  @Operation(summary = "List alert rules", description = "Returns every rule, oldest first.")
  @GetMapping("/rules")
  public ResponseEntity<List<AlertRule>> rules() {
    return ResponseEntity.ok(alertEngine.rules());
  }

  @Operation(summary = "Create alert rule", description = "Creates a new alert rule.")
  @PostMapping("/rules")
  public ResponseEntity<AlertRule> createRule(@Valid @RequestBody AlertRuleRequest request) {
    log.info("Creating alert rule '{}' on {}", request.getName(), request.getMetricName());
    return responseFactory.created(alertEngine.createRule(alertRuleMapper.toDefinition(request)));
  }

  @Operation(summary = "Update alert rule", description = "Changes the fields present.")
  @PutMapping("/rules/{ruleId}")
  public ResponseEntity<AlertRule> updateRule(
      @PathVariable String ruleId, @Valid @RequestBody AlertRuleUpdateRequest request) {
    return ResponseEntity.ok(alertEngine.updateRule(ruleId, alertRuleMapper.toUpdate(request)));
  }

  @Operation(summary = "Delete alert rule", description = "Deletes a rule, resolving its alert.")
  @DeleteMapping("/rules/{ruleId}")
  public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
    alertEngine.deleteRule(ruleId);
    return ResponseEntity.noContent().build();
  }

  // -----------------------------------------------------
  // Alerts & health
  // -----------------------------------------------------
  @Operation(
      summary = "List alerts",
      description = "Returns unresolved alerts, or every alert with all=true, newest first.")
  @GetMapping("/alerts")
  public ResponseEntity<List<Alert>> alerts(
      @RequestParam(defaultValue = "false") boolean all,
      @RequestParam(defaultValue = "100") int limit) {
    return ResponseEntity.ok(all ? alertEngine.allAlerts(limit) : alertEngine.activeAlerts());
  }

  @Operation(summary = "Resolve alert", description = "Marks an alert as resolved.")
  @PostMapping("/alerts/{alertId}/resolve")
  public ResponseEntity<Alert> resolve(@PathVariable String alertId) {
    return ResponseEntity.ok(alertEngine.resolve(alertId));
  }

  @Operation(summary = "System health", description = "Returns the current health snapshot.")
  @GetMapping("/health")
  public ResponseEntity<HealthSnapshot> health() {
    return ResponseEntity.ok(healthService.health());
  }
}
