package com.mk.fx.qa.codepage.execution.monitoring;

import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertEngine;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertSeverity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Derives an overall health status from open alerts and recent system and API metrics. */
@Slf4j
@Service
public class SystemHealthService {

  static final Duration SAMPLE_WINDOW = Duration.ofMinutes(5);
  static final double CPU_CRITICAL_PERCENT = 90;
  static final double CPU_WARNING_PERCENT = 70;
  static final double LATENCY_CRITICAL_MS = 10_000;
  static final double LATENCY_WARNING_MS = 5_000;

  private final MetricsService metrics;
  private final AlertEngine alerts;
  private final Clock clock;
  private final Instant startedAt;

  public SystemHealthService(MetricsService metrics, AlertEngine alerts, Clock clock) {
    this.metrics = metrics;
    this.alerts = alerts;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public HealthSnapshot health() {
    var now = clock.instant();
    var since = now.minus(SAMPLE_WINDOW);
    var active = alerts.activeAlerts();
    var critical =
        (int) active.stream().filter(a -> a.severity() == AlertSeverity.CRITICAL).count();

    var system =
        metrics.query(
            MetricFilter.builder()
                .kind(MetricKind.SYSTEM_RESOURCE)
                .from(since)
                .limit(Integer.MAX_VALUE)
                .build());
    var cpu = average(system, "system_cpu_usage");
    var memoryMb = Math.round(average(system, "system_memory_usage") / (1024 * 1024) * 100) / 100.0;
    var latency = average(metrics.recent("api_response_time", since), "api_response_time");

    HealthStatus status;
    if (critical > 0 || cpu > CPU_CRITICAL_PERCENT || latency > LATENCY_CRITICAL_MS) {
      status = HealthStatus.CRITICAL;
    } else if (!active.isEmpty() || cpu > CPU_WARNING_PERCENT || latency > LATENCY_WARNING_MS) {
      status = HealthStatus.WARNING;
    } else {
      status = HealthStatus.HEALTHY;
    }
    if (status != HealthStatus.HEALTHY) {
      log.debug(
          "Health {}: activeAlerts={}, criticalAlerts={}, cpu={}, latency={}",
          status.value(),
          active.size(),
          critical,
          cpu,
          latency);
    }
    return new HealthSnapshot(
        status,
        active.size(),
        critical,
        cpu,
        memoryMb,
        latency,
        Duration.between(startedAt, now).toSeconds(),
        now);
  }

  private static double average(List<Metric> metrics, String name) {
    return metrics.stream()
        .filter(m -> m.name().equals(name))
        .mapToDouble(Metric::value)
        .average()
        .orElse(0);
  }
}
