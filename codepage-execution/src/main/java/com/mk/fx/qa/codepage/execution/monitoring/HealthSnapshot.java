package com.mk.fx.qa.codepage.execution.monitoring;

import java.time.Instant;

/**
 * Point-in-time system health.
 *
 * @param avgCpuUsagePercent average of {@code system_cpu_usage} over the sampling window
 * @param avgMemoryUsageMb average of {@code system_memory_usage} in megabytes, two decimals
 * @param avgApiResponseTimeMs average of {@code api_response_time} over the sampling window
 */
public record HealthSnapshot(
    HealthStatus status,
    int activeAlerts,
    int criticalAlerts,
    double avgCpuUsagePercent,
    double avgMemoryUsageMb,
    double avgApiResponseTimeMs,
    long uptimeSeconds,
    Instant timestamp) {}
