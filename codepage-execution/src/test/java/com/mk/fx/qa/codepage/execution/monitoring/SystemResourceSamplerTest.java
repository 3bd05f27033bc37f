package com.mk.fx.qa.codepage.execution.monitoring;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import org.junit.jupiter.api.Test;

class SystemResourceSamplerTest {

  @Test
  void sample_recordsMemoryMetrics() {
    var metrics = mock(MetricsService.class);
    var sampler = new SystemResourceSampler(new MonitoringCfg(), metrics);

    sampler.sample();

    verify(metrics)
        .record(
            eq(MetricKind.SYSTEM_RESOURCE),
            eq("system_memory_usage"),
            doubleThat(v -> v > 0),
            eq("bytes"),
            anyMap());
    verify(metrics)
        .record(
            eq(MetricKind.SYSTEM_RESOURCE),
            eq("system_heap_total"),
            anyDouble(),
            eq("bytes"),
            anyMap());
    verify(metrics)
        .record(
            eq(MetricKind.SYSTEM_RESOURCE),
            eq("system_non_heap_memory"),
            anyDouble(),
            eq("bytes"),
            anyMap());
    verify(metrics, atMost(1))
        .record(
            eq(MetricKind.SYSTEM_RESOURCE),
            eq("system_cpu_usage"),
            doubleThat(v -> v >= 0 && v <= 100),
            eq("percent"),
            anyMap());
  }

  @Test
  void start_disabledSchedulesNothing() {
    var cfg = new MonitoringCfg();
    cfg.setSystemSamplingEnabled(false);
    var metrics = mock(MetricsService.class);
    var sampler = new SystemResourceSampler(cfg, metrics);

    sampler.start();
    sampler.stop();

    verifyNoInteractions(metrics);
  }
}
