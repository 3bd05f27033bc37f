package com.mk.fx.qa.codepage.execution.monitoring;

import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Periodically records process CPU and JVM memory usage as system resource metrics. */
@Slf4j
@Component
public class SystemResourceSampler {

  private final MonitoringCfg cfg;
  private final MetricsService metrics;
  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
  private ScheduledExecutorService sampler;

  public SystemResourceSampler(MonitoringCfg cfg, MetricsService metrics) {
    this.cfg = cfg;
    this.metrics = metrics;
  }

  @PostConstruct
  void start() {
    if (!cfg.isSystemSamplingEnabled()) {
      log.info("System resource sampling disabled");
      return;
    }
    sampler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("system-sampler");
              t.setDaemon(true);
              return t;
            });
    var interval = cfg.getSystemSampleIntervalMs();
    sampler.scheduleAtFixedRate(this::sampleQuietly, interval, interval, TimeUnit.MILLISECONDS);
    log.info("System resource sampling every {} ms", interval);
  }

  @PreDestroy
  void stop() {
    if (sampler != null) {
      sampler.shutdownNow();
    }
  }

  /** Records one sample of every system metric. */
  public void sample() {
    var heap = memory.getHeapMemoryUsage();
    var nonHeap = memory.getNonHeapMemoryUsage();
    var cpu = processCpuPercent();
    if (cpu >= 0) {
      metrics.record(MetricKind.SYSTEM_RESOURCE, "system_cpu_usage", cpu, "percent", Map.of());
    }
    metrics.record(
        MetricKind.SYSTEM_RESOURCE, "system_memory_usage", heap.getUsed(), "bytes", Map.of());
    metrics.record(
        MetricKind.SYSTEM_RESOURCE, "system_heap_total", heap.getCommitted(), "bytes", Map.of());
    metrics.record(
        MetricKind.SYSTEM_RESOURCE,
        "system_non_heap_memory",
        nonHeap.getUsed(),
        "bytes",
        Map.of());
  }

  private void sampleQuietly() {
    try {
      sample();
    } catch (RuntimeException e) {
      log.error("System resource sampling failed", e);
    }
  }

  /** Recent process CPU load in percent, or -1 when the JVM does not report it. */
  private static double processCpuPercent() {
    if (ManagementFactory.getOperatingSystemMXBean()
        instanceof com.sun.management.OperatingSystemMXBean os) {
      var load = os.getProcessCpuLoad();
      return load < 0 ? -1 : load * 100.0;
    }
    return -1;
  }
}
