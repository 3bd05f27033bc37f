package com.mk.fx.qa.codepage.execution.sandbox;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Measures heap memory held while a run executes.
 *
 * <p>Samples the heap in use outside the young-generation eden space, so short-lived garbage a
 * script churns through does not count until it survives a collection. Collectors without a
 * separate eden pool are sampled on total heap used. Samples are relative to the value at run
 * start and never negative.
 */
@Slf4j
@Component
public class ThreadMemorySampler {

  private final MemoryMXBean memoryBean;
  private final List<MemoryPoolMXBean> retainedPools;

  public ThreadMemorySampler() {
    this.memoryBean = ManagementFactory.getMemoryMXBean();
    var heapPools =
        ManagementFactory.getMemoryPoolMXBeans().stream()
            .filter(pool -> pool.getType() == MemoryType.HEAP)
            .toList();
    if (heapPools.stream().anyMatch(ThreadMemorySampler::isEden)) {
      this.retainedPools = heapPools.stream().filter(pool -> !isEden(pool)).toList();
    } else {
      log.info("No eden pool reported by the collector, sampling total heap used");
      this.retainedPools = List.of();
    }
  }

  /** Heap in use right now; samples are reported relative to the value at run start. */
  public long baseline() {
    return heapInUse();
  }

  public long sample(long baseline) {
    return Math.max(0L, heapInUse() - baseline);
  }

  long heapInUse() {
    if (retainedPools.isEmpty()) {
      return memoryBean.getHeapMemoryUsage().getUsed();
    }
    long used = 0L;
    for (var pool : retainedPools) {
      var usage = pool.getUsage();
      if (usage != null) {
        used += usage.getUsed();
      }
    }
    return used;
  }

  private static boolean isEden(MemoryPoolMXBean pool) {
    return pool.getName().contains("Eden");
  }
}
