package com.mk.fx.qa.codepage.execution.sandbox;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ThreadMemorySamplerTest {

  private final ThreadMemorySampler sampler = new ThreadMemorySampler();

  @Test
  void baseline_isNeverNegative() {
    assertTrue(sampler.baseline() >= 0);
  }

  @Test
  void sample_clampsAtZeroWhenHeapShrinksBelowBaseline() {
    assertEquals(0L, sampler.sample(Long.MAX_VALUE));
  }

  @Test
  void sample_againstZeroBaselineIsHeapInUse() {
    var sample = sampler.sample(0L);

    assertTrue(sample >= 0);
    assertTrue(sample <= Runtime.getRuntime().maxMemory());
  }
}
