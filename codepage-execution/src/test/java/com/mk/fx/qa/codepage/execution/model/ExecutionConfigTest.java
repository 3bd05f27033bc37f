package com.mk.fx.qa.codepage.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ExecutionConfigTest {

  private final ExecutionConfig defaults =
      new ExecutionConfig(30_000, 64L * 1024 * 1024, 100, ExecutionEnvironment.DEVELOPMENT);

  @Test
  void merge_nullOverridesKeepsDefaults() {
    assertSame(defaults, defaults.merge(null));
    assertEquals(defaults, defaults.merge(new ExecutionConfigOverrides()));
  }

  @Test
  void merge_replacesOnlyPresentFields() {
    var merged =
        defaults.merge(
            ExecutionConfigOverrides.builder()
                .timeoutMs(5_000L)
                .environment(ExecutionEnvironment.STAGING)
                .build());

    assertEquals(5_000, merged.timeoutMs());
    assertEquals(ExecutionEnvironment.STAGING, merged.environment());
    assertEquals(defaults.memoryLimitBytes(), merged.memoryLimitBytes());
    assertEquals(100, merged.apiCallLimit());
  }

  @Test
  void merge_rejectsOutOfRangeValues() {
    var tooLong = ExecutionConfigOverrides.builder().timeoutMs(300_001L).build();
    var negativeCalls = ExecutionConfigOverrides.builder().apiCallLimit(-1).build();

    assertThrows(IllegalArgumentException.class, () -> defaults.merge(tooLong));
    assertThrows(IllegalArgumentException.class, () -> defaults.merge(negativeCalls));
  }

  @Test
  void zeroApiCallLimitIsAllowed() {
    var merged = defaults.merge(ExecutionConfigOverrides.builder().apiCallLimit(0).build());

    assertEquals(0, merged.apiCallLimit());
  }
}
