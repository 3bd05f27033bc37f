package com.mk.fx.qa.codepage.execution.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Caller-supplied partial {@link ExecutionConfig}; null fields keep the platform default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionConfigOverrides {

  private Long timeoutMs;
  private Long memoryLimitBytes;
  private Integer apiCallLimit;
  private ExecutionEnvironment environment;
}
