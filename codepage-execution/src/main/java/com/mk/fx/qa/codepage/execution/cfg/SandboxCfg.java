package com.mk.fx.qa.codepage.execution.cfg;

import com.mk.fx.qa.codepage.execution.model.ExecutionConfig;
import com.mk.fx.qa.codepage.execution.model.ExecutionEnvironment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codepage.sandbox")
public class SandboxCfg {

  @Min(1)
  @Max(64)
  private int concurrency = 8;

  @Min(10)
  @Max(1000)
  private long pollIntervalMs = 100;

  /** Instructions executed between two deadline checks inside the interpreter. */
  @Min(100)
  private int instructionObserverThreshold = 10_000;

  @Min(64)
  private int maxStackDepth = 1_000;

  @PositiveOrZero private double mockLatencyFactor = 1.0;

  @Valid @NotNull private Defaults defaults = new Defaults();

  @Data
  public static class Defaults {

    @Positive private long timeoutMs = 30_000;

    @Positive private long memoryLimitBytes = 134_217_728L;

    @PositiveOrZero private int apiCallLimit = 100;

    @NotNull private ExecutionEnvironment environment = ExecutionEnvironment.DEVELOPMENT;
  }

  public ExecutionConfig defaultExecutionConfig() {
    return new ExecutionConfig(
        defaults.getTimeoutMs(),
        defaults.getMemoryLimitBytes(),
        defaults.getApiCallLimit(),
        defaults.getEnvironment());
  }
}
