package com.mk.fx.qa.codepage.execution.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;
import lombok.Data;

/**
 * A codepage script to run, with optional per-run limits. Limits left out fall back to the
 * platform defaults.
 */
@Data
public class ExecutionSubmissionRequest {

  private String projectId;

  private String versionId;

  @NotBlank private String script;

  private Map<String, Object> testData;

  @Positive private Long timeoutMs;

  @Positive private Long memoryLimitBytes;

  @PositiveOrZero private Integer apiCallLimit;

  private String environment;
}
