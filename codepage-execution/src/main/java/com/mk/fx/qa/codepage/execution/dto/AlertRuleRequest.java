package com.mk.fx.qa.codepage.execution.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Data;

@Data
public class AlertRuleRequest {

  @NotBlank
  @Size(max = 100)
  private String name;

  @NotBlank private String type;

  @NotBlank private String metricName;

  @NotBlank private String condition;

  @NotNull private Double threshold;

  @NotNull
  @Min(1)
  @Max(1440)
  private Integer windowMinutes;

  private Boolean active;

  private List<String> channels;
}
