package com.mk.fx.qa.codepage.execution.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Data;

/** Partial rule update; only the fields present are changed. */
@Data
public class AlertRuleUpdateRequest {

  @Size(min = 1, max = 100)
  private String name;

  private String type;

  private String metricName;

  private String condition;

  private Double threshold;

  @Min(1)
  @Max(1440)
  private Integer windowMinutes;

  private Boolean active;

  private List<String> channels;
}
