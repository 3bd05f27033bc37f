package com.mk.fx.qa.codepage.execution.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Data;

@Data
public class MetricRecordRequest {

  @NotBlank private String type;

  @NotBlank private String name;

  @NotNull private Double value;

  @NotBlank private String unit;

  private Map<String, Object> metadata;
}
