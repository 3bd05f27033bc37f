package com.mk.fx.qa.codepage.execution.monitoring.alert;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial rule update; null fields keep their current value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleUpdate {

  private String name;
  private AlertRuleType type;
  private String metricName;
  private AlertCondition condition;
  private Double threshold;
  private Integer windowMinutes;
  private Boolean active;
  private List<String> channels;
}
