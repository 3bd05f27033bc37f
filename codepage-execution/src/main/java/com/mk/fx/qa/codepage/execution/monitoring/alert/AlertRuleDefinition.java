package com.mk.fx.qa.codepage.execution.monitoring.alert;

import java.util.List;
import lombok.Builder;

/** Everything an operator supplies to create a rule. */
@Builder
public record AlertRuleDefinition(
    String name,
    AlertRuleType type,
    String metricName,
    AlertCondition condition,
    double threshold,
    int windowMinutes,
    Boolean active,
    List<String> channels) {}
