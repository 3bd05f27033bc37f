package com.mk.fx.qa.codepage.execution.monitoring.alert;

import java.util.List;

/** Rules installed at startup when {@code codepage.monitoring.default-rules-enabled} is set. */
final class DefaultAlertRules {

  private static final List<String> CHANNELS = List.of("console", "log");

  private DefaultAlertRules() {}

  static List<AlertRuleDefinition> definitions() {
    return List.of(
        rule("High Codepage Execution Time", AlertRuleType.THRESHOLD, "codepage_execution_time", 10_000, 5),
        rule("High Memory Usage", AlertRuleType.THRESHOLD, "codepage_memory_usage", 128L * 1024 * 1024, 5),
        rule("High API Response Time", AlertRuleType.THRESHOLD, "api_response_time", 5_000, 10),
        rule("High Error Rate", AlertRuleType.ERROR_RATE, "api_response_time", 0.1, 15),
        rule("System CPU Usage", AlertRuleType.THRESHOLD, "system_cpu_usage", 80, 5));
  }

  private static AlertRuleDefinition rule(
      String name, AlertRuleType type, String metricName, double threshold, int windowMinutes) {
    return AlertRuleDefinition.builder()
        .name(name)
        .type(type)
        .metricName(metricName)
        .condition(AlertCondition.GT)
        .threshold(threshold)
        .windowMinutes(windowMinutes)
        .active(true)
        .channels(CHANNELS)
        .build();
  }
}
