package com.mk.fx.qa.codepage.execution.monitoring.alert;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import com.mk.fx.qa.codepage.execution.monitoring.MetricKind;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlertRuleEvaluatorTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final AlertRuleEvaluator evaluator = new AlertRuleEvaluator();

  private static Metric metric(String id, String name, double value, Map<String, Object> metadata) {
    return new Metric(id, MetricKind.API_RESPONSE, name, value, "ms", NOW, metadata);
  }

  private static AlertRule rule(AlertRuleType type) {
    return AlertRule.builder()
        .id("rule-1")
        .name("r")
        .type(type)
        .metricName("latency")
        .condition(AlertCondition.GT)
        .threshold(1)
        .windowMinutes(5)
        .active(true)
        .build();
  }

  @Test
  void triggerValue_emptyWindowIsInert() {
    var m = metric("m1", "latency", 50, Map.of());

    assertTrue(evaluator.triggerValue(rule(AlertRuleType.THRESHOLD), m, List.of()).isEmpty());
  }

  @Test
  void triggerValue_anomalyIgnoresTriggeringMetric() {
    var trigger = metric("m6", "latency", 20, Map.of());
    var window =
        List.of(
            metric("m1", "latency", 10, Map.of()),
            metric("m2", "latency", 10, Map.of()),
            metric("m3", "latency", 10, Map.of()),
            metric("m4", "latency", 14, Map.of()),
            metric("m5", "latency", 6, Map.of()),
            trigger);

    // mean 10, population std dev of the other five is sqrt(32 / 5)
    var score = evaluator.triggerValue(rule(AlertRuleType.ANOMALY), trigger, window);

    assertEquals(10 / Math.sqrt(32.0 / 5), score.getAsDouble(), 1e-9);
  }

  @Test
  void isErrorLike_recognisesStatusFlagsAndName() {
    assertTrue(AlertRuleEvaluator.isErrorLike(metric("a", "latency", 1, Map.of("statusCode", 404))));
    assertTrue(AlertRuleEvaluator.isErrorLike(metric("b", "latency", 1, Map.of("statusCode", "503"))));
    assertTrue(AlertRuleEvaluator.isErrorLike(metric("c", "latency", 1, Map.of("error", "true"))));
    assertTrue(AlertRuleEvaluator.isErrorLike(metric("d", "latency", 1, Map.of("status", "ERROR"))));
    assertTrue(AlertRuleEvaluator.isErrorLike(metric("e", "api_errors", 1, Map.of())));
    assertFalse(AlertRuleEvaluator.isErrorLike(metric("f", "latency", 1, Map.of("statusCode", 302))));
    assertFalse(
        AlertRuleEvaluator.isErrorLike(metric("g", "latency", 1, Map.of("statusCode", "n/a"))));
  }
}
