package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Computes the value a rule compares against its threshold.
 *
 * <p>An empty result means the rule is inert for this metric: the window was empty, or an anomaly
 * rule had fewer than {@value #MIN_ANOMALY_SAMPLES} other samples.
 */
final class AlertRuleEvaluator {

  static final int MIN_ANOMALY_SAMPLES = 5;

  OptionalDouble triggerValue(AlertRule rule, Metric metric, List<Metric> window) {
    if (window.isEmpty()) {
      return OptionalDouble.empty();
    }
    return switch (rule.type()) {
      case THRESHOLD -> OptionalDouble.of(metric.value());
      case ERROR_RATE -> OptionalDouble.of(
          (double) window.stream().filter(AlertRuleEvaluator::isErrorLike).count() / window.size());
      case ANOMALY -> deviationScore(metric, window);
    };
  }

  boolean fires(AlertRule rule, double triggerValue) {
    return rule.condition().test(triggerValue, rule.threshold());
  }

  private static OptionalDouble deviationScore(Metric metric, List<Metric> window) {
    double[] others =
        window.stream()
            .filter(m -> !m.id().equals(metric.id()))
            .mapToDouble(Metric::value)
            .toArray();
    if (others.length < MIN_ANOMALY_SAMPLES) {
      return OptionalDouble.empty();
    }
    double mean = 0;
    for (double v : others) {
      mean += v;
    }
    mean /= others.length;
    double variance = 0;
    for (double v : others) {
      variance += (v - mean) * (v - mean);
    }
    double stdDev = Math.sqrt(variance / others.length);
    return OptionalDouble.of(Math.abs(metric.value() - mean) / Math.max(stdDev, 1.0));
  }

  /**
   * A metric counts as an error when its metadata carries an HTTP status of 400 or above, {@code
   * error=true} or {@code status=error}, or when its name mentions "error".
   */
  static boolean isErrorLike(Metric metric) {
    var metadata = metric.metadata();
    if (statusCode(metadata.get("statusCode")) >= 400) {
      return true;
    }
    var error = metadata.get("error");
    if (Boolean.TRUE.equals(error) || "true".equalsIgnoreCase(String.valueOf(error))) {
      return true;
    }
    if ("error".equalsIgnoreCase(String.valueOf(metadata.get("status")))) {
      return true;
    }
    return metric.name().toLowerCase(Locale.ROOT).contains("error");
  }

  private static int statusCode(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }
}
