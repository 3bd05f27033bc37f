package com.mk.fx.qa.codepage.execution.monitoring.alert;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import com.mk.fx.qa.codepage.execution.monitoring.Metric;
import com.mk.fx.qa.codepage.execution.monitoring.notify.NotificationDispatcher;
import com.mk.fx.qa.codepage.execution.store.KeyValueStore;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Evaluates alert rules against incoming metrics and keeps the alert lifecycle.
 *
 * <p>A rule has at most one unresolved alert. While it is open, further firings update it in place
 * (trigger value, metadata, occurrences, severity escalation) and send no notification; a new
 * alert, and a new notification, is only created once the open one has been resolved. A rule that
 * stops firing does not resolve its alert.
 */
@Slf4j
@Service
public class AlertEngine {

  private static final int MAX_NAME_LENGTH = 100;
  static final int DEFAULT_ALERT_LIMIT = 100;

  private final MonitoringCfg cfg;
  private final KeyValueStore<String, AlertRule> rules;
  private final KeyValueStore<String, Alert> alerts;
  private final NotificationDispatcher dispatcher;
  private final Clock clock;
  private final AlertRuleEvaluator evaluator = new AlertRuleEvaluator();

  // ruleId -> id of its unresolved alert; guarded by lock together with the stores' writes
  private final Map<String, String> openAlertByRule = new HashMap<>();
  private final Object lock = new Object();

  public AlertEngine(
      MonitoringCfg cfg,
      KeyValueStore<String, AlertRule> rules,
      KeyValueStore<String, Alert> alerts,
      NotificationDispatcher dispatcher,
      Clock clock) {
    this.cfg = cfg;
    this.rules = rules;
    this.alerts = alerts;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  @PostConstruct
  void installDefaultRules() {
    if (!cfg.isDefaultRulesEnabled()) {
      log.info("Default alert rules disabled");
      return;
    }
    DefaultAlertRules.definitions().forEach(this::createRule);
    log.info("Installed {} default alert rules", rules.size());
  }

  // ---------------------------------------------------------------------------
  // Rules
  // ---------------------------------------------------------------------------

  public AlertRule createRule(AlertRuleDefinition definition) {
    var now = clock.instant();
    var rule =
        AlertRule.builder()
            .id("rule-" + UUID.randomUUID())
            .name(definition.name())
            .type(definition.type())
            .metricName(definition.metricName())
            .condition(definition.condition())
            .threshold(definition.threshold())
            .windowMinutes(definition.windowMinutes())
            .active(definition.active() == null || definition.active())
            .channels(definition.channels())
            .createdAt(now)
            .updatedAt(now)
            .build();
    validate(rule);
    synchronized (lock) {
      rules.put(rule.id(), rule);
    }
    log.info("Created alert rule {} '{}' on {}", rule.id(), rule.name(), rule.metricName());
    return rule;
  }

  public AlertRule updateRule(String ruleId, AlertRuleUpdate update) {
    synchronized (lock) {
      var current = rules.get(ruleId).orElseThrow(() -> new AlertRuleNotFoundException(ruleId));
      var builder = current.toBuilder().updatedAt(clock.instant());
      if (update.getName() != null) builder.name(update.getName());
      if (update.getType() != null) builder.type(update.getType());
      if (update.getMetricName() != null) builder.metricName(update.getMetricName());
      if (update.getCondition() != null) builder.condition(update.getCondition());
      if (update.getThreshold() != null) builder.threshold(update.getThreshold());
      if (update.getWindowMinutes() != null) builder.windowMinutes(update.getWindowMinutes());
      if (update.getActive() != null) builder.active(update.getActive());
      if (update.getChannels() != null) builder.channels(update.getChannels());
      var updated = builder.build();
      validate(updated);
      rules.put(ruleId, updated);
      log.info("Updated alert rule {}", ruleId);
      return updated;
    }
  }

  /** Deletes the rule and resolves its open alert, if any. */
  public void deleteRule(String ruleId) {
    synchronized (lock) {
      if (!rules.delete(ruleId)) {
        throw new AlertRuleNotFoundException(ruleId);
      }
      var openId = openAlertByRule.remove(ruleId);
      if (openId != null) {
        alerts.get(openId).ifPresent(a -> alerts.put(a.id(), a.resolve(clock.instant())));
      }
    }
    log.info("Deleted alert rule {}", ruleId);
  }

  public List<AlertRule> rules() {
    return rules.list().stream().sorted(Comparator.comparing(AlertRule::createdAt)).toList();
  }

  public Optional<AlertRule> rule(String ruleId) {
    return rules.get(ruleId);
  }

  // ---------------------------------------------------------------------------
  // Evaluation
  // ---------------------------------------------------------------------------

  /**
   * Evaluates every active rule watching the metric's name. A rule that fails to evaluate is
   * logged and skipped.
   */
  public void evaluate(Metric metric, MetricWindow window) {
    var candidates =
        rules.list(r -> r.active() && r.metricName().equals(metric.name())).stream()
            .sorted(Comparator.comparing(AlertRule::createdAt))
            .toList();
    for (var rule : candidates) {
      try {
        var since = clock.instant().minus(Duration.ofMinutes(rule.windowMinutes()));
        var recent = window.recent(rule.metricName(), since);
        var trigger = evaluator.triggerValue(rule, metric, recent);
        if (trigger.isPresent() && evaluator.fires(rule, trigger.getAsDouble())) {
          fire(rule, metric, trigger.getAsDouble());
        }
      } catch (RuntimeException e) {
        log.error("Failed to evaluate alert rule {} for metric {}", rule.id(), metric.id(), e);
      }
    }
  }

  private void fire(AlertRule rule, Metric metric, double triggerValue) {
    var now = clock.instant();
    var severity = AlertSeverity.of(triggerValue, rule.threshold());
    var message = message(rule, metric, triggerValue);
    Alert created = null;
    synchronized (lock) {
      if (rules.get(rule.id()).isEmpty()) {
        return;
      }
      var openId = openAlertByRule.get(rule.id());
      var open = openId == null ? Optional.<Alert>empty() : alerts.get(openId);
      if (open.isPresent() && !open.get().resolved()) {
        var refired = open.get().refire(triggerValue, severity, message, metric.metadata(), now);
        alerts.put(refired.id(), refired);
        log.debug("Alert {} fired again ({} occurrences)", refired.id(), refired.occurrences());
      } else {
        created =
            new Alert(
                "alert-" + UUID.randomUUID(),
                rule.id(),
                rule.name(),
                severity,
                message,
                triggerValue,
                rule.threshold(),
                metric.metadata(),
                false,
                now,
                now,
                1,
                null);
        alerts.put(created.id(), created);
        openAlertByRule.put(rule.id(), created.id());
      }
    }
    if (created != null) {
      log.warn("Alert {} raised: {}", created.id(), created.message());
      dispatcher.dispatch(created, rule.channels());
    }
  }

  @VisibleForTesting
  static String message(AlertRule rule, Metric metric, double triggerValue) {
    var unit = metric.unit() == null ? "" : metric.unit();
    return switch (rule.type()) {
      case THRESHOLD -> String.format(
          "%s: %s is %s%s (threshold: %s%s)",
          rule.name(), metric.name(), format(triggerValue), unit, format(rule.threshold()), unit);
      case ERROR_RATE -> String.format(
          "%s: %s error rate is %s (threshold: %s)",
          rule.name(), metric.name(), format(triggerValue), format(rule.threshold()));
      case ANOMALY -> String.format(
          "%s: %s deviation score is %s for value %s%s (threshold: %s)",
          rule.name(),
          metric.name(),
          format(triggerValue),
          format(metric.value()),
          unit,
          format(rule.threshold()));
    };
  }

  private static String format(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  // ---------------------------------------------------------------------------
  // Alerts
  // ---------------------------------------------------------------------------

  public List<Alert> activeAlerts() {
    return alerts.list(a -> !a.resolved()).stream()
        .sorted(Comparator.comparing(Alert::createdAt).reversed())
        .toList();
  }

  /** All alerts, resolved included, newest first; a non-positive limit means the default. */
  public List<Alert> allAlerts(int limit) {
    return alerts.list().stream()
        .sorted(Comparator.comparing(Alert::createdAt).reversed())
        .limit(limit > 0 ? limit : DEFAULT_ALERT_LIMIT)
        .toList();
  }

  public Optional<Alert> alert(String alertId) {
    return alerts.get(alertId);
  }

  /** Resolves the alert. Resolving an already resolved alert returns it unchanged. */
  public Alert resolve(String alertId) {
    synchronized (lock) {
      var alert = alerts.get(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
      if (alert.resolved()) {
        return alert;
      }
      var resolved = alert.resolve(clock.instant());
      alerts.put(alertId, resolved);
      openAlertByRule.remove(alert.ruleId(), alertId);
      log.info("Resolved alert {} for rule {}", alertId, alert.ruleId());
      return resolved;
    }
  }

  private void validate(AlertRule rule) {
    if (rule.name() == null || rule.name().isBlank()) {
      throw new IllegalArgumentException("Rule name must not be blank");
    }
    if (rule.name().length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException(
          "Rule name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    if (rule.type() == null) {
      throw new IllegalArgumentException("Rule type is required");
    }
    if (rule.metricName() == null || rule.metricName().isBlank()) {
      throw new IllegalArgumentException("Rule metric name must not be blank");
    }
    if (rule.condition() == null) {
      throw new IllegalArgumentException("Rule condition is required");
    }
    if (!Double.isFinite(rule.threshold())) {
      throw new IllegalArgumentException("Rule threshold must be a finite number");
    }
    if (rule.windowMinutes() < AlertRule.MIN_WINDOW_MINUTES
        || rule.windowMinutes() > AlertRule.MAX_WINDOW_MINUTES) {
      throw new IllegalArgumentException(
          "Rule window must be between "
              + AlertRule.MIN_WINDOW_MINUTES
              + " and "
              + AlertRule.MAX_WINDOW_MINUTES
              + " minutes");
    }
    for (var channel : rule.channels()) {
      if (channel == null || channel.isBlank()) {
        throw new IllegalArgumentException("Rule channel names must not be blank");
      }
    }
  }
}
