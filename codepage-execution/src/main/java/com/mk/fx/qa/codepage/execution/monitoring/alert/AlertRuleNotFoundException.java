package com.mk.fx.qa.codepage.execution.monitoring.alert;

public class AlertRuleNotFoundException extends RuntimeException {

  public AlertRuleNotFoundException(String ruleId) {
    super("Alert rule not found: " + ruleId);
  }
}
