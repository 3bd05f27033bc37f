package com.mk.fx.qa.codepage.execution.monitoring.alert;

public class AlertNotFoundException extends RuntimeException {

  public AlertNotFoundException(String alertId) {
    super("Alert not found: " + alertId);
  }
}
