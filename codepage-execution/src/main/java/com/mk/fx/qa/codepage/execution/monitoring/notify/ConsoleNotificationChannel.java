package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Operator-facing one-liner on the dedicated {@code alerts.console} logger. */
@Slf4j(topic = "alerts.console")
@Component
public class ConsoleNotificationChannel implements NotificationChannel {

  @Override
  public String name() {
    return "console";
  }

  @Override
  public void send(Alert alert) {
    log.warn(
        "[ALERT] {} - {} (id: {})",
        alert.severity().value().toUpperCase(),
        alert.message(),
        alert.id());
  }
}
