package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the mail that would be sent to the configured recipients to the {@code alerts.email}
 * outbox logger. No SMTP transport is wired.
 */
@Slf4j(topic = "alerts.email")
@Component
public class EmailNotificationChannel implements NotificationChannel {

  private final List<String> recipients;

  public EmailNotificationChannel(MonitoringCfg cfg) {
    this.recipients =
        Arrays.stream(cfg.getNotifications().getEmailRecipients().split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
  }

  @Override
  public String name() {
    return "email";
  }

  @Override
  public void send(Alert alert) {
    if (recipients.isEmpty()) {
      log.debug("No email recipients configured, alert {} not mailed", alert.id());
      return;
    }
    log.info(
        "To: {} | Subject: [{}] {} | Body: {} (trigger {}, threshold {})",
        String.join(", ", recipients),
        alert.severity().value().toUpperCase(),
        alert.ruleName(),
        alert.message(),
        alert.triggerValue(),
        alert.threshold());
  }

  List<String> recipients() {
    return recipients;
  }
}
