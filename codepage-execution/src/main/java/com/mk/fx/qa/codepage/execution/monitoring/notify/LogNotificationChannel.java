package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import java.util.LinkedHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Structured JSON line per alert on the {@code alerts.log} logger, for log shipping. */
@Slf4j(topic = "alerts.log")
@Component
public class LogNotificationChannel implements NotificationChannel {

  private final ObjectMapper objectMapper;

  public LogNotificationChannel(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "log";
  }

  @Override
  public void send(Alert alert) throws NotificationException {
    var entry = new LinkedHashMap<String, Object>();
    entry.put("type", "alert");
    entry.put("level", alert.severity().value());
    entry.put("message", alert.message());
    entry.put("alertId", alert.id());
    entry.put("ruleId", alert.ruleId());
    entry.put("timestamp", alert.lastTriggeredAt());
    entry.put("metadata", alert.metadata());
    try {
      log.warn(objectMapper.writeValueAsString(entry));
    } catch (JsonProcessingException e) {
      throw new NotificationException("Failed to serialise alert " + alert.id(), e);
    }
  }
}
