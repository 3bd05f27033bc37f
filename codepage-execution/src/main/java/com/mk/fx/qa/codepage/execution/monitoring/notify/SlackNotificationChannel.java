package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Posts alerts to a Slack incoming webhook. Does nothing while no webhook URL is configured. */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

  private final ObjectMapper objectMapper;
  private final String webhookUrl;
  private final Duration timeout;
  private final HttpClient httpClient;

  public SlackNotificationChannel(MonitoringCfg cfg, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.webhookUrl = cfg.getNotifications().getSlackWebhookUrl();
    this.timeout = Duration.ofSeconds(cfg.getNotifications().getWebhookTimeoutSeconds());
    this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  @Override
  public String name() {
    return "slack";
  }

  @Override
  public void send(Alert alert) throws NotificationException {
    if (webhookUrl == null || webhookUrl.isBlank()) {
      log.debug("Slack webhook not configured, alert {} not posted", alert.id());
      return;
    }
    try {
      var body =
          objectMapper.writeValueAsString(
              Map.of(
                  "text",
                  ":rotating_light: *" + alert.severity().value().toUpperCase() + "* " + alert.message()));
      var request =
          HttpRequest.newBuilder()
              .uri(URI.create(webhookUrl))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(body))
              .build();
      var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 300) {
        throw new NotificationException(
            "Slack webhook answered " + response.statusCode() + ": " + response.body());
      }
      log.debug("Alert {} posted to Slack", alert.id());
    } catch (JsonProcessingException e) {
      throw new NotificationException("Failed to serialise alert " + alert.id(), e);
    } catch (IOException e) {
      throw new NotificationException("Slack webhook call failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotificationException("Interrupted while posting alert " + alert.id(), e);
    }
  }
}
