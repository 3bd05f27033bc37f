package com.mk.fx.qa.codepage.execution.cfg;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codepage.monitoring")
public class MonitoringCfg {

  @Positive private int bufferSize = 1000;

  @Min(1000)
  private long flushIntervalMs = 30_000;

  @Min(1000)
  private long systemSampleIntervalMs = 60_000;

  private boolean systemSamplingEnabled = true;

  private boolean defaultRulesEnabled = true;

  @NotNull private Notifications notifications = new Notifications();

  @Data
  public static class Notifications {

    /** Incoming webhook used by the slack channel; blank disables delivery. */
    private String slackWebhookUrl = "";

    private String emailRecipients = "";

    @Positive private int webhookTimeoutSeconds = 5;
  }
}
