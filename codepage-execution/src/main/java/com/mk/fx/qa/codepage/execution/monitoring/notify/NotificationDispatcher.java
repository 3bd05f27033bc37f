package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Routes an alert to the channels its rule names. A failing channel never stops the others. */
@Slf4j
@Component
public class NotificationDispatcher {

  private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();

  public NotificationDispatcher(List<NotificationChannel> channels) {
    channels.forEach(channel -> this.channels.put(channel.name(), channel));
    log.info("Notification channels available: {}", this.channels.keySet());
  }

  /** Returns how many channels accepted the alert. */
  public int dispatch(Alert alert, Collection<String> channelNames) {
    int delivered = 0;
    for (var name : channelNames) {
      var channel = channels.get(name);
      if (channel == null) {
        log.warn("Unknown notification channel '{}' for alert {}", name, alert.id());
        continue;
      }
      try {
        channel.send(alert);
        delivered++;
      } catch (Exception e) {
        log.error("Channel '{}' failed to deliver alert {}: {}", name, alert.id(), e.getMessage(), e);
      }
    }
    return delivered;
  }

  public boolean supports(String channelName) {
    return channels.containsKey(channelName);
  }
}
