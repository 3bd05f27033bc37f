package com.mk.fx.qa.codepage.execution.monitoring.notify;

import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;

/** Destination for newly created alerts, addressed by {@link #name()} from a rule's channels. */
public interface NotificationChannel {

  String name();

  /**
   * Delivers the alert. Failures are reported by throwing; the dispatcher isolates them from other
   * channels.
   */
  void send(Alert alert) throws NotificationException;
}
