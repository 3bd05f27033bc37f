package com.mk.fx.qa.codepage.execution.sandbox;

import java.time.Instant;
import java.util.List;

/** Console bound to one run; every line lands in the run's log instead of a shared stream. */
public class SandboxConsole {

  private final List<String> sink;

  SandboxConsole(List<String> sink) {
    this.sink = sink;
  }

  public void log(String message) {
    append("", message);
  }

  public void warn(String message) {
    append("WARN: ", message);
  }

  public void error(String message) {
    append("ERROR: ", message);
  }

  private void append(String level, String message) {
    sink.add("[" + Instant.now() + "] " + level + message);
  }
}
