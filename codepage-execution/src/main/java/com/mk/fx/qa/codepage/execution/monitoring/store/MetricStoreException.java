package com.mk.fx.qa.codepage.execution.monitoring.store;

/** The retained metric store could not accept or serve data. */
public class MetricStoreException extends RuntimeException {

  public MetricStoreException(String message) {
    super(message);
  }

  public MetricStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
