package com.mk.fx.qa.codepage.execution.model;

import java.util.Locale;

/**
 * A single failure attached to an {@link ExecutionResult}.
 *
 * @param message human-readable description
 * @param stack script stack trace, if one was available
 * @param kind classification of the failure
 * @param lineNumber 1-based line in the script, if known
 * @param columnNumber 1-based column in the script, if known
 */
public record ExecutionError(
    String message, String stack, ErrorKind kind, Integer lineNumber, Integer columnNumber) {

  public static ExecutionError of(ErrorKind kind, String message) {
    return new ExecutionError(message, null, kind, null, null);
  }

  /** ReferenceError/TypeError, resource exhaustion, or a message mentioning timeout or memory. */
  public boolean isCritical() {
    if (kind == ErrorKind.REFERENCE_ERROR
        || kind == ErrorKind.TYPE_ERROR
        || kind == ErrorKind.TIMEOUT_EXCEEDED
        || kind == ErrorKind.MEMORY_EXCEEDED) {
      return true;
    }
    var lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
    return lower.contains("timeout") || lower.contains("memory");
  }
}
