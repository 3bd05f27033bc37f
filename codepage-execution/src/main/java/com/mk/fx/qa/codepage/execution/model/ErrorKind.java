package com.mk.fx.qa.codepage.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Closed classification of everything that can end an execution abnormally.
 *
 * <p>Script kinds mirror the ECMAScript error constructors; unknown error names thrown by a script
 * fall back to {@link #ERROR}. Resource-limit kinds are produced by the host, never by the script.
 */
public enum ErrorKind {
  ERROR("Error", Category.SCRIPT),
  SYNTAX_ERROR("SyntaxError", Category.SCRIPT),
  REFERENCE_ERROR("ReferenceError", Category.SCRIPT),
  TYPE_ERROR("TypeError", Category.SCRIPT),
  RANGE_ERROR("RangeError", Category.SCRIPT),
  URI_ERROR("URIError", Category.SCRIPT),
  EVAL_ERROR("EvalError", Category.SCRIPT),
  INTERNAL_ERROR("InternalError", Category.SCRIPT),
  TIMEOUT_EXCEEDED("TimeoutExceeded", Category.RESOURCE_LIMIT),
  MEMORY_EXCEEDED("MemoryExceeded", Category.RESOURCE_LIMIT),
  API_CALL_LIMIT_EXCEEDED("ApiCallLimitExceeded", Category.RESOURCE_LIMIT),
  EXECUTION_CANCELLED("ExecutionCancelled", Category.HOST);

  public enum Category {
    SCRIPT,
    RESOURCE_LIMIT,
    HOST
  }

  private final String label;
  private final Category category;

  ErrorKind(String label, Category category) {
    this.label = label;
    this.category = category;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public Category category() {
    return category;
  }

  /** True for kinds that abort a run from the host side and override any script error. */
  public boolean isAbort() {
    return category != Category.SCRIPT;
  }

  /** Maps a script error name (e.g. {@code TypeError}) to a kind. Unknown names map to ERROR. */
  public static ErrorKind fromScriptName(String name) {
    if (name == null) {
      return ERROR;
    }
    return Arrays.stream(values())
        .filter(kind -> kind.category == Category.SCRIPT && kind.label.equals(name))
        .findFirst()
        .orElse(ERROR);
  }

  @JsonCreator
  public static ErrorKind fromLabel(String label) {
    return Arrays.stream(values())
        .filter(kind -> kind.label.equals(label) || kind.name().equalsIgnoreCase(label))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown error kind: " + label));
  }
}
