package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import lombok.Getter;

/**
 * Unwinds a script that must stop running.
 *
 * <p>Extends {@link Error} because the interpreter neither runs script {@code catch} nor {@code
 * finally} blocks for errors, so user code cannot intercept the abort.
 */
@Getter
public class SandboxAbortError extends Error {

  private final ErrorKind kind;

  public SandboxAbortError(ErrorKind kind) {
    super(kind.label(), null, false, false);
    this.kind = kind;
  }
}
