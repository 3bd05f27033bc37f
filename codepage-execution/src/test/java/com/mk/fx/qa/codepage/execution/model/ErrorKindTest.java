package com.mk.fx.qa.codepage.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ErrorKindTest {

  @Test
  void fromScriptName_unknownNamesFallBackToError() {
    assertEquals(ErrorKind.TYPE_ERROR, ErrorKind.fromScriptName("TypeError"));
    assertEquals(ErrorKind.ERROR, ErrorKind.fromScriptName("ValidationError"));
    assertEquals(ErrorKind.ERROR, ErrorKind.fromScriptName(null));
    assertEquals(ErrorKind.ERROR, ErrorKind.fromScriptName("TimeoutExceeded"));
  }

  @Test
  void isAbort_onlyForHostKinds() {
    assertTrue(ErrorKind.TIMEOUT_EXCEEDED.isAbort());
    assertTrue(ErrorKind.EXECUTION_CANCELLED.isAbort());
    assertFalse(ErrorKind.RANGE_ERROR.isAbort());
  }

  @Test
  void isCritical_coversKindsAndMessages() {
    assertTrue(ExecutionError.of(ErrorKind.REFERENCE_ERROR, "x is not defined").isCritical());
    assertTrue(ExecutionError.of(ErrorKind.ERROR, "Gateway timeout").isCritical());
    assertTrue(ExecutionError.of(ErrorKind.ERROR, "Out of Memory").isCritical());
    assertFalse(ExecutionError.of(ErrorKind.RANGE_ERROR, "bad length").isCritical());
  }
}
