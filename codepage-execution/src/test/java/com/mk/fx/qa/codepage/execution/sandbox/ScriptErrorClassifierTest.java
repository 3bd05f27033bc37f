package com.mk.fx.qa.codepage.execution.sandbox;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.WrappedException;

class ScriptErrorClassifierTest {

  @Test
  void abortError_keepsItsKind() {
    var error = ScriptErrorClassifier.classify(new SandboxAbortError(ErrorKind.MEMORY_EXCEEDED));

    assertEquals(ErrorKind.MEMORY_EXCEEDED, error.kind());
    assertEquals("MemoryExceeded", error.message());
  }

  @Test
  void evaluatorException_isSyntaxError() {
    var error =
        ScriptErrorClassifier.classify(
            new EvaluatorException("missing ; before statement", "codepage.js", 3, "x y", 2));

    assertEquals(ErrorKind.SYNTAX_ERROR, error.kind());
    assertEquals("missing ; before statement", error.message());
    assertEquals(3, error.lineNumber());
    assertEquals(2, error.columnNumber());
  }

  @Test
  void stackDepthEvaluatorException_isRangeError() {
    var error =
        ScriptErrorClassifier.classify(new EvaluatorException("Exceeded maximum stack depth"));

    assertEquals(ErrorKind.RANGE_ERROR, error.kind());
    assertNull(error.lineNumber());
  }

  @Test
  void javaStackOverflow_isRangeError() {
    var error = ScriptErrorClassifier.classify(new StackOverflowError());

    assertEquals(ErrorKind.RANGE_ERROR, error.kind());
  }

  @Test
  void wrappedHostFailure_isInternalError() {
    var error =
        ScriptErrorClassifier.classify(new WrappedException(new IllegalStateException("boom")));

    assertEquals(ErrorKind.INTERNAL_ERROR, error.kind());
    assertEquals("boom", error.message());
  }

  @Test
  void unknownThrowable_isInternalErrorWithFallbackMessage() {
    var error = ScriptErrorClassifier.classify(new RuntimeException());

    assertEquals(ErrorKind.INTERNAL_ERROR, error.kind());
    assertEquals("RuntimeException occurred", error.message());
  }
}
