package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionError;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EcmaError;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.JavaScriptException;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.WrappedException;

/**
 * Turns whatever escaped a script run into an {@link ExecutionError} with a closed {@link
 * ErrorKind}.
 *
 * <ul>
 *   <li>{@link EcmaError}: raised by the interpreter, named after the ECMAScript constructor.
 *   <li>{@link JavaScriptException}: a value thrown by the script; error objects keep their name.
 *   <li>{@link EvaluatorException}: compile failures, or exhausting the interpreter stack.
 *   <li>{@link WrappedException} and anything else: host failures surfaced as InternalError.
 * </ul>
 */
final class ScriptErrorClassifier {

  private static final String STACK_DEPTH_MESSAGE = "stack depth";

  private ScriptErrorClassifier() {}

  static ExecutionError classify(Throwable failure) {
    if (failure instanceof SandboxAbortError abort) {
      return ExecutionError.of(abort.getKind(), abort.getKind().label());
    }
    if (failure instanceof EcmaError ecma) {
      return fromRhino(ecma, ErrorKind.fromScriptName(ecma.getName()), ecma.getErrorMessage());
    }
    if (failure instanceof JavaScriptException thrown) {
      return fromThrownValue(thrown);
    }
    if (failure instanceof WrappedException wrapped) {
      var cause = wrapped.getWrappedException();
      return fromRhino(wrapped, ErrorKind.INTERNAL_ERROR, messageOf(cause));
    }
    if (failure instanceof EvaluatorException evaluator) {
      var details = evaluator.details();
      var kind =
          details != null && details.contains(STACK_DEPTH_MESSAGE)
              ? ErrorKind.RANGE_ERROR
              : ErrorKind.SYNTAX_ERROR;
      return fromRhino(evaluator, kind, details);
    }
    if (failure instanceof StackOverflowError) {
      return ExecutionError.of(ErrorKind.RANGE_ERROR, "Maximum call stack size exceeded");
    }
    return ExecutionError.of(ErrorKind.INTERNAL_ERROR, messageOf(failure));
  }

  private static ExecutionError fromThrownValue(JavaScriptException thrown) {
    var value = thrown.getValue();
    if (value instanceof Scriptable error) {
      var name = ScriptableObject.getProperty(error, "name");
      var message = ScriptableObject.getProperty(error, "message");
      var kind =
          name instanceof CharSequence ? ErrorKind.fromScriptName(name.toString()) : ErrorKind.ERROR;
      var text = message instanceof CharSequence ? message.toString() : thrown.details();
      return fromRhino(thrown, kind, text);
    }
    return fromRhino(thrown, ErrorKind.ERROR, Context.toString(value));
  }

  private static ExecutionError fromRhino(RhinoException e, ErrorKind kind, String message) {
    var stack = e.getScriptStackTrace();
    return new ExecutionError(
        message == null || message.isBlank() ? kind.label() : message,
        stack == null || stack.isBlank() ? null : stack,
        kind,
        positive(e.lineNumber()),
        positive(e.columnNumber()));
  }

  private static Integer positive(int value) {
    return value > 0 ? value : null;
  }

  private static String messageOf(Throwable t) {
    var msg = t.getMessage();
    return msg == null || msg.isBlank() ? t.getClass().getSimpleName() + " occurred" : msg;
  }
}
