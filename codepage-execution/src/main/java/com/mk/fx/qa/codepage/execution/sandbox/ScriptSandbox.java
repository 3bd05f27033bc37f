package com.mk.fx.qa.codepage.execution.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import com.mk.fx.qa.codepage.execution.cfg.SandboxCfg;
import com.mk.fx.qa.codepage.execution.mockapi.ApiCallLimitExceededException;
import com.mk.fx.qa.codepage.execution.mockapi.ApiOperation;
import com.mk.fx.qa.codepage.execution.mockapi.MockExternalApi;
import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.NativeObject;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.springframework.stereotype.Component;

/**
 * Evaluates a codepage script on the calling thread inside a locked-down Rhino scope.
 *
 * <p>The scope holds the safe standard objects ({@code JSON}, {@code Math}, {@code Date}, {@code
 * Promise}, ...) without {@code eval} or any access to Java packages, plus the injected bindings:
 * {@code console}, {@code api}, {@code QB}, {@code testData} and {@code getResourceUsage()}.
 * Pending promise continuations are drained before {@link #run} returns.
 */
@Slf4j
@Component
public class ScriptSandbox {

  static final String SCRIPT_NAME = "codepage.js";
  private static final String BOOTSTRAP_RESOURCE = "sandbox/qb-bootstrap.js";
  private static final int BINDING = ScriptableObject.READONLY | ScriptableObject.PERMANENT;

  private final SandboxContextFactory contextFactory;
  private final JsonBridge bridge;
  private final String bootstrapSource;

  public ScriptSandbox(SandboxCfg cfg) {
    this.contextFactory =
        new SandboxContextFactory(cfg.getInstructionObserverThreshold(), cfg.getMaxStackDepth());
    this.bridge = new JsonBridge(new ObjectMapper());
    this.bootstrapSource = loadBootstrap();
  }

  /**
   * Runs the script to completion, including queued promise reactions.
   *
   * @throws org.mozilla.javascript.RhinoException when the script fails to compile or throws
   * @throws SandboxAbortError when the run was abandoned while the script was executing
   */
  public void run(ExecutionContext context, MockExternalApi api, String scriptSource) {
    Context cx = contextFactory.enterContext();
    try {
      cx.putThreadLocal(ResourceMonitor.class, context.getMonitor());
      ScriptableObject scope = cx.initSafeStandardObjects();
      scope.delete("eval");

      bind(scope, "console", console(scope, context.getConsole()));
      bind(scope, "api", apiBinding(scope, api, context));
      bind(scope, "testData", bridge.toScript(cx, scope, context.getTestData()));
      bind(
          scope,
          "getResourceUsage",
          new HostFunction(scope, "getResourceUsage", 0, (c, s, args) -> usage(c, s, context)));

      cx.evaluateString(scope, bootstrapSource, "qb-bootstrap.js", 1, null);

      Script script = cx.compileString(scriptSource, SCRIPT_NAME, 1, null);
      script.exec(cx, scope);
      cx.processMicrotasks();
    } finally {
      Context.exit();
    }
  }

  private Scriptable console(ScriptableObject scope, SandboxConsole console) {
    var obj = newObject(scope);
    Stream.of("log", "info", "debug")
        .forEach(name -> define(obj, scope, name, console::log));
    define(obj, scope, "warn", console::warn);
    define(obj, scope, "error", console::error);
    return obj;
  }

  private void define(NativeObject obj, Scriptable scope, String name, Consumer<String> sink) {
    obj.defineProperty(
        name,
        new HostFunction(
            scope,
            name,
            0,
            (cx, s, args) -> {
              sink.accept(
                  Stream.of(args).map(arg -> bridge.render(cx, s, arg)).collect(Collectors.joining(" ")));
              return Context.getUndefinedValue();
            }),
        BINDING);
  }

  private Scriptable apiBinding(
      ScriptableObject scope, MockExternalApi api, ExecutionContext context) {
    var obj = newObject(scope);
    for (ApiOperation operation : ApiOperation.values()) {
      obj.defineProperty(
          operation.scriptName(),
          new HostFunction(
              scope,
              operation.scriptName(),
              1,
              (cx, s, args) -> callApi(cx, s, api, context, operation, args)),
          BINDING);
    }
    return obj;
  }

  private Object callApi(
      Context cx,
      Scriptable scope,
      MockExternalApi api,
      ExecutionContext context,
      ApiOperation operation,
      Object[] args) {
    var params = bridge.toJavaMap(cx, scope, args.length > 0 ? args[0] : null);
    try {
      return bridge.toScript(cx, scope, api.invoke(operation, params));
    } catch (ApiCallLimitExceededException e) {
      log.debug("Run {} rejected {}: {}", context.getTestId(), operation, e.getMessage());
      throw new SandboxAbortError(ErrorKind.API_CALL_LIMIT_EXCEEDED);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SandboxAbortError(
          context.getMonitor().violation().orElse(ErrorKind.EXECUTION_CANCELLED));
    }
  }

  private Object usage(Context cx, Scriptable scope, ExecutionContext context) {
    var usage = new LinkedHashMap<String, Object>();
    usage.put("memoryUsage", context.peakMemoryBytes());
    usage.put("apiCallCount", context.getApiCalls().size());
    usage.put("executionTime", context.getMonitor().elapsed().toMillis());
    return bridge.toScript(cx, scope, usage);
  }

  private static NativeObject newObject(ScriptableObject scope) {
    var obj = new NativeObject();
    obj.setParentScope(scope);
    obj.setPrototype(ScriptableObject.getObjectPrototype(scope));
    return obj;
  }

  private static void bind(ScriptableObject scope, String name, Object value) {
    scope.defineProperty(name, value, BINDING);
  }

  private static String loadBootstrap() {
    try {
      return Resources.toString(Resources.getResource(BOOTSTRAP_RESOURCE), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load " + BOOTSTRAP_RESOURCE, e);
    }
  }
}
