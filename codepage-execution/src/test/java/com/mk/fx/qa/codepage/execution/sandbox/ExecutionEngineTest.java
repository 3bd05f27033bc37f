package com.mk.fx.qa.codepage.execution.sandbox;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.codepage.execution.cfg.SandboxCfg;
import com.mk.fx.qa.codepage.execution.mockapi.MockDataFixtures;
import com.mk.fx.qa.codepage.execution.mockapi.MockExternalApi;
import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfig;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfigOverrides;
import com.mk.fx.qa.codepage.execution.model.ExecutionEnvironment;
import com.mk.fx.qa.codepage.execution.model.ExecutionRequest;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.model.ExecutionStatus;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutionEngineTest {

  private ExecutionEngine engine;

  private static SandboxCfg cfg() {
    SandboxCfg cfg = new SandboxCfg();
    cfg.setConcurrency(2);
    cfg.setPollIntervalMs(20);
    cfg.setMockLatencyFactor(0);
    return cfg;
  }

  private static ExecutionConfig config(long timeoutMs, int apiCallLimit) {
    return new ExecutionConfig(
        timeoutMs,
        cfg().getDefaults().getMemoryLimitBytes(),
        apiCallLimit,
        ExecutionEnvironment.DEVELOPMENT);
  }

  private ExecutionEngine newEngine(List<ExecutionResultListener> listeners) {
    var cfg = cfg();
    return newEngine(cfg, new ScriptSandbox(cfg), listeners);
  }

  private ExecutionEngine newEngine(
      SandboxCfg cfg, ScriptSandbox sandbox, List<ExecutionResultListener> listeners) {
    engine =
        new ExecutionEngine(
            cfg, sandbox, new ThreadMemorySampler(), new MockDataFixtures(), listeners);
    return engine;
  }

  private ExecutionResult run(String script) {
    return newEngine(List.of()).execute(script, Map.of(), config(10_000, 100));
  }

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.shutdown();
    }
  }

  @Test
  void execute_passedScriptHasNoErrors() {
    var result = run("var x = 1 + 1; console.log('sum', x);");

    assertEquals(ExecutionStatus.PASSED, result.status());
    assertTrue(result.errors().isEmpty());
    assertFalse(result.hasErrors());
    assertEquals(1, result.logs().size());
    assertTrue(result.logs().get(0).endsWith("sum 2"));
    assertEquals(ExecutionRequest.ADHOC_PROJECT, result.projectId());
  }

  @Test
  void execute_consoleLevelsArePrefixed() {
    var result = run("console.warn('careful'); console.error({code: 7});");

    assertEquals(2, result.logs().size());
    assertTrue(result.logs().get(0).endsWith("WARN: careful"));
    assertTrue(result.logs().get(1).endsWith("ERROR: {\"code\":7}"));
  }

  @Test
  void execute_infiniteLoopTimesOut() {
    var started = System.nanoTime();
    var result =
        newEngine(List.of()).execute("while (true) {}", Map.of(), config(200, 100));
    var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.TIMEOUT_EXCEEDED, result.errors().get(0).kind());
    assertTrue(elapsedMs < 5_000, "engine returned after " + elapsedMs + " ms");
  }

  @Test
  void execute_scriptCannotCatchTimeout() {
    var result =
        newEngine(List.of())
            .execute(
                "try { while (true) {} } catch (e) { console.log('caught'); }",
                Map.of(),
                config(200, 100));

    assertEquals(ErrorKind.TIMEOUT_EXCEEDED, result.errors().get(0).kind());
    assertTrue(result.logs().stream().noneMatch(l -> l.endsWith("caught")));
  }

  @Test
  void execute_apiCallLimitStopsFurtherCalls() {
    var script =
        "for (var i = 0; i < 5; i++) { api.query({tableId: 'vehicles_table_id'}); }";
    var result = newEngine(List.of()).execute(script, Map.of(), config(10_000, 3));

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals(3, result.apiCallCount());
    assertEquals(3, result.apiCalls().size());
    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.API_CALL_LIMIT_EXCEEDED, result.errors().get(0).kind());
    assertTrue(result.logs().stream().anyMatch(l -> l.contains("API call limit exceeded")));
  }

  @Test
  void execute_thrownTypeErrorIsClassified() {
    var result = run("var a = null;\na.missing();");

    assertEquals(ExecutionStatus.ERROR, result.status());
    var error = result.errors().get(0);
    assertEquals(ErrorKind.TYPE_ERROR, error.kind());
    assertEquals(2, error.lineNumber());
    assertTrue(error.isCritical());
  }

  @Test
  void execute_userThrownErrorKeepsName() {
    var result = run("throw new RangeError('too far');");

    assertEquals(ErrorKind.RANGE_ERROR, result.errors().get(0).kind());
    assertEquals("too far", result.errors().get(0).message());
  }

  @Test
  void execute_thrownStringIsPlainError() {
    var result = run("throw 'plain';");

    assertEquals(ErrorKind.ERROR, result.errors().get(0).kind());
    assertEquals("plain", result.errors().get(0).message());
  }

  @Test
  void execute_syntaxErrorIsReported() {
    var result = run("var = ;");

    assertEquals(ErrorKind.SYNTAX_ERROR, result.errors().get(0).kind());
  }

  @Test
  void execute_unknownIdentifierIsReferenceError() {
    var result = run("notDefined + 1;");

    assertEquals(ErrorKind.REFERENCE_ERROR, result.errors().get(0).kind());
  }

  @Test
  void execute_runawayRecursionIsRangeError() {
    var result = run("function f() { return f(); } f();");

    assertEquals(ErrorKind.RANGE_ERROR, result.errors().get(0).kind());
  }

  @Test
  void execute_evalAndJavaAreNotReachable() {
    var result =
        run("console.log(typeof eval, typeof java, typeof Packages, typeof require);");

    assertEquals(ExecutionStatus.PASSED, result.status());
    assertTrue(result.logs().get(0).endsWith("undefined undefined undefined undefined"));
  }

  @Test
  void execute_qbPromisesResolveBeforeResultIsBuilt() {
    var script =
        "QB.on('ready', function () {\n"
            + "  return QB.api.queryRecords({tableId: 'vehicles_table_id'}).then(function (r) {\n"
            + "    console.log('vehicles', r.data.length);\n"
            + "  });\n"
            + "});";
    var result = run(script);

    assertEquals(ExecutionStatus.PASSED, result.status());
    assertEquals(1, result.apiCallCount());
    assertTrue(result.logs().get(0).endsWith("vehicles 3"));
  }

  @Test
  void execute_testDataIsExposed() {
    var result =
        newEngine(List.of())
            .execute(
                "console.log(testData.customer.name);",
                Map.of("customer", Map.of("name", "Ada")),
                config(10_000, 100));

    assertTrue(result.logs().get(0).endsWith("Ada"));
  }

  @Test
  void execute_resourceUsageReportsApiCalls() {
    var result =
        run("api.get({recordId: 'r1'}); console.log(getResourceUsage().apiCallCount);");

    assertTrue(result.logs().get(0).endsWith("1"));
  }

  @Test
  void execute_memoryLimitIsEnforced() {
    var script = "var a = []; while (true) { a.push({i: a.length, s: 'x' + a.length}); }";
    var result =
        newEngine(List.of())
            .execute(
                script,
                Map.of(),
                new ExecutionConfig(20_000, 1_000_000, 100, ExecutionEnvironment.DEVELOPMENT));

    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.MEMORY_EXCEEDED, result.errors().get(0).kind());
    assertTrue(result.peakMemoryBytes() > 1_000_000);
  }

  @Test
  void execute_shortLivedAllocationsStayUnderDefaultMemoryLimit() {
    var script =
        "var s = 0;\n"
            + "for (var i = 0; i < 3e6; i++) { var o = {a: i}; s += o.a; }\n"
            + "console.log('sum', s);";
    var defaults = cfg().getDefaults();
    var result =
        newEngine(List.of())
            .execute(
                script,
                Map.of(),
                new ExecutionConfig(
                    60_000,
                    defaults.getMemoryLimitBytes(),
                    defaults.getApiCallLimit(),
                    ExecutionEnvironment.DEVELOPMENT));

    assertEquals(ExecutionStatus.PASSED, result.status(), () -> result.errors().toString());
    assertTrue(result.peakMemoryBytes() < defaults.getMemoryLimitBytes());
    assertTrue(result.logs().get(0).endsWith("sum 4499998500000"));
  }

  @Test
  void execute_limitViolationSupersedesLaterPromiseError() {
    var script =
        "var q = {tableId: 'vehicles_table_id'};\n"
            + "QB.api.queryRecords(q)\n"
            + "  .then(function () { return QB.api.queryRecords(q); })\n"
            + "  .then(function () { console.log('second call returned'); return null.x; });";
    var result = newEngine(List.of()).execute(script, Map.of(), config(10_000, 1));

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.API_CALL_LIMIT_EXCEEDED, result.errors().get(0).kind());
    assertEquals(1, result.apiCallCount());
    assertTrue(result.logs().stream().noneMatch(l -> l.endsWith("second call returned")));
  }

  @Test
  void execute_limitViolationCannotBeCaughtAndRethrown() {
    var script =
        "var q = {tableId: 'vehicles_table_id'};\n"
            + "try { api.query(q); api.query(q); } catch (e) { console.log('caught'); }\n"
            + "null.y;";
    var result = newEngine(List.of()).execute(script, Map.of(), config(10_000, 1));

    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.API_CALL_LIMIT_EXCEEDED, result.errors().get(0).kind());
    assertTrue(result.logs().stream().noneMatch(l -> l.endsWith("caught")));
  }

  @Test
  void execute_violationRecordedBeforeScriptFailureWins() {
    var cfg = cfg();
    var sandbox =
        new ScriptSandbox(cfg) {
          @Override
          public void run(ExecutionContext context, MockExternalApi api, String scriptSource) {
            context.getMonitor().abort(ErrorKind.MEMORY_EXCEEDED);
            super.run(context, api, "null.x;");
          }
        };

    var result = newEngine(cfg, sandbox, List.of()).execute("1;", Map.of(), config(10_000, 10));

    assertEquals(1, result.errors().size());
    assertEquals(ErrorKind.MEMORY_EXCEEDED, result.errors().get(0).kind());
  }

  @Test
  void execute_requestOverridesAreMerged() {
    var request =
        new ExecutionRequest(
            "project-1",
            null,
            "while (true) {}",
            null,
            ExecutionConfigOverrides.builder()
                .timeoutMs(150L)
                .environment(ExecutionEnvironment.STAGING)
                .build());

    var result = newEngine(List.of()).execute(request);

    assertEquals("project-1", result.projectId());
    assertEquals(ExecutionRequest.CURRENT_VERSION, result.versionId());
    assertEquals(ExecutionEnvironment.STAGING, result.environment());
    assertEquals(ErrorKind.TIMEOUT_EXCEEDED, result.errors().get(0).kind());
  }

  @Test
  void execute_invalidOverridesRejectedBeforeRunning() {
    var request =
        new ExecutionRequest(
            "p",
            "v",
            "1;",
            null,
            ExecutionConfigOverrides.builder().timeoutMs(-5L).build());
    var engine = newEngine(List.of());

    assertThrows(IllegalArgumentException.class, () -> engine.execute(request));
    assertEquals(0, engine.stats().completedExecutions());
  }

  @Test
  void cancel_activeRunEndsWithCancelled() throws Exception {
    var engine = newEngine(List.of());
    var pending =
        CompletableFuture.supplyAsync(
            () -> engine.execute("while (true) {}", Map.of(), config(30_000, 100)));

    String testId = null;
    for (int i = 0; i < 200 && testId == null; i++) {
      testId =
          engine.activeExecutions().stream()
              .filter(ActiveExecution::started)
              .map(ActiveExecution::testId)
              .findFirst()
              .orElse(null);
      if (testId == null) {
        Thread.sleep(10);
      }
    }
    assertNotNull(testId, "execution never became active");

    assertTrue(engine.cancel(testId));
    var result = pending.get(5, TimeUnit.SECONDS);

    assertEquals(ErrorKind.EXECUTION_CANCELLED, result.errors().get(0).kind());
    assertTrue(engine.activeExecutions().isEmpty());
    assertFalse(engine.cancel(testId));
  }

  @Test
  void listeners_failureDoesNotAffectOthersOrCaller() {
    List<ExecutionResult> received = new CopyOnWriteArrayList<>();
    ExecutionResultListener failing =
        r -> {
          throw new IllegalStateException("listener down");
        };
    var engine = newEngine(List.of(failing, received::add));

    var result = engine.execute("1 + 1;", Map.of(), config(10_000, 10));

    assertEquals(ExecutionStatus.PASSED, result.status());
    assertEquals(List.of(result), received);
    assertEquals(1, engine.stats().completedExecutions());
  }

  @Test
  void mockData_updateIsStored() {
    var engine = newEngine(List.of());
    engine.updateMockData("colours", List.of(Map.of("name", "red")));

    assertEquals(1, engine.getMockData("colours").orElseThrow().size());
    assertTrue(engine.isHealthy());
  }

  @Test
  void mockData_recordsMayHoldNullValues() {
    var engine = newEngine(List.of());
    Map<String, Object> record = new HashMap<>();
    record.put("id", 1);
    record.put("notes", null);

    engine.updateMockData("vehicles", List.of(record));

    var stored = engine.getMockData("vehicles").orElseThrow();
    assertEquals(1, stored.size());
    assertTrue(stored.get(0).containsKey("notes"));
    assertNull(stored.get(0).get("notes"));
  }
}
