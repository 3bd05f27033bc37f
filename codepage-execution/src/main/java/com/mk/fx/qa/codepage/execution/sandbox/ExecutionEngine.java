package com.mk.fx.qa.codepage.execution.sandbox;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.codepage.execution.cfg.SandboxCfg;
import com.mk.fx.qa.codepage.execution.mockapi.ApiCallRecord;
import com.mk.fx.qa.codepage.execution.mockapi.LatencySimulator;
import com.mk.fx.qa.codepage.execution.mockapi.MockDataFixtures;
import com.mk.fx.qa.codepage.execution.mockapi.MockExternalApi;
import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfig;
import com.mk.fx.qa.codepage.execution.model.ExecutionError;
import com.mk.fx.qa.codepage.execution.model.ExecutionRequest;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.model.ExecutionStatus;
import com.mk.fx.qa.codepage.execution.model.PerformanceMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs codepage scripts in the sandbox, one worker-pool task per run, and turns every outcome into
 * an {@link ExecutionResult}.
 *
 * <p>The calling thread waits on the run's future in ticks of at most {@code poll-interval-ms}.
 * Each tick samples heap in use and checks the deadline; once the {@link ResourceMonitor}
 * records a violation the worker is interrupted and the result is built immediately, whether or
 * not the script has noticed yet.
 *
 * <p>{@link #execute} never throws for script or limit failures. Results are handed to every
 * {@link ExecutionResultListener}; a failing listener is logged and does not affect the caller.
 */
@Slf4j
@Service
public class ExecutionEngine {

  private final SandboxCfg properties;
  private final ScriptSandbox sandbox;
  private final ThreadMemorySampler memorySampler;
  private final MockDataFixtures fixtures;
  private final List<ExecutionResultListener> listeners;
  private final ThreadPoolExecutor executor;
  private final Map<String, ExecutionContext> activeContexts = new ConcurrentHashMap<>();
  private final Map<String, Future<?>> activeRuns = new ConcurrentHashMap<>();
  private final AtomicLong totalCompleted = new AtomicLong();

  public ExecutionEngine(
      SandboxCfg properties,
      ScriptSandbox sandbox,
      ThreadMemorySampler memorySampler,
      MockDataFixtures fixtures,
      List<ExecutionResultListener> listeners) {
    this.properties = properties;
    this.sandbox = sandbox;
    this.memorySampler = memorySampler;
    this.fixtures = fixtures;
    this.listeners = List.copyOf(listeners);
    this.executor = createExecutor(properties.getConcurrency());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ExecutionEngine initialised with concurrency={} pollIntervalMs={} defaults={} listeners={}",
        properties.getConcurrency(),
        properties.getPollIntervalMs(),
        properties.defaultExecutionConfig(),
        listeners.size());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("codepage-sandbox-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    return (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
  }

  /**
   * Runs a script for a project version, merging the request overrides over the configured
   * defaults.
   *
   * @throws IllegalArgumentException if the merged limits are invalid; nothing is run then
   */
  public ExecutionResult execute(ExecutionRequest request) {
    var config = properties.defaultExecutionConfig().merge(request.overrides());
    return run(
        request.projectId(), request.versionId(), request.scriptSource(), request.testData(), config);
  }

  /** Runs an ad hoc script outside any project. */
  public ExecutionResult execute(
      String scriptSource, Map<String, Object> testData, ExecutionConfig config) {
    return run(
        ExecutionRequest.ADHOC_PROJECT,
        ExecutionRequest.CURRENT_VERSION,
        scriptSource,
        testData == null ? Map.of() : testData,
        config);
  }

  private ExecutionResult run(
      String projectId,
      String versionId,
      String scriptSource,
      Map<String, Object> testData,
      ExecutionConfig config) {
    var testId = UUID.randomUUID().toString();
    var context = new ExecutionContext(testId, projectId, versionId, config, testData);
    var api =
        new MockExternalApi(
            fixtures, context, new LatencySimulator(properties.getMockLatencyFactor()));
    activeContexts.put(testId, context);
    log.info("Execution {} submitted (project={} version={})", testId, projectId, versionId);

    Throwable failure = null;
    try {
      Future<?> future = executor.submit(() -> runOnWorker(context, api, scriptSource));
      activeRuns.put(testId, future);
      failure = await(context, future);
    } catch (RejectedExecutionException ex) {
      log.warn("Execution {} rejected: {}", testId, ex.getMessage());
      context.getMonitor().abort(ErrorKind.EXECUTION_CANCELLED);
    } finally {
      activeRuns.remove(testId);
      activeContexts.remove(testId);
    }

    var result = buildResult(context, failure);
    totalCompleted.incrementAndGet();
    log.info(
        "Execution {} finished status={} time={}ms apiCalls={} peakMemory={}",
        testId,
        result.status().value(),
        result.executionTimeMs(),
        result.apiCallCount(),
        result.peakMemoryBytes());
    notifyListeners(result);
    return result;
  }

  private Void runOnWorker(ExecutionContext context, MockExternalApi api, String scriptSource) {
    var thread = Thread.currentThread();
    context.begin(thread, memorySampler.baseline());
    try {
      sandbox.run(context, api, scriptSource);
    } finally {
      context.recordMemorySample(memorySampler.sample(context.getHeapBaseline()));
    }
    return null;
  }

  /**
   * Waits for the run, sampling and checking limits every tick.
   *
   * @return what the script threw, or null if it completed or was abandoned
   */
  private Throwable await(ExecutionContext context, Future<?> future) {
    var monitor = context.getMonitor();
    while (true) {
      try {
        var wait = Math.max(1, Math.min(properties.getPollIntervalMs(), monitor.remainingMillis()));
        future.get(wait, TimeUnit.MILLISECONDS);
        return null;
      } catch (TimeoutException tick) {
        if (monitor.isStarted()) {
          sampleMemory(context);
          monitor.checkDeadline();
        }
        if (monitor.isAborted()) {
          future.cancel(true);
          log.warn(
              "Execution {} abandoned: {}",
              context.getTestId(),
              monitor.violation().map(ErrorKind::label).orElse("unknown"));
          return null;
        }
      } catch (ExecutionException ex) {
        return ex.getCause();
      } catch (CancellationException ex) {
        monitor.abort(ErrorKind.EXECUTION_CANCELLED);
        return null;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        monitor.abort(ErrorKind.EXECUTION_CANCELLED);
        future.cancel(true);
        return null;
      }
    }
  }

  private void sampleMemory(ExecutionContext context) {
    if (context.getWorker() != null) {
      context.recordMemorySample(memorySampler.sample(context.getHeapBaseline()));
    }
  }

  private ExecutionResult buildResult(ExecutionContext context, Throwable failure) {
    var monitor = context.getMonitor();
    List<ApiCallRecord> apiCalls = List.copyOf(context.getApiCalls());
    List<ExecutionError> errors =
        monitor
            .violationError()
            .map(List::of)
            .orElseGet(
                () -> failure == null ? List.of() : List.of(ScriptErrorClassifier.classify(failure)));
    if (failure != null && monitor.isAborted()) {
      log.debug(
          "Execution {} script error superseded by {}: {}",
          context.getTestId(),
          monitor.violation().orElseThrow(),
          failure.toString());
    }

    var status = errors.isEmpty() ? ExecutionStatus.PASSED : ExecutionStatus.ERROR;
    var executionTimeMs = monitor.elapsed().toMillis();
    var peakMemory = context.peakMemoryBytes();
    var avgApiResponseTime =
        apiCalls.stream().mapToLong(ApiCallRecord::durationMs).average().orElse(0.0);
    var metrics =
        new PerformanceMetrics(executionTimeMs, peakMemory, apiCalls.size(), avgApiResponseTime);

    return new ExecutionResult(
        context.getTestId(),
        context.getProjectId(),
        context.getVersionId(),
        context.getConfig().environment(),
        status,
        executionTimeMs,
        peakMemory,
        apiCalls.size(),
        errors,
        metrics,
        List.copyOf(context.getLogs()),
        apiCalls,
        monitor.startTime().orElse(context.getCreatedAt()),
        Instant.now());
  }

  private void notifyListeners(ExecutionResult result) {
    for (ExecutionResultListener listener : listeners) {
      try {
        listener.onResult(result);
      } catch (RuntimeException ex) {
        log.error(
            "Result listener {} failed for execution {}: {}",
            listener.getClass().getSimpleName(),
            result.id(),
            ex.getMessage(),
            ex);
      }
    }
  }

  /** Runs that have not produced a result yet. */
  public List<ActiveExecution> activeExecutions() {
    return activeContexts.values().stream().map(ActiveExecution::of).toList();
  }

  public Optional<ExecutionContext> activeContext(String testId) {
    return Optional.ofNullable(activeContexts.get(testId));
  }

  /**
   * Abandons an active run. The waiting caller receives a result whose sole error is
   * {@link ErrorKind#EXECUTION_CANCELLED}, unless another limit was hit first.
   *
   * @return false if no such run is active
   */
  public boolean cancel(String testId) {
    var context = activeContexts.get(testId);
    if (context == null) {
      return false;
    }
    context.getMonitor().abort(ErrorKind.EXECUTION_CANCELLED);
    var future = activeRuns.get(testId);
    if (future != null) {
      future.cancel(true);
    }
    log.info("Execution {} cancellation requested", testId);
    return true;
  }

  public ExecutionStats stats() {
    var active = activeContexts.values();
    var avgTime =
        active.stream().mapToLong(c -> c.getMonitor().elapsed().toMillis()).average().orElse(0.0);
    var avgMemory = active.stream().mapToLong(ExecutionContext::peakMemoryBytes).average().orElse(0.0);
    return new ExecutionStats(
        active.size(),
        fixtures.size(),
        avgTime,
        avgMemory,
        totalCompleted.get(),
        executor.getQueue().size());
  }

  public Map<String, List<Map<String, Object>>> getMockData() {
    return fixtures.all();
  }

  public Optional<List<Map<String, Object>>> getMockData(String key) {
    return fixtures.find(key);
  }

  public void updateMockData(String key, List<Map<String, Object>> records) {
    fixtures.put(key, records);
    log.info("Mock data updated: {} ({} records)", key, records.size());
  }

  public boolean isHealthy() {
    return !executor.isShutdown();
  }

  @PreDestroy
  void shutdown() {
    activeContexts.values().forEach(c -> c.getMonitor().abort(ErrorKind.EXECUTION_CANCELLED));
    executor.shutdownNow();
  }
}
