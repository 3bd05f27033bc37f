package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.mockapi.ApiCallGuard;
import com.mk.fx.qa.codepage.execution.mockapi.ApiCallRecord;
import com.mk.fx.qa.codepage.execution.mockapi.ApiOperation;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfig;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;

/**
 * Mutable state of one run: console output, completed API calls and memory samples, in the order
 * they happened.
 *
 * <p>Owned by the {@link ExecutionEngine} for the duration of the run. The worker thread appends
 * while the engine thread may take a snapshot at the deadline, hence the copy-on-write lists.
 */
@Getter
public class ExecutionContext implements ApiCallGuard {

  private final String testId;
  private final String projectId;
  private final String versionId;
  private final ExecutionConfig config;
  private final Map<String, Object> testData;
  private final Instant createdAt;
  private final ResourceMonitor monitor;
  private final SandboxConsole console;
  private final List<ApiCallRecord> apiCalls = new CopyOnWriteArrayList<>();
  private final List<String> logs = new CopyOnWriteArrayList<>();
  private final List<Long> memorySamples = new CopyOnWriteArrayList<>();
  private volatile Thread worker;
  private volatile long heapBaseline;

  public ExecutionContext(
      String testId,
      String projectId,
      String versionId,
      ExecutionConfig config,
      Map<String, Object> testData) {
    this.testId = testId;
    this.projectId = projectId;
    this.versionId = versionId;
    this.config = config;
    this.testData = testData;
    this.createdAt = Instant.now();
    this.monitor = new ResourceMonitor(config);
    this.console = new SandboxConsole(logs);
  }

  /** Binds the run to the worker thread executing it and starts the resource clock. */
  void begin(Thread thread, long baselineBytes) {
    this.worker = thread;
    this.heapBaseline = baselineBytes;
    monitor.start();
  }

  void recordMemorySample(long bytes) {
    var sample = Math.max(0, bytes);
    memorySamples.add(sample);
    monitor.sampleMemory(sample);
  }

  public long peakMemoryBytes() {
    return memorySamples.stream().mapToLong(Long::longValue).max().orElse(0L);
  }

  @Override
  public boolean tryAcquire(ApiOperation operation) {
    return monitor.recordApiCall();
  }

  @Override
  public int limit() {
    return config.apiCallLimit();
  }

  @Override
  public void onCompleted(ApiCallRecord call) {
    apiCalls.add(call);
  }

  @Override
  public void onRejected(ApiOperation operation) {
    console.error(
        "API call limit exceeded (" + config.apiCallLimit() + "): " + operation.scriptName()
            + " was not executed");
  }
}
