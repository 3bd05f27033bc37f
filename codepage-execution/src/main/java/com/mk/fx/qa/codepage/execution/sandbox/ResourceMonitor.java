package com.mk.fx.qa.codepage.execution.sandbox;

import com.mk.fx.qa.codepage.execution.model.ErrorKind;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfig;
import com.mk.fx.qa.codepage.execution.model.ExecutionError;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks elapsed time, sampled memory and mock API calls for one execution and decides when the
 * execution must be abandoned.
 *
 * <p>The first limit that is hit is recorded as the terminal violation; later violations are
 * ignored. The monitor is shared between the worker running the script, the interpreter's
 * instruction observer and the engine thread polling the deadline, so every field is either
 * atomic or volatile.
 */
public class ResourceMonitor {

  private static final long NOT_STARTED = -1L;

  private final ExecutionConfig config;
  private final AtomicReference<ErrorKind> violation = new AtomicReference<>();
  private final AtomicInteger apiCalls = new AtomicInteger();
  private final AtomicLong peakMemory = new AtomicLong();
  private volatile long startNanos = NOT_STARTED;
  private volatile Instant startTime;

  public ResourceMonitor(ExecutionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /** Starts the wall clock. The deadline is {@code start + timeoutMs}. */
  public void start() {
    if (startNanos != NOT_STARTED) {
      throw new IllegalStateException("Resource monitor already started");
    }
    startTime = Instant.now();
    startNanos = System.nanoTime();
  }

  public boolean isStarted() {
    return startNanos != NOT_STARTED;
  }

  public Optional<Instant> startTime() {
    return Optional.ofNullable(startTime);
  }

  public Duration elapsed() {
    var started = startNanos;
    return started == NOT_STARTED ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started);
  }

  /** Milliseconds left before the deadline, never negative. */
  public long remainingMillis() {
    if (!isStarted()) {
      return config.timeoutMs();
    }
    return Math.max(0, config.timeoutMs() - elapsed().toMillis());
  }

  public boolean isExpired() {
    return isStarted() && elapsed().toMillis() >= config.timeoutMs();
  }

  /**
   * Records a memory sample.
   *
   * @return false when the sample is above the configured limit; the run is then aborted
   */
  public boolean sampleMemory(long bytes) {
    peakMemory.accumulateAndGet(bytes, Math::max);
    if (bytes > config.memoryLimitBytes()) {
      abort(ErrorKind.MEMORY_EXCEEDED);
      return false;
    }
    return true;
  }

  /**
   * Counts one mock API call against the limit.
   *
   * @return false when the call would pass the limit or the run is already aborted; the call must
   *     then not be executed
   */
  public boolean recordApiCall() {
    if (isAborted()) {
      return false;
    }
    while (true) {
      var current = apiCalls.get();
      if (current >= config.apiCallLimit()) {
        abort(ErrorKind.API_CALL_LIMIT_EXCEEDED);
        return false;
      }
      if (apiCalls.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  /**
   * Flags the run as abandoned for the given reason.
   *
   * @return true if this call set the violation, false if an earlier one already won
   */
  public boolean abort(ErrorKind kind) {
    if (!kind.isAbort()) {
      throw new IllegalArgumentException(kind + " is not a resource or host violation");
    }
    return violation.compareAndSet(null, kind);
  }

  /** Aborts with {@link ErrorKind#TIMEOUT_EXCEEDED} when the deadline has passed. */
  public boolean checkDeadline() {
    if (isExpired()) {
      abort(ErrorKind.TIMEOUT_EXCEEDED);
    }
    return !isAborted();
  }

  public boolean isAborted() {
    return violation.get() != null;
  }

  public Optional<ErrorKind> violation() {
    return Optional.ofNullable(violation.get());
  }

  /** The synthetic error reported for the recorded violation. */
  public Optional<ExecutionError> violationError() {
    return violation().map(kind -> ExecutionError.of(kind, describe(kind)));
  }

  public int apiCallCount() {
    return apiCalls.get();
  }

  public long peakMemoryBytes() {
    return peakMemory.get();
  }

  public ExecutionConfig config() {
    return config;
  }

  private String describe(ErrorKind kind) {
    return switch (kind) {
      case TIMEOUT_EXCEEDED -> "Execution timed out after " + config.timeoutMs() + " ms";
      case MEMORY_EXCEEDED -> "Memory limit exceeded: "
          + peakMemory.get()
          + " bytes used, limit is "
          + config.memoryLimitBytes()
          + " bytes";
      case API_CALL_LIMIT_EXCEEDED -> "API call limit exceeded (" + config.apiCallLimit() + ")";
      case EXECUTION_CANCELLED -> "Execution cancelled";
      default -> kind.label();
    };
  }
}
