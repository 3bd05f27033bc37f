package com.mk.fx.qa.codepage.execution.mockapi;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Emulates network cost for mock API calls by sleeping the calling thread.
 *
 * <p>The sleep is interruptible so an execution that hits its deadline does not wait for pending
 * latency timers.
 */
public final class LatencySimulator {

  private final double factor;

  /**
   * @param factor multiplier applied to every simulated delay; {@code 0} disables latency
   */
  public LatencySimulator(double factor) {
    if (factor < 0) {
      throw new IllegalArgumentException("Latency factor must be >= 0");
    }
    this.factor = factor;
  }

  public static LatencySimulator none() {
    return new LatencySimulator(0);
  }

  long delayMillis(ApiOperation operation, int recordCount) {
    if (factor == 0) {
      return 0;
    }
    var jitter =
        operation.jitterMillis() == 0
            ? 0
            : ThreadLocalRandom.current().nextLong(operation.jitterMillis() + 1);
    var raw = operation.baseMillis() + jitter + operation.perRecordMillis() * recordCount;
    return Math.round(raw * factor);
  }

  void pause(ApiOperation operation, int recordCount) throws InterruptedException {
    var delay = delayMillis(operation, recordCount);
    if (delay > 0) {
      TimeUnit.MILLISECONDS.sleep(delay);
    } else if (Thread.interrupted()) {
      throw new InterruptedException("Mock API call interrupted");
    }
  }
}
