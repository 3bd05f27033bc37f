package com.mk.fx.qa.codepage.execution.monitoring;

import com.mk.fx.qa.codepage.execution.cfg.MonitoringCfg;
import com.mk.fx.qa.codepage.execution.model.ExecutionResult;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertEngine;
import com.mk.fx.qa.codepage.execution.monitoring.store.MetricStore;
import com.mk.fx.qa.codepage.execution.sandbox.ExecutionResultListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records metrics into a bounded buffer that is flushed in batches into the {@link MetricStore}.
 *
 * <p>The buffer flushes when it reaches {@code codepage.monitoring.buffer-size} and on a fixed
 * schedule. A failed flush puts the batch back at the front of the buffer so that the next flush
 * retries it; callers of {@link #record} never see store failures. Every flush prunes metrics older
 * than {@link #RETENTION}. Queries see both stored and still buffered metrics.
 */
@Slf4j
@Service
public class MetricsService implements ExecutionResultListener {

  public static final Duration RETENTION = Duration.ofHours(24);
  static final int DEFAULT_SUMMARY_WINDOW_MINUTES = 60;

  private final MonitoringCfg cfg;
  private final MetricStore store;
  private final AlertEngine alertEngine;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Metric> buffer = new ArrayDeque<>();
  private ScheduledExecutorService flusher;

  public MetricsService(
      MonitoringCfg cfg, MetricStore store, AlertEngine alertEngine, Clock clock) {
    this.cfg = cfg;
    this.store = store;
    this.alertEngine = alertEngine;
    this.clock = clock;
  }

  @PostConstruct
  void startFlusher() {
    flusher =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-flush");
              t.setDaemon(true);
              return t;
            });
    var interval = cfg.getFlushIntervalMs();
    flusher.scheduleWithFixedDelay(this::flush, interval, interval, TimeUnit.MILLISECONDS);
    log.info(
        "MetricsService initialised with bufferSize={}, flushInterval={}ms, retention={}",
        cfg.getBufferSize(),
        interval,
        RETENTION);
  }

  @PreDestroy
  void shutdown() {
    if (flusher != null) {
      flusher.shutdownNow();
      try {
        flusher.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException ignored) {
        Thread.currentThread().interrupt();
      }
    }
    flush();
    log.info("MetricsService stopped with {} metrics stored", store.size());
  }

  // ---------------------------------------------------------------------------
  // Recording
  // ---------------------------------------------------------------------------

  /**
   * Records one metric and evaluates the alert rules watching it before returning.
   *
   * @throws IllegalArgumentException if the name or unit is blank or the value is not finite
   */
  public Metric record(
      MetricKind kind, String name, double value, String unit, Map<String, Object> metadata) {
    if (kind == null) {
      throw new IllegalArgumentException("Metric kind is required");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Metric name must not be blank");
    }
    if (unit == null || unit.isBlank()) {
      throw new IllegalArgumentException("Metric unit must not be blank");
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Metric value must be a finite number: " + value);
    }
    var metric =
        new Metric(
            "metric-" + UUID.randomUUID(), kind, name, value, unit, clock.instant(), metadata);
    lock.lock();
    try {
      buffer.addLast(metric);
      if (buffer.size() >= cfg.getBufferSize()) {
        flushLocked();
      }
    } finally {
      lock.unlock();
    }
    alertEngine.evaluate(metric, this::recent);
    return metric;
  }

  @Override
  public void onResult(ExecutionResult result) {
    recordExecution(result);
  }

  /** Records the per-run metrics of a finished execution. */
  public void recordExecution(ExecutionResult result) {
    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("executionId", result.id());
    metadata.put("projectId", result.projectId());
    metadata.put("versionId", result.versionId());
    metadata.put("status", result.status().value());
    metadata.put("environment", result.environment().value());

    record(MetricKind.EXECUTION, "codepage_execution_time", result.executionTimeMs(), "ms", metadata);
    record(MetricKind.EXECUTION, "codepage_memory_usage", result.peakMemoryBytes(), "bytes", metadata);
    record(MetricKind.EXECUTION, "codepage_api_calls", result.apiCallCount(), "count", metadata);
    record(MetricKind.EXECUTION, "codepage_errors", result.errors().size(), "count", metadata);
    for (var call : result.apiCalls()) {
      var callMetadata = new LinkedHashMap<>(metadata);
      callMetadata.put("method", call.method());
      record(
          MetricKind.EXECUTION, "codepage_api_response_time", call.durationMs(), "ms", callMetadata);
    }
  }

  /** Records one HTTP exchange served by this application. */
  public void recordApiResponse(
      String endpoint,
      String method,
      int statusCode,
      long responseTimeMs,
      long requestSizeBytes,
      long responseSizeBytes) {
    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("endpoint", endpoint);
    metadata.put("method", method);
    metadata.put("statusCode", statusCode);

    record(MetricKind.API_RESPONSE, "api_response_time", responseTimeMs, "ms", metadata);
    record(MetricKind.API_RESPONSE, "api_request_size", requestSizeBytes, "bytes", metadata);
    record(MetricKind.API_RESPONSE, "api_response_size", responseSizeBytes, "bytes", metadata);
    if (statusCode >= 400) {
      record(MetricKind.API_RESPONSE, "api_errors", 1, "count", metadata);
    }
  }

  // ---------------------------------------------------------------------------
  // Flushing
  // ---------------------------------------------------------------------------

  /** Moves the buffered metrics into the store and prunes expired ones. Never throws. */
  public void flush() {
    lock.lock();
    try {
      flushLocked();
    } finally {
      lock.unlock();
    }
  }

  private void flushLocked() {
    if (!buffer.isEmpty()) {
      var batch = new ArrayList<>(buffer);
      buffer.clear();
      try {
        store.append(batch);
        log.debug("Flushed {} metrics", batch.size());
      } catch (RuntimeException e) {
        for (int i = batch.size() - 1; i >= 0; i--) {
          buffer.addFirst(batch.get(i));
        }
        log.error("Failed to flush {} metrics, kept for retry", batch.size(), e);
      }
    }
    try {
      var pruned = store.pruneOlderThan(clock.instant().minus(RETENTION));
      if (pruned > 0) {
        log.debug("Pruned {} metrics older than {}", pruned, RETENTION);
      }
    } catch (RuntimeException e) {
      log.error("Failed to prune expired metrics", e);
    }
  }

  // ---------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------

  /** Stored and buffered metrics matching the filter, newest first, capped at the filter limit. */
  public List<Metric> query(MetricFilter filter) {
    var effective = filter != null ? filter : MetricFilter.all();
    return matching(effective).stream().limit(effective.limit()).toList();
  }

  /** Metrics with the given name recorded at or after {@code since}, newest first, unbounded. */
  public List<Metric> recent(String name, Instant since) {
    return matching(MetricFilter.builder().name(name).from(since).build());
  }

  /**
   * Summarises the metrics of the last {@code windowMinutes}, optionally of one kind.
   *
   * @param windowMinutes window length, {@value #DEFAULT_SUMMARY_WINDOW_MINUTES} when not positive
   */
  public MetricSummary summarize(MetricKind kind, int windowMinutes) {
    var window = windowMinutes > 0 ? windowMinutes : DEFAULT_SUMMARY_WINDOW_MINUTES;
    var end = clock.instant();
    var start = end.minus(Duration.ofMinutes(window));
    var values =
        matching(MetricFilter.builder().kind(kind).from(start).to(end).build()).stream()
            .mapToDouble(Metric::value)
            .summaryStatistics();
    if (values.getCount() == 0) {
      return new MetricSummary(0, 0, 0, 0, start, end);
    }
    return new MetricSummary(
        (int) values.getCount(),
        values.getAverage(),
        values.getMin(),
        values.getMax(),
        start,
        end);
  }

  public int bufferedCount() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  public int storedCount() {
    return store.size();
  }

  private List<Metric> matching(MetricFilter filter) {
    List<Metric> all;
    lock.lock();
    try {
      all = new ArrayList<>(store.snapshot());
      all.addAll(buffer);
    } finally {
      lock.unlock();
    }
    // insertion order reversed first so that equal timestamps keep newest-recorded first
    Collections.reverse(all);
    return all.stream()
        .filter(filter::matches)
        .sorted(Comparator.comparing(Metric::timestamp).reversed())
        .toList();
  }
}
