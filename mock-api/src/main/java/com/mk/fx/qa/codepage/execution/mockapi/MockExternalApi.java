package com.mk.fx.qa.codepage.execution.mockapi;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in for the platform data API exposed to sandboxed codepages.
 *
 * <p>One instance serves one execution. Each operation consults the {@link ApiCallGuard} first;
 * a rejected call throws {@link ApiCallLimitExceededException} without running. Admitted calls
 * sleep a simulated latency, build a canned response from {@link MockDataFixtures} and report an
 * {@link ApiCallRecord} back to the guard.
 *
 * <p>Not thread-safe: scripts call it from the single thread running the execution.
 */
@Slf4j
public class MockExternalApi {

  static final String VEHICLES_TABLE = "vehicles_table_id";

  private final MockDataFixtures fixtures;
  private final ApiCallGuard guard;
  private final LatencySimulator latency;

  public MockExternalApi(MockDataFixtures fixtures, ApiCallGuard guard, LatencySimulator latency) {
    this.fixtures = Objects.requireNonNull(fixtures, "fixtures");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.latency = Objects.requireNonNull(latency, "latency");
  }

  /**
   * Dispatches an operation by name.
   *
   * @throws IllegalArgumentException if the operation is unknown
   * @throws ApiCallLimitExceededException if the guard rejects the call
   * @throws InterruptedException if the simulated latency was interrupted
   */
  public Map<String, Object> invoke(ApiOperation operation, Map<String, Object> params)
      throws InterruptedException {
    var safeParams = params != null ? params : Map.<String, Object>of();
    if (!guard.tryAcquire(operation)) {
      guard.onRejected(operation);
      throw new ApiCallLimitExceededException(guard.limit(), operation);
    }

    var startedAt = Instant.now();
    var start = System.nanoTime();
    latency.pause(operation, recordCount(operation, safeParams));
    var response =
        switch (operation) {
          case QUERY -> queryResponse(safeParams);
          case CREATE -> Map.<String, Object>of(
              "id", newRecordId(), "createdDate", Instant.now().toString());
          case UPDATE -> timestamped(safeParams.get("recordId"), "updatedDate");
          case DELETE -> timestamped(safeParams.get("recordId"), "deletedDate");
          case GET -> getResponse(safeParams);
          case BULK_CREATE -> bulkCreateResponse(safeParams);
        };
    var durationMs = (System.nanoTime() - start) / 1_000_000;

    guard.onCompleted(new ApiCallRecord(operation.scriptName(), safeParams, response, startedAt, durationMs));
    log.debug("Mock API {} completed in {} ms", operation.scriptName(), durationMs);
    return response;
  }

  public Map<String, Object> query(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.QUERY, params);
  }

  public Map<String, Object> create(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.CREATE, params);
  }

  public Map<String, Object> update(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.UPDATE, params);
  }

  public Map<String, Object> delete(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.DELETE, params);
  }

  public Map<String, Object> get(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.GET, params);
  }

  public Map<String, Object> bulkCreate(Map<String, Object> params) throws InterruptedException {
    return invoke(ApiOperation.BULK_CREATE, params);
  }

  private Map<String, Object> queryResponse(Map<String, Object> params) {
    List<Map<String, Object>> data = List.of();
    var total = 0;
    if (VEHICLES_TABLE.equals(params.get("tableId"))) {
      var vehicles = fixtures.get(MockDataFixtures.VEHICLES);
      var where = params.get("where");
      var availableOnly = where == null || String.valueOf(where).contains("Available");
      data =
          availableOnly
              ? vehicles.stream().filter(v -> "Available".equals(v.get("status"))).toList()
              : vehicles;
      total = vehicles.size();
    }
    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("totalRecords", total);
    metadata.put("skip", 0);
    metadata.put("top", total);
    return Map.of("data", data, "metadata", metadata);
  }

  private Map<String, Object> getResponse(Map<String, Object> params) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("6", Map.of("value", "Toyota"));
    fields.put("7", Map.of("value", "Camry"));
    fields.put("8", Map.of("value", 28000));
    var response = new LinkedHashMap<String, Object>();
    response.put("id", params.get("recordId"));
    response.put("fields", fields);
    return response;
  }

  private Map<String, Object> bulkCreateResponse(Map<String, Object> params) {
    var count = Math.max(1, recordCount(ApiOperation.BULK_CREATE, params));
    List<Object> ids = new ArrayList<>(count);
    IntStream.range(0, count).forEach(i -> ids.add(newRecordId()));
    return Map.of(
        "metadata",
        Map.of("createdRecordIds", ids, "totalNumberOfRecordsProcessed", count));
  }

  private static Map<String, Object> timestamped(Object recordId, String field) {
    var response = new LinkedHashMap<String, Object>();
    response.put("id", recordId);
    response.put(field, Instant.now().toString());
    return response;
  }

  private static int recordCount(ApiOperation operation, Map<String, Object> params) {
    if (operation != ApiOperation.BULK_CREATE) {
      return 0;
    }
    return params.get("records") instanceof List<?> records ? records.size() : 1;
  }

  private static int newRecordId() {
    return ThreadLocalRandom.current().nextInt(1000, 11000);
  }
}
