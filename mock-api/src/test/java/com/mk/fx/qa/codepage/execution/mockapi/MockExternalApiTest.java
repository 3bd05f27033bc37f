package com.mk.fx.qa.codepage.execution.mockapi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class MockExternalApiTest {

  private static final class CountingGuard implements ApiCallGuard {
    private final int limit;
    private final AtomicInteger count = new AtomicInteger();
    private final List<ApiCallRecord> completed = new ArrayList<>();
    private final List<ApiOperation> rejected = new ArrayList<>();

    CountingGuard(int limit) {
      this.limit = limit;
    }

    @Override
    public boolean tryAcquire(ApiOperation operation) {
      return count.incrementAndGet() <= limit;
    }

    @Override
    public int limit() {
      return limit;
    }

    @Override
    public void onCompleted(ApiCallRecord call) {
      completed.add(call);
    }

    @Override
    public void onRejected(ApiOperation operation) {
      rejected.add(operation);
    }
  }

  @Test
  void query_vehiclesTable_returnsOnlyAvailableByDefault() throws Exception {
    var guard = new CountingGuard(10);
    var api = new MockExternalApi(new MockDataFixtures(), guard, LatencySimulator.none());

    var response = api.query(Map.of("tableId", "vehicles_table_id"));

    var data = (List<?>) response.get("data");
    assertEquals(3, data.size());
    @SuppressWarnings("unchecked")
    var metadata = (Map<String, Object>) response.get("metadata");
    assertEquals(4, metadata.get("totalRecords"));
    assertEquals(1, guard.completed.size());
    assertEquals("query", guard.completed.get(0).method());
  }

  @Test
  void query_unknownTable_returnsEmptyData() throws Exception {
    var api = new MockExternalApi(new MockDataFixtures(), ApiCallGuard.unlimited(), LatencySimulator.none());

    var response = api.query(Map.of("tableId", "quotes_table_id"));

    assertTrue(((List<?>) response.get("data")).isEmpty());
  }

  @Test
  void invoke_beyondLimit_isRejectedAndNotRecorded() throws Exception {
    var guard = new CountingGuard(2);
    var api = new MockExternalApi(new MockDataFixtures(), guard, LatencySimulator.none());

    api.create(Map.of("tableId", "quotes"));
    api.get(Map.of("recordId", 7));
    var ex =
        assertThrows(
            ApiCallLimitExceededException.class, () -> api.update(Map.of("recordId", 7)));

    assertEquals(2, ex.getLimit());
    assertEquals(ApiOperation.UPDATE, ex.getOperation());
    assertEquals(2, guard.completed.size());
    assertEquals(List.of(ApiOperation.UPDATE), guard.rejected);
  }

  @Test
  void bulkCreate_returnsOneIdPerRecord() throws Exception {
    var api = new MockExternalApi(new MockDataFixtures(), ApiCallGuard.unlimited(), LatencySimulator.none());

    var response = api.bulkCreate(Map.of("records", List.of(Map.of(), Map.of(), Map.of())));

    @SuppressWarnings("unchecked")
    var metadata = (Map<String, Object>) response.get("metadata");
    assertEquals(3, ((List<?>) metadata.get("createdRecordIds")).size());
    assertEquals(3, metadata.get("totalNumberOfRecordsProcessed"));
  }

  @Test
  void latency_isInterruptible() {
    var api =
        new MockExternalApi(new MockDataFixtures(), ApiCallGuard.unlimited(), new LatencySimulator(100));
    Thread.currentThread().interrupt();
    try {
      assertThrows(InterruptedException.class, () -> api.query(Map.of()));
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void operationNames_resolveBothBindings() {
    assertEquals(ApiOperation.BULK_CREATE, ApiOperation.fromScriptName("bulkCreate"));
    assertEquals(ApiOperation.BULK_CREATE, ApiOperation.fromScriptName("bulkCreateRecords"));
    assertThrows(IllegalArgumentException.class, () -> ApiOperation.fromScriptName("drop"));
  }
}
