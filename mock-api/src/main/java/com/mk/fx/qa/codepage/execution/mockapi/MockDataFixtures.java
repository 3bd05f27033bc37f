package com.mk.fx.qa.codepage.execution.mockapi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Canned record sets served by the {@link MockExternalApi}.
 *
 * <p>Shared by every execution; data sets are replaced wholesale and handed out as immutable
 * copies, so a running script never observes a half-updated set.
 */
@Slf4j
public class MockDataFixtures {

  public static final String VEHICLES = "vehicles";
  public static final String OPTIONS = "options";
  public static final String DISCOUNTS = "discounts";

  private final Map<String, List<Map<String, Object>>> dataSets = new ConcurrentHashMap<>();

  public MockDataFixtures() {
    dataSets.put(
        VEHICLES,
        List.of(
            vehicle(1, "Toyota", "Camry", 28000, "Available"),
            vehicle(2, "Honda", "Accord", 32000, "Available"),
            vehicle(3, "Ford", "F-150", 45000, "Available"),
            vehicle(4, "BMW", "X5", 65000, "Sold")));
    dataSets.put(
        OPTIONS,
        List.of(
            Map.of("id", "premium", "name", "Premium Package", "price", 2500),
            Map.of("id", "navigation", "name", "Navigation System", "price", 1200),
            Map.of("id", "sunroof", "name", "Sunroof", "price", 800),
            Map.of("id", "leather", "name", "Leather Seats", "price", 1500)));
    dataSets.put(
        DISCOUNTS,
        List.of(
            Map.of("id", "loyalty", "name", "Loyalty Discount", "amount", 1000),
            Map.of("id", "trade", "name", "Trade-in Credit", "amount", 3000),
            Map.of("id", "military", "name", "Military Discount", "amount", 500)));
    log.info("Mock data initialised with {} data sets", dataSets.size());
  }

  private static Map<String, Object> vehicle(
      int id, String make, String model, int price, String status) {
    var v = new LinkedHashMap<String, Object>();
    v.put("id", id);
    v.put("make", make);
    v.put("model", model);
    v.put("price", price);
    v.put("status", status);
    return v;
  }

  public List<Map<String, Object>> get(String key) {
    return dataSets.getOrDefault(key, List.of());
  }

  public Optional<List<Map<String, Object>>> find(String key) {
    return Optional.ofNullable(dataSets.get(key));
  }

  public Map<String, List<Map<String, Object>>> all() {
    return Map.copyOf(dataSets);
  }

  public void put(String key, List<Map<String, Object>> records) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(records, "records");
    if (key.isBlank()) {
      throw new IllegalArgumentException("Mock data key must not be blank");
    }
    dataSets.put(key, records.stream().map(MockDataFixtures::copyRecord).toList());
    log.info("Mock data updated: {} ({} records)", key, records.size());
  }

  public int size() {
    return dataSets.size();
  }

  // Map.copyOf rejects null values, which JSON bodies carry
  private static Map<String, Object> copyRecord(Map<String, Object> record) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(record));
  }
}
