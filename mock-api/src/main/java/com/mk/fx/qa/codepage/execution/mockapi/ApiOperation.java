package com.mk.fx.qa.codepage.execution.mockapi;

import java.util.Arrays;

/**
 * Operations offered by the mock data API, with the artificial latency each one simulates.
 *
 * <p>Latency is {@code baseMillis + random(0, jitterMillis)}; {@link #BULK_CREATE} adds {@code
 * perRecordMillis} for every record in the request.
 */
public enum ApiOperation {
  QUERY("query", "queryRecords", 50, 100, 0),
  CREATE("create", "createRecord", 100, 200, 0),
  UPDATE("update", "updateRecord", 80, 150, 0),
  DELETE("delete", "deleteRecord", 60, 100, 0),
  GET("get", "getRecord", 40, 80, 0),
  BULK_CREATE("bulkCreate", "bulkCreateRecords", 0, 200, 50);

  private final String scriptName;
  private final String legacyName;
  private final long baseMillis;
  private final long jitterMillis;
  private final long perRecordMillis;

  ApiOperation(
      String scriptName, String legacyName, long baseMillis, long jitterMillis, long perRecordMillis) {
    this.scriptName = scriptName;
    this.legacyName = legacyName;
    this.baseMillis = baseMillis;
    this.jitterMillis = jitterMillis;
    this.perRecordMillis = perRecordMillis;
  }

  /** Name of the operation on the synchronous {@code api} binding. */
  public String scriptName() {
    return scriptName;
  }

  /** Name of the operation on the promise-returning {@code QB.api} binding. */
  public String legacyName() {
    return legacyName;
  }

  long baseMillis() {
    return baseMillis;
  }

  long jitterMillis() {
    return jitterMillis;
  }

  long perRecordMillis() {
    return perRecordMillis;
  }

  public static ApiOperation fromScriptName(String name) {
    return Arrays.stream(values())
        .filter(op -> op.scriptName.equals(name) || op.legacyName.equals(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported API operation: " + name));
  }
}
