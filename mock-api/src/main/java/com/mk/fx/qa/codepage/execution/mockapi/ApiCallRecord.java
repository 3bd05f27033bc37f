package com.mk.fx.qa.codepage.execution.mockapi;

import java.time.Instant;
import java.util.Map;

/**
 * One completed call against the {@link MockExternalApi}.
 *
 * @param method operation name as exposed to scripts (e.g. {@code query})
 * @param params parameters passed by the script
 * @param response canned response returned to the script
 * @param timestamp when the call started
 * @param durationMs wall-clock duration including simulated latency
 */
public record ApiCallRecord(
    String method,
    Map<String, Object> params,
    Map<String, Object> response,
    Instant timestamp,
    long durationMs) {}
