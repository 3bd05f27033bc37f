package com.mk.fx.qa.codepage.execution.reporting;

import java.time.Instant;

public record ReportingStats(
    int totalResults,
    int totalReports,
    Instant oldestResult,
    Instant newestResult,
    long averageResultsPerProject) {}
