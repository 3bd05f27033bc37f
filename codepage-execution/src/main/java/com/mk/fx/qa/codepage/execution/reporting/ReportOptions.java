package com.mk.fx.qa.codepage.execution.reporting;

/**
 * Controls which sections a generated report fills in. Disabled sections are present but empty.
 */
public record ReportOptions(
    boolean includePerformanceAnalysis,
    boolean includeErrorAnalysis,
    boolean includeRecommendations,
    DetailLevel detailLevel) {

  public ReportOptions {
    detailLevel = detailLevel == null ? DetailLevel.DETAILED : detailLevel;
  }

  public static ReportOptions defaults() {
    return new ReportOptions(true, true, true, DetailLevel.DETAILED);
  }
}
