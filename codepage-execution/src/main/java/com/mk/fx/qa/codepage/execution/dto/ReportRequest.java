package com.mk.fx.qa.codepage.execution.dto;

import lombok.Data;

/** Optional report sections and detail level; omitted flags default to included. */
@Data
public class ReportRequest {

  private Boolean includePerformanceAnalysis;

  private Boolean includeErrorAnalysis;

  private Boolean includeRecommendations;

  private String detailLevel;
}
