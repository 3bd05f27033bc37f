package com.mk.fx.qa.codepage.execution.model;

import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to run one codepage script.
 *
 * @param projectId owning project
 * @param versionId project version, {@value #CURRENT_VERSION} when not given
 * @param scriptSource script to evaluate
 * @param testData caller data exposed to the script as {@code testData}
 * @param overrides per-run limits merged over platform defaults, may be null
 */
public record ExecutionRequest(
    String projectId,
    String versionId,
    String scriptSource,
    Map<String, Object> testData,
    ExecutionConfigOverrides overrides) {

  public static final String CURRENT_VERSION = "current";
  public static final String ADHOC_PROJECT = "adhoc";

  public ExecutionRequest {
    Objects.requireNonNull(scriptSource, "scriptSource");
    projectId = projectId == null || projectId.isBlank() ? ADHOC_PROJECT : projectId;
    versionId = versionId == null || versionId.isBlank() ? CURRENT_VERSION : versionId;
    testData = testData == null ? Map.of() : testData;
  }
}
