package com.mk.fx.qa.codepage.execution.reporting;

import java.util.Objects;

/** Identifies the result history of one project version. */
public record ResultKey(String projectId, String versionId) {

  public ResultKey {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(versionId, "versionId");
  }
}
