package com.mk.fx.qa.codepage.execution.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Replacement records for one mock data set. */
@Data
public class MockDataUpdate {

  @NotNull private List<Map<String, Object>> records;
}
