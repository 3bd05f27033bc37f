package com.mk.fx.qa.codepage.execution.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codepage.reporting")
public class ReportingCfg {

  /** Results kept per project/version; older ones are dropped. */
  @Positive
  @Max(10_000)
  private int historySize = 100;

  /** Results embedded into a report generated at the detailed level. */
  @Min(0)
  private int detailedResultsIncluded = 20;
}
