package com.mk.fx.qa.codepage.execution.cfg;

import com.mk.fx.qa.codepage.execution.mockapi.MockDataFixtures;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MockApiConfig {

  /** Fixture data shared by every run; updated through the executions endpoint. */
  @Bean
  public MockDataFixtures mockDataFixtures() {
    return new MockDataFixtures();
  }
}
