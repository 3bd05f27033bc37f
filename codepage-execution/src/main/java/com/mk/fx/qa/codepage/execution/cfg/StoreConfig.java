package com.mk.fx.qa.codepage.execution.cfg;

import com.mk.fx.qa.codepage.execution.monitoring.alert.Alert;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertRule;
import com.mk.fx.qa.codepage.execution.monitoring.store.InMemoryMetricStore;
import com.mk.fx.qa.codepage.execution.monitoring.store.MetricStore;
import com.mk.fx.qa.codepage.execution.reporting.TestReport;
import com.mk.fx.qa.codepage.execution.store.InMemoryKeyValueStore;
import com.mk.fx.qa.codepage.execution.store.KeyValueStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** In-memory stores; replace these beans to persist reports, rules, alerts or metrics. */
@Configuration
public class StoreConfig {

  @Bean
  public KeyValueStore<String, TestReport> reportStore() {
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  public KeyValueStore<String, AlertRule> alertRuleStore() {
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  public KeyValueStore<String, Alert> alertStore() {
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  public MetricStore metricStore() {
    return new InMemoryMetricStore();
  }
}
