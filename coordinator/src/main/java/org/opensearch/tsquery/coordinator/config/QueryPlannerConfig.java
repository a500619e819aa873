/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.config;

import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlanRenderer;
import org.opensearch.tsquery.coordinator.plan.logical.PromQlRenderer;
import org.opensearch.tsquery.query.PartitionAggregationRunner;
import org.opensearch.tsquery.query.QueryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;

/** Query settings of this node, read from {@code tsquery.properties}. */
@Configuration
@PropertySource("classpath:tsquery.properties")
public class QueryPlannerConfig {

  static final String ASK_TIMEOUT_MS = "tsquery.query.ask-timeout-ms";
  static final String SAMPLE_LIMIT = "tsquery.query.sample-limit";
  static final String MIN_STEP_MS = "tsquery.query.min-step-ms";
  static final String PARALLELISM = "tsquery.query.parallelism";
  static final String METRIC_COLUMN = "tsquery.dataset.metric-column";

  static final String DEFAULT_METRIC_COLUMN = "_metric_";

  @Bean
  public QueryConfig queryConfig(Environment environment) {
    QueryConfig defaults = QueryConfig.builder().build();
    return QueryConfig.builder()
        .askTimeoutMs(
            environment.getProperty(ASK_TIMEOUT_MS, Long.class, defaults.getAskTimeoutMs()))
        .sampleLimit(
            environment.getProperty(SAMPLE_LIMIT, Integer.class, defaults.getSampleLimit()))
        .minStepMs(environment.getProperty(MIN_STEP_MS, Long.class, defaults.getMinStepMs()))
        .parallelism(
            environment.getProperty(PARALLELISM, Integer.class, defaults.getParallelism()))
        .build();
  }

  @Bean
  public LogicalPlanRenderer promQlRenderer(Environment environment) {
    return new PromQlRenderer(environment.getProperty(METRIC_COLUMN, DEFAULT_METRIC_COLUMN));
  }

  @Bean
  public PartitionAggregationRunner partitionAggregationRunner(QueryConfig queryConfig) {
    return new PartitionAggregationRunner(queryConfig);
  }
}
