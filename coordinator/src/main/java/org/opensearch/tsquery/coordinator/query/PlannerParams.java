/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.query;

import lombok.Builder;
import lombok.Value;
import org.opensearch.tsquery.query.QueryConfig;

/** Per-query limits and planner overrides. */
@Value
@Builder(toBuilder = true)
public class PlannerParams {

  @Builder.Default int sampleLimit = 1_000_000;

  @Builder.Default long queryTimeoutMs = 30_000L;

  /** Number of shards a query fans out to, or null to use the dataset's spread. */
  Integer spreadOverride;

  /** Whether results from the partitions that answered may be returned when others failed. */
  @Builder.Default boolean allowPartialResults = false;

  /** Limits taken from the node's query settings. */
  public static PlannerParams from(QueryConfig queryConfig) {
    return PlannerParams.builder()
        .sampleLimit(queryConfig.getSampleLimit())
        .queryTimeoutMs(queryConfig.getAskTimeoutMs())
        .build();
  }
}
