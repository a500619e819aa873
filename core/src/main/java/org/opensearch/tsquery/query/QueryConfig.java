/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.query;

import lombok.Builder;
import lombok.Value;

/** Settings shared by every query planned or executed by this node. */
@Value
@Builder
public class QueryConfig {

  /** How long a dispatched plan may wait for its result. */
  @Builder.Default long askTimeoutMs = 30_000L;

  /** Maximum number of samples a single query may return. */
  @Builder.Default int sampleLimit = 1_000_000;

  /** Smallest step a range query may use. */
  @Builder.Default long minStepMs = 5_000L;

  /** Number of partitions aggregated concurrently. */
  @Builder.Default int parallelism = Runtime.getRuntime().availableProcessors();
}
