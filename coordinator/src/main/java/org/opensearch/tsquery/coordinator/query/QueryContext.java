/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.query;

import java.util.UUID;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything known about a query besides its plan: the text it was submitted as, its identity and
 * its limits. Contexts are immutable; a derived context is a copy with some fields replaced.
 */
@Value
@Builder(toBuilder = true)
public class QueryContext {

  @NonNull PromQlQueryParams origQueryParams;

  @Builder.Default String queryId = UUID.randomUUID().toString();

  @Builder.Default long submitTime = System.currentTimeMillis();

  @Builder.Default PlannerParams plannerParams = PlannerParams.builder().build();

  public static QueryContext of(PromQlQueryParams params) {
    return QueryContext.builder().origQueryParams(params).build();
  }

  /** Returns a copy of this context whose query text is {@code promQl}. */
  public QueryContext withPromQl(String promQl) {
    return toBuilder().origQueryParams(origQueryParams.withPromQl(promQl)).build();
  }
}
