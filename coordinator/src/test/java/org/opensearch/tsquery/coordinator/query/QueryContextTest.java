/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.query.QueryConfig;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryContextTest {

  @Test
  void should_replace_only_the_query_text() {
    QueryContext context =
        QueryContext.builder()
            .origQueryParams(new PromQlQueryParams("a + b", 10L, 5L, 20L))
            .queryId("q-1")
            .submitTime(42L)
            .plannerParams(
                PlannerParams.builder().sampleLimit(10).allowPartialResults(true).build())
            .build();

    QueryContext derived = context.withPromQl("a");

    assertEquals(new PromQlQueryParams("a", 10L, 5L, 20L), derived.getOrigQueryParams());
    assertEquals("q-1", derived.getQueryId());
    assertEquals(42L, derived.getSubmitTime());
    assertEquals(context.getPlannerParams(), derived.getPlannerParams());
    assertEquals("a + b", context.getOrigQueryParams().getPromQl());
    assertNotEquals(context, derived);
  }

  @Test
  void should_give_each_query_its_own_id() {
    PromQlQueryParams params = new PromQlQueryParams("up", 0L, 1L, 2L);

    assertNotEquals(QueryContext.of(params).getQueryId(), QueryContext.of(params).getQueryId());
  }

  @Test
  void should_take_planner_limits_from_the_query_settings() {
    PlannerParams params =
        PlannerParams.from(QueryConfig.builder().sampleLimit(500).askTimeoutMs(2_000L).build());

    assertEquals(500, params.getSampleLimit());
    assertEquals(2_000L, params.getQueryTimeoutMs());
    assertNull(params.getSpreadOverride());
    assertFalse(params.isAllowPartialResults());
  }
}
