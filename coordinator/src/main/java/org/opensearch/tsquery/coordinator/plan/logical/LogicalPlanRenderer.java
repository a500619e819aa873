/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

/** Turns a logical plan back into query text that parses into an equivalent plan. */
public interface LogicalPlanRenderer {

  /**
   * Renders a plan as query text.
   *
   * @throws UnsupportedOperationException if the plan kind has no textual form
   */
  String convertToQuery(LogicalPlan plan);
}
