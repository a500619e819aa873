/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import java.util.List;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/** Merges the distinct label names returned by its children. */
public class LabelNamesDistConcatExec extends NonLeafExecPlan {

  public LabelNamesDistConcatExec(
      QueryContext queryContext, PlanDispatcher dispatcher, List<ExecPlan> children) {
    super(queryContext, dispatcher, children);
  }

  @Override
  protected String args() {
    return "";
  }
}
