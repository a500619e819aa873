/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import java.util.List;

/** A plan node that selects series by column filters. */
public interface FilteredPlan extends LogicalPlan {

  List<ColumnFilter> getFilters();
}
