/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import java.util.List;
import org.opensearch.tsquery.aggregate.Aggregator;
import org.opensearch.tsquery.metadata.Projection;

/** Validates the arguments of an aggregation function and binds them into an aggregator. */
interface ArgumentShape {
  Validated<Aggregator<?>> validate(List<String> args, Projection projection);
}
