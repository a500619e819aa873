/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

/** An aggregate whose single value can be read as a double. */
public interface NumericAggregate {
  double doubleValue();
}
