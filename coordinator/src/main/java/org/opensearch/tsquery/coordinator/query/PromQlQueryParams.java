/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.query;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/** Query text of a range query together with its time range and step, in seconds. */
@Value
public class PromQlQueryParams {

  @With @NonNull String promQl;
  long startSecs;
  long stepSecs;
  long endSecs;
}
