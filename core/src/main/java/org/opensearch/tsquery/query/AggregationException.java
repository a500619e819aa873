/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.query;

import lombok.Getter;

/** Reading or aggregating the chunks of one partition failed. */
@Getter
public class AggregationException extends RuntimeException {

  private final String partitionKey;

  public AggregationException(String partitionKey, Throwable cause) {
    super("Failed to aggregate partition " + partitionKey, cause);
    this.partitionKey = partitionKey;
  }
}
