/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Number of series per group of shard-key values. Groups are formed from the first {@code
 * numGroupByFields} shard-key columns, restricted to the given prefix of values.
 */
@Value
public class TsCardinalities implements LogicalPlan {

  ImmutableList<String> shardKeyPrefix;
  int numGroupByFields;

  public TsCardinalities(List<String> shardKeyPrefix, int numGroupByFields) {
    Preconditions.checkArgument(numGroupByFields >= 1, "numGroupByFields must be positive");
    Preconditions.checkArgument(
        numGroupByFields >= shardKeyPrefix.size(),
        "numGroupByFields %s must not be less than the prefix size %s",
        numGroupByFields,
        shardKeyPrefix.size());
    this.shardKeyPrefix = ImmutableList.copyOf(shardKeyPrefix);
    this.numGroupByFields = numGroupByFields;
  }
}
