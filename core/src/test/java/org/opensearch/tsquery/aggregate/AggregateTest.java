/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class AggregateTest {

  @Test
  void should_hold_one_scalar_value() {
    DoubleAggregate aggregate = new DoubleAggregate(2.5);

    assertEquals(List.of(2.5), aggregate.getResult());
    assertEquals(Double.class, aggregate.getValueClass());
    assertEquals(2.5, aggregate.doubleValue());
    assertEquals(new DoubleAggregate(2.5), aggregate);
    assertNotEquals(new DoubleAggregate(2.0), aggregate);
    assertEquals(7.0, new LongAggregate(7L).doubleValue());
  }

  @Test
  void should_concatenate_lists_into_a_new_instance() {
    ListAggregate<String> first = ListAggregate.of(String.class, List.of("a", "b"));
    ListAggregate<String> second = ListAggregate.of(String.class, List.of("c"));

    ListAggregate<String> both = first.add(second);

    assertEquals(List.of("a", "b", "c"), both.getResult());
    assertEquals(List.of("a", "b"), first.getResult());
    assertEquals(List.of("c"), second.getResult());
    assertEquals(String.class, both.getValueClass());
    assertThrows(UnsupportedOperationException.class, () -> both.getResult().add("d"));
  }

  @Test
  void should_update_buffer_in_place() {
    DoubleBufferAggregate buffer = new DoubleBufferAggregate(3, 1.0);
    buffer.set(1, 5.0);

    assertEquals(3, buffer.size());
    assertEquals(5.0, buffer.get(1));
    assertEquals(List.of(1.0, 5.0, 1.0), buffer.getResult());
  }

  @Test
  void should_merge_average_buffers_from_sums_and_counts() {
    AverageBufferAggregate first = new AverageBufferAggregate(2);
    first.accumulate(0, 1.0);
    first.accumulate(0, 3.0);
    AverageBufferAggregate second = new AverageBufferAggregate(2);
    second.accumulate(0, 8.0);

    AverageBufferAggregate merged = AverageBufferAggregate.merge(first, second);

    assertEquals(4.0, merged.getResult().get(0));
    assertTrue(Double.isNaN(merged.getResult().get(1)));
    assertEquals(12.0, merged.getSum(0));
    assertEquals(3L, merged.getCount(0));
    assertEquals(2L, first.getCount(0));
  }

  @Test
  void should_not_merge_buffers_of_different_sizes() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AverageBufferAggregate.merge(
                new AverageBufferAggregate(2), new AverageBufferAggregate(3)));
  }
}
