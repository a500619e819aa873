/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.coordinator.plan.logical.BinaryOperator;
import org.opensearch.tsquery.coordinator.plan.logical.Cardinality;
import org.opensearch.tsquery.coordinator.query.PromQlQueryParams;
import org.opensearch.tsquery.coordinator.query.QueryContext;
import org.opensearch.tsquery.query.QueryConfig;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecPlanTest {

  private final InProcessPlanDispatcher local =
      new InProcessPlanDispatcher(QueryConfig.builder().askTimeoutMs(500L).build());

  private final RemotePlanDispatcher remote = new RemotePlanDispatcher("http://b", 100L);

  private final QueryContext context =
      QueryContext.of(new PromQlQueryParams("a + b", 1L, 2L, 3L));

  @Test
  void should_print_the_plan_tree() {
    ExecPlan lhs = new PromQlRemoteExec(context.withPromQl("a"), remote);
    ExecPlan rhs = new PromQlRemoteExec(context.withPromQl("b"), remote);
    ExecPlan join =
        new BinaryJoinExec(
            context,
            local,
            List.of(lhs),
            List.of(rhs),
            BinaryOperator.ADD,
            Cardinality.ONE_TO_ONE,
            List.of("host"),
            List.of(),
            List.of(),
            "_metric_");
    ExecPlan root = new LabelNamesDistConcatExec(context, local, List.of(join));

    assertEquals(
        "E~LabelNamesDistConcatExec() on LOCAL\n"
            + "-E~BinaryJoinExec(binaryOp=ADD, on=[host], ignoring=[], include=[]) on LOCAL\n"
            + "--E~PromQlRemoteExec(promQl=a, start=1, step=2, end=3, endpoint=http://b)"
            + " on REMOTE\n"
            + "--E~PromQlRemoteExec(promQl=b, start=1, step=2, end=3, endpoint=http://b)"
            + " on REMOTE",
        root.printTree());
  }

  @Test
  void should_report_where_each_node_runs() {
    assertEquals(DispatchLocation.LOCAL, local.getLocation());
    assertEquals(500L, local.getTimeoutMs());
    assertEquals(DispatchLocation.REMOTE, remote.getLocation());
    assertEquals(100L, remote.getTimeoutMs());
  }

  @Test
  void should_give_each_node_its_own_id() {
    assertNotEquals(
        new PromQlRemoteExec(context, remote).getPlanId(),
        new PromQlRemoteExec(context, remote).getPlanId());
  }

  @Test
  void should_keep_set_operators_out_of_binary_joins() {
    List<ExecPlan> side = List.of(new PromQlRemoteExec(context, remote));

    assertThrows(
        IllegalArgumentException.class,
        () ->
            new BinaryJoinExec(
                context,
                local,
                side,
                side,
                BinaryOperator.LAND,
                Cardinality.MANY_TO_MANY,
                List.of(),
                List.of(),
                List.of(),
                "_metric_"));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SetOperatorExec(
                context, local, side, side, BinaryOperator.ADD, List.of(), List.of(), "_metric_"));
  }

  @Test
  void should_require_children_to_combine() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PartKeysDistConcatExec(context, local, List.of()));
  }
}
