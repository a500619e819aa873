/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.coordinator.exec.BinaryJoinExec;
import org.opensearch.tsquery.coordinator.exec.ExecPlan;
import org.opensearch.tsquery.coordinator.exec.InProcessPlanDispatcher;
import org.opensearch.tsquery.coordinator.exec.LabelNamesDistConcatExec;
import org.opensearch.tsquery.coordinator.exec.LabelValuesDistConcatExec;
import org.opensearch.tsquery.coordinator.exec.PartKeysDistConcatExec;
import org.opensearch.tsquery.coordinator.exec.SetOperatorExec;
import org.opensearch.tsquery.coordinator.plan.logical.BinaryJoin;
import org.opensearch.tsquery.coordinator.plan.logical.LabelNames;
import org.opensearch.tsquery.coordinator.plan.logical.LabelValues;
import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlan;
import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlanRenderer;
import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlanUtils;
import org.opensearch.tsquery.coordinator.plan.logical.SeriesKeysByFilters;
import org.opensearch.tsquery.coordinator.plan.logical.TsCardinalities;
import org.opensearch.tsquery.coordinator.query.QueryContext;
import org.opensearch.tsquery.query.QueryConfig;

/**
 * Plans queries over a set of partitions that each hold a disjoint subset of the metrics. A
 * partition is a cluster with its own planner; the partition of a metric is chosen by the planner
 * selector.
 *
 * <ul>
 *   <li>Binary joins whose leaves all live in one partition are planned by that partition.
 *       Otherwise each side is re-rendered to query text and planned on its own, and the two
 *       results are joined locally.
 *   <li>Label values, label names and series keys are asked of every distinct partition planner
 *       and the answers are concatenated locally.
 *   <li>Cardinality queries always go to the default partition. Partitions holding other data are
 *       not consulted.
 *   <li>Any other plan is planned by the partition of the first metric it selects.
 * </ul>
 */
@Log4j2
public class SinglePartitionPlanner implements QueryPlanner {

  private final ImmutableSortedMap<String, QueryPlanner> planners;
  private final String defaultPlanner;
  private final Function<String, String> plannerSelector;
  private final String datasetMetricColumn;
  private final LogicalPlanRenderer renderer;
  private final InProcessPlanDispatcher inProcessPlanDispatcher;

  /**
   * @param planners planner of each partition, by partition name
   * @param defaultPlanner name of the partition that answers cardinality queries
   * @param plannerSelector maps a metric name to the name of its partition
   * @param datasetMetricColumn name of the column holding metric names
   * @param queryConfig settings of the combining nodes built here
   * @param renderer turns join sides back into query text
   */
  public SinglePartitionPlanner(
      Map<String, QueryPlanner> planners,
      String defaultPlanner,
      Function<String, String> plannerSelector,
      String datasetMetricColumn,
      QueryConfig queryConfig,
      LogicalPlanRenderer renderer) {
    Preconditions.checkArgument(!planners.isEmpty(), "At least one partition planner is required");
    Preconditions.checkArgument(
        planners.containsKey(defaultPlanner),
        "Default partition %s has no planner, known partitions are %s",
        defaultPlanner,
        planners.keySet());
    this.planners = ImmutableSortedMap.copyOf(planners);
    this.defaultPlanner = defaultPlanner;
    this.plannerSelector = plannerSelector;
    this.datasetMetricColumn = datasetMetricColumn;
    this.renderer = renderer;
    this.inProcessPlanDispatcher = new InProcessPlanDispatcher(queryConfig);
  }

  @Override
  public ExecPlan materialize(LogicalPlan plan, QueryContext context) {
    if (plan instanceof BinaryJoin join) {
      return materializeBinaryJoin(join, context);
    } else if (plan instanceof LabelValues) {
      List<ExecPlan> plans = materializeOnEveryPlanner(plan, context);
      return plans.size() == 1
          ? plans.get(0)
          : new LabelValuesDistConcatExec(context, inProcessPlanDispatcher, plans);
    } else if (plan instanceof LabelNames) {
      List<ExecPlan> plans = materializeOnEveryPlanner(plan, context);
      return plans.size() == 1
          ? plans.get(0)
          : new LabelNamesDistConcatExec(context, inProcessPlanDispatcher, plans);
    } else if (plan instanceof SeriesKeysByFilters) {
      List<ExecPlan> plans = materializeOnEveryPlanner(plan, context);
      return plans.size() == 1
          ? plans.get(0)
          : new PartKeysDistConcatExec(context, inProcessPlanDispatcher, plans);
    } else if (plan instanceof TsCardinalities) {
      // Only the default partition is asked, whatever the other partitions hold.
      log.debug(
          "Routing cardinality query {} to default partition {}",
          context.getQueryId(),
          defaultPlanner);
      return planners.get(defaultPlanner).materialize(plan, context);
    }
    return getPlanner(plan).materialize(plan, context);
  }

  /**
   * Returns the planner of the partition holding the first metric the plan selects. A plan without
   * a metric goes to the partition whose name sorts first.
   *
   * @throws IllegalStateException if the selector names a partition without a planner
   */
  QueryPlanner getPlanner(LogicalPlan plan) {
    Optional<String> metric = LogicalPlanUtils.getMetricName(plan, datasetMetricColumn);
    if (metric.isEmpty()) {
      log.debug("No metric in {}, using partition {}", plan, planners.firstKey());
      return planners.firstEntry().getValue();
    }
    String partition = plannerSelector.apply(metric.get());
    QueryPlanner planner = planners.get(partition);
    if (planner == null) {
      throw new IllegalStateException(
          String.format(
              "Metric %s maps to partition %s which has no planner, known partitions are %s",
              metric.get(), partition, planners.keySet()));
    }
    log.debug("Metric {} maps to partition {}", metric.get(), partition);
    return planner;
  }

  private ExecPlan materializeBinaryJoin(BinaryJoin join, QueryContext context) {
    List<QueryPlanner> allPlanners = getBinaryJoinPlanners(join);
    QueryPlanner first = allPlanners.get(0);
    if (allPlanners.stream().allMatch(planner -> planner == first)) {
      return first.materialize(join, context);
    }

    log.info(
        "Splitting {} join of query {} across {} partition plans",
        join.getOperator(),
        context.getQueryId(),
        allPlanners.size());
    QueryContext lhsContext = context.withPromQl(renderer.convertToQuery(join.getLhs()));
    QueryContext rhsContext = context.withPromQl(renderer.convertToQuery(join.getRhs()));
    ExecPlan lhsExec = materializeJoinSide(join.getLhs(), lhsContext);
    ExecPlan rhsExec = materializeJoinSide(join.getRhs(), rhsContext);

    List<String> on = LogicalPlanUtils.renameLabels(join.getOn(), datasetMetricColumn);
    List<String> ignoring = LogicalPlanUtils.renameLabels(join.getIgnoring(), datasetMetricColumn);
    if (join.getOperator().isSetOperator()) {
      return new SetOperatorExec(
          context,
          inProcessPlanDispatcher,
          List.of(lhsExec),
          List.of(rhsExec),
          join.getOperator(),
          on,
          ignoring,
          datasetMetricColumn);
    }
    return new BinaryJoinExec(
        context,
        inProcessPlanDispatcher,
        List.of(lhsExec),
        List.of(rhsExec),
        join.getOperator(),
        join.getCardinality(),
        on,
        ignoring,
        LogicalPlanUtils.renameLabels(join.getInclude(), datasetMetricColumn),
        datasetMetricColumn);
  }

  private ExecPlan materializeJoinSide(LogicalPlan side, QueryContext context) {
    if (side instanceof BinaryJoin join) {
      return materializeBinaryJoin(join, context);
    }
    return getPlanner(side).materialize(side, context);
  }

  /** Planners of the non-join leaves of a join tree, left to right. */
  private List<QueryPlanner> getBinaryJoinPlanners(BinaryJoin join) {
    ImmutableList.Builder<QueryPlanner> planners = ImmutableList.builder();
    for (LogicalPlan side : List.of(join.getLhs(), join.getRhs())) {
      if (side instanceof BinaryJoin nested) {
        planners.addAll(getBinaryJoinPlanners(nested));
      } else {
        planners.add(getPlanner(side));
      }
    }
    return planners.build();
  }

  private List<ExecPlan> materializeOnEveryPlanner(LogicalPlan plan, QueryContext context) {
    Set<QueryPlanner> seen = Sets.newIdentityHashSet();
    ImmutableList.Builder<ExecPlan> plans = ImmutableList.builder();
    for (QueryPlanner planner : planners.values()) {
      if (seen.add(planner)) {
        plans.add(planner.materialize(plan, context));
      }
    }
    List<ExecPlan> result = plans.build();
    log.info(
        "Fanned out {} of query {} to {} partition planners",
        plan.getClass().getSimpleName(),
        context.getQueryId(),
        result.size());
    return result;
  }
}
