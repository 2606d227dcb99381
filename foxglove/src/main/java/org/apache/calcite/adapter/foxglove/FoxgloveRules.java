/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.foxglove;

import org.apache.calcite.adapter.enumerable.EnumerableConvention;
import org.apache.calcite.adapter.foxglove.query.Qualifier;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveResource;
import org.apache.calcite.plan.Convention;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptRule;
import org.apache.calcite.plan.RelOptRuleCall;
import org.apache.calcite.plan.RelOptUtil;
import org.apache.calcite.plan.RelRule;
import org.apache.calcite.plan.RelTraitSet;
import org.apache.calcite.rel.RelCollations;
import org.apache.calcite.rel.RelFieldCollation;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.convert.ConverterRule;
import org.apache.calcite.rel.core.Sort;
import org.apache.calcite.rel.logical.LogicalFilter;
import org.apache.calcite.rel.logical.LogicalProject;
import org.apache.calcite.rel.metadata.RelColumnOrigin;
import org.apache.calcite.rel.metadata.RelMetadataQuery;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.rex.RexUtil;
import org.apache.calcite.tools.RelBuilderFactory;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Planner rules relating to the Foxglove adapter. */
public final class FoxgloveRules {
  private static final Logger LOGGER = LoggerFactory.getLogger(FoxgloveRules.class);

  private FoxgloveRules() {}

  /** Rule that pushes translatable filter conjuncts into a
   * {@link FoxgloveTableScan}. */
  public static final FoxgloveFilterRule FILTER =
      (FoxgloveFilterRule) FoxgloveFilterRule.Config.DEFAULT.toRule();

  /** Rule that converts column-only projections to {@link FoxgloveProject}. */
  public static final FoxgloveProjectRule PROJECT =
      FoxgloveProjectRule.DEFAULT_CONFIG.toRule(FoxgloveProjectRule.class);

  /** Rule that converts single-key sorts and literal fetches to
   * {@link FoxgloveSort}. */
  public static final FoxgloveSortRule SORT =
      FoxgloveSortRule.DEFAULT_CONFIG.toRule(FoxgloveSortRule.class);

  /** Rule that converts the Foxglove convention to enumerable. */
  public static final FoxgloveToEnumerableConverterRule TO_ENUMERABLE =
      FoxgloveToEnumerableConverterRule.DEFAULT_CONFIG
          .toRule(FoxgloveToEnumerableConverterRule.class);

  public static final List<RelOptRule> RULES =
      ImmutableList.of(FILTER, PROJECT, SORT);

  /**
   * Rule that splits a {@link LogicalFilter} on a {@link FoxgloveTableScan}
   * into a {@link FoxgloveFilter} holding the conjuncts the API can use and a
   * residual filter for the rest.
   */
  public static class FoxgloveFilterRule extends RelRule<FoxgloveFilterRule.Config> {

    private FoxgloveFilterRule(Config config) {
      super(config);
    }

    @Override public void onMatch(RelOptRuleCall call) {
      final LogicalFilter filter = call.rel(0);
      final FoxgloveTableScan scan = call.rel(1);
      final RelOptCluster cluster = filter.getCluster();
      final RexBuilder rexBuilder = cluster.getRexBuilder();
      final FoxgloveResource resource = scan.getFoxgloveTable().getResource();
      final FoxgloveFilterTranslator translator =
          new FoxgloveFilterTranslator(resource, scan.getRowType().getFieldNames());

      final RexNode condition =
          RexUtil.expandSearch(rexBuilder, null, filter.getCondition());
      final List<RexNode> pushed = new ArrayList<>();
      final List<RexNode> residual = new ArrayList<>();
      for (RexNode conjunct : RelOptUtil.conjunctions(condition)) {
        Qualifier qualifier = translator.translate(conjunct);
        if (qualifier == null) {
          residual.add(conjunct);
          continue;
        }
        pushed.add(conjunct);
        if (translator.needsResidual(qualifier)) {
          residual.add(conjunct);
        }
      }
      if (pushed.isEmpty()) {
        return;
      }
      LOGGER.debug("{}: pushing {} conjunct(s), {} left in residual filter",
          resource.name(), pushed.size(), residual.size());

      final RelNode foxgloveFilter =
          new FoxgloveFilter(cluster, scan.getTraitSet(), scan,
              RexUtil.composeConjunction(rexBuilder, pushed));
      if (residual.isEmpty()) {
        call.transformTo(foxgloveFilter);
      } else {
        call.transformTo(
            LogicalFilter.create(foxgloveFilter,
                RexUtil.composeConjunction(rexBuilder, residual)));
      }
    }

    /** Configuration for {@link FoxgloveFilterRule}. */
    public static class Config implements RelRule.Config {
      private final OperandTransform operandSupplier;

      private Config() {
        this.operandSupplier = b0 ->
            b0.operand(LogicalFilter.class).oneInput(b1 ->
                b1.operand(FoxgloveTableScan.class).noInputs());
      }

      public static final Config DEFAULT = new Config();

      @Override public RelRule.Config withOperandSupplier(OperandTransform transform) {
        return this;
      }

      @Override public RelRule.Config withDescription(String description) {
        return this;
      }

      @Override public RelRule.Config withRelBuilderFactory(
          RelBuilderFactory factory) {
        return this;
      }

      @Override public RelOptRule toRule() {
        return new FoxgloveFilterRule(this);
      }

      @Override public String description() {
        return "FoxgloveFilterRule";
      }

      @Override public OperandTransform operandSupplier() {
        return operandSupplier;
      }
    }
  }

  /**
   * Rule to convert a {@link LogicalProject} made only of column references
   * to a {@link FoxgloveProject}.
   */
  public static class FoxgloveProjectRule extends ConverterRule {
    static final Config DEFAULT_CONFIG = Config.INSTANCE
        .withConversion(LogicalProject.class, Convention.NONE,
            FoxgloveRel.CONVENTION, "FoxgloveProjectRule")
        .withRuleFactory(FoxgloveProjectRule::new);

    protected FoxgloveProjectRule(Config config) {
      super(config);
    }

    @Override public boolean matches(RelOptRuleCall call) {
      final LogicalProject project = call.rel(0);
      for (RexNode e : project.getProjects()) {
        if (!(e instanceof RexInputRef)) {
          return false;
        }
      }
      return true;
    }

    @Override public RelNode convert(RelNode rel) {
      final LogicalProject project = (LogicalProject) rel;
      final RelTraitSet traitSet = project.getTraitSet().replace(out);
      return new FoxgloveProject(project.getCluster(), traitSet,
          convert(project.getInput(), out), project.getProjects(),
          project.getRowType());
    }
  }

  /**
   * Rule to convert a {@link Sort} to a {@link FoxgloveSort}.
   *
   * <p>Applies to at most one key and a literal fetch without offset. The
   * key must be a column of the resource, with the null direction the scan
   * produces: absent values first when ascending, last when descending.
   */
  public static class FoxgloveSortRule extends ConverterRule {
    static final Config DEFAULT_CONFIG = Config.INSTANCE
        .withConversion(Sort.class, Convention.NONE,
            FoxgloveRel.CONVENTION, "FoxgloveSortRule")
        .withRuleFactory(FoxgloveSortRule::new);

    protected FoxgloveSortRule(Config config) {
      super(config);
    }

    @Override public boolean matches(RelOptRuleCall call) {
      final Sort sort = call.rel(0);
      if (sort.offset != null) {
        return false;
      }
      if (sort.fetch != null && !(sort.fetch instanceof RexLiteral)) {
        return false;
      }
      final List<RelFieldCollation> collations =
          sort.getCollation().getFieldCollations();
      if (collations.isEmpty()) {
        return sort.fetch != null;
      }
      if (collations.size() != 1) {
        return false;
      }
      final RelMetadataQuery mq = call.getMetadataQuery();
      final Double maxRowCount = mq.getMaxRowCount(sort.getInput());
      if (maxRowCount != null && !maxRowCount.isInfinite()) {
        // input is already capped; the scan would order before capping
        return false;
      }
      final RelFieldCollation fieldCollation = collations.get(0);
      switch (fieldCollation.getDirection()) {
      case ASCENDING:
        if (fieldCollation.nullDirection != RelFieldCollation.NullDirection.FIRST) {
          return false;
        }
        break;
      case DESCENDING:
        if (fieldCollation.nullDirection != RelFieldCollation.NullDirection.LAST) {
          return false;
        }
        break;
      default:
        return false;
      }
      final RelColumnOrigin origin =
          mq.getColumnOrigin(sort.getInput(), fieldCollation.getFieldIndex());
      if (origin == null || origin.isDerived()) {
        return false;
      }
      final FoxgloveTable table =
          origin.getOriginTable().unwrap(FoxgloveTable.class);
      if (table == null) {
        return false;
      }
      final FoxgloveResource resource = table.getResource();
      final String column =
          resource.columns().get(origin.getOriginColumnOrdinal()).name();
      return resource.canSort(column);
    }

    @Override public @Nullable RelNode convert(RelNode rel) {
      final Sort sort = (Sort) rel;
      final RelTraitSet traitSet =
          sort.getTraitSet().replace(out).replace(sort.getCollation());
      return new FoxgloveSort(rel.getCluster(), traitSet,
          convert(sort.getInput(), traitSet.replace(RelCollations.EMPTY)),
          sort.getCollation(), sort.fetch);
    }
  }

  /**
   * Rule to convert a relational expression from
   * {@link FoxgloveRel#CONVENTION} to {@link EnumerableConvention}.
   */
  public static class FoxgloveToEnumerableConverterRule extends ConverterRule {
    static final Config DEFAULT_CONFIG = Config.INSTANCE
        .withConversion(RelNode.class, FoxgloveRel.CONVENTION,
            EnumerableConvention.INSTANCE,
            "FoxgloveToEnumerableConverterRule")
        .withRuleFactory(FoxgloveToEnumerableConverterRule::new);

    protected FoxgloveToEnumerableConverterRule(Config config) {
      super(config);
    }

    @Override public RelNode convert(RelNode rel) {
      final RelTraitSet newTraitSet = rel.getTraitSet().replace(getOutConvention());
      return new FoxgloveToEnumerableConverter(rel.getCluster(), newTraitSet, rel);
    }
  }
}
