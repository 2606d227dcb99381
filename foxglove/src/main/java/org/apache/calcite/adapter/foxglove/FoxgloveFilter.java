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

import org.apache.calcite.adapter.foxglove.query.Qualifier;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptCost;
import org.apache.calcite.plan.RelOptPlanner;
import org.apache.calcite.plan.RelOptUtil;
import org.apache.calcite.plan.RelTraitSet;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Filter;
import org.apache.calcite.rel.metadata.RelMetadataQuery;
import org.apache.calcite.rex.RexNode;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of {@link Filter} relational expression in Foxglove.
 *
 * <p>Its condition is a conjunction of comparisons that
 * {@link FoxgloveFilterTranslator} accepts.
 */
public class FoxgloveFilter extends Filter implements FoxgloveRel {

  public FoxgloveFilter(RelOptCluster cluster, RelTraitSet traitSet,
      RelNode input, RexNode condition) {
    super(cluster, traitSet, input, condition);
    assert getConvention() == FoxgloveRel.CONVENTION;
    assert getConvention() == input.getConvention();
  }

  @Override public FoxgloveFilter copy(RelTraitSet traitSet, RelNode input,
      RexNode condition) {
    return new FoxgloveFilter(getCluster(), traitSet, input, condition);
  }

  @Override public @Nullable RelOptCost computeSelfCost(RelOptPlanner planner,
      RelMetadataQuery mq) {
    return super.computeSelfCost(planner, mq).multiplyBy(0.1);
  }

  @Override public void implement(Implementor implementor) {
    implementor.visitChild(0, getInput());
    final FoxgloveFilterTranslator translator =
        new FoxgloveFilterTranslator(implementor.foxgloveTable.getResource(),
            implementor.fields);
    for (RexNode conjunct : RelOptUtil.conjunctions(condition)) {
      Qualifier qualifier = translator.translate(conjunct);
      if (qualifier == null) {
        throw new AssertionError("cannot translate " + conjunct);
      }
      implementor.qualifiers.add(qualifier);
    }
  }
}
