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

import org.apache.calcite.adapter.foxglove.query.SortDirective;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptCost;
import org.apache.calcite.plan.RelOptPlanner;
import org.apache.calcite.plan.RelTraitSet;
import org.apache.calcite.rel.RelCollation;
import org.apache.calcite.rel.RelFieldCollation;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Sort;
import org.apache.calcite.rel.metadata.RelMetadataQuery;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of {@link Sort} relational expression in Foxglove.
 *
 * <p>Carries at most one sort key and an optional literal fetch, never an
 * offset. The scan either asks the API for that order or sorts the rows
 * itself; the fetch caps the rows the scan emits.
 */
public class FoxgloveSort extends Sort implements FoxgloveRel {

  public FoxgloveSort(RelOptCluster cluster, RelTraitSet traitSet,
      RelNode input, RelCollation collation, @Nullable RexNode fetch) {
    super(cluster, traitSet, input, collation, null, fetch);
    assert getConvention() == FoxgloveRel.CONVENTION;
    assert getConvention() == input.getConvention();
    assert collation.getFieldCollations().size() <= 1;
    assert fetch == null || fetch instanceof RexLiteral;
  }

  @Override public Sort copy(RelTraitSet traitSet, RelNode input,
      RelCollation newCollation, @Nullable RexNode offset,
      @Nullable RexNode fetch) {
    assert offset == null;
    return new FoxgloveSort(getCluster(), traitSet, input, newCollation, fetch);
  }

  @Override public @Nullable RelOptCost computeSelfCost(RelOptPlanner planner,
      RelMetadataQuery mq) {
    return super.computeSelfCost(planner, mq).multiplyBy(0.05);
  }

  @Override public void implement(Implementor implementor) {
    implementor.visitChild(0, getInput());
    if (!collation.getFieldCollations().isEmpty()) {
      final RelFieldCollation fieldCollation =
          collation.getFieldCollations().get(0);
      final String field = implementor.fields.get(fieldCollation.getFieldIndex());
      implementor.sort = fieldCollation.getDirection().isDescending()
          ? SortDirective.desc(field)
          : SortDirective.asc(field);
    }
    if (fetch != null) {
      final int limit = RexLiteral.intValue(fetch);
      implementor.limit = implementor.limit == null
          ? limit : Math.min(implementor.limit, limit);
    }
  }
}
