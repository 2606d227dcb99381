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

import org.apache.calcite.adapter.enumerable.EnumerableRel;
import org.apache.calcite.adapter.enumerable.EnumerableRelImplementor;
import org.apache.calcite.adapter.enumerable.JavaRowFormat;
import org.apache.calcite.adapter.enumerable.PhysType;
import org.apache.calcite.adapter.enumerable.PhysTypeImpl;
import org.apache.calcite.adapter.foxglove.query.SortDirective;
import org.apache.calcite.adapter.foxglove.resource.ScanRequest;
import org.apache.calcite.linq4j.tree.BlockBuilder;
import org.apache.calcite.linq4j.tree.Expression;
import org.apache.calcite.linq4j.tree.Expressions;
import org.apache.calcite.plan.ConventionTraitDef;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptCost;
import org.apache.calcite.plan.RelOptPlanner;
import org.apache.calcite.plan.RelTraitSet;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.convert.ConverterImpl;
import org.apache.calcite.rel.metadata.RelMetadataQuery;
import org.apache.calcite.runtime.Hook;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Relational expression representing a scan of a Foxglove resource, with
 * the qualifiers, columns and ordering collected from the expressions
 * beneath it.
 */
public class FoxgloveToEnumerableConverter extends ConverterImpl
    implements EnumerableRel {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(FoxgloveToEnumerableConverter.class);

  protected FoxgloveToEnumerableConverter(RelOptCluster cluster,
      RelTraitSet traits, RelNode input) {
    super(cluster, ConventionTraitDef.INSTANCE, traits, input);
  }

  @Override public RelNode copy(RelTraitSet traitSet, List<RelNode> inputs) {
    return new FoxgloveToEnumerableConverter(getCluster(), traitSet, sole(inputs));
  }

  @Override public @Nullable RelOptCost computeSelfCost(RelOptPlanner planner,
      RelMetadataQuery mq) {
    return super.computeSelfCost(planner, mq).multiplyBy(.1);
  }

  @Override public Result implement(EnumerableRelImplementor implementor, Prefer pref) {
    final FoxgloveRel.Implementor foxgloveImplementor = new FoxgloveRel.Implementor();
    foxgloveImplementor.visitChild(0, getInput());

    final SortDirective sort = foxgloveImplementor.sort;
    final ScanRequest request =
        new ScanRequest(foxgloveImplementor.qualifiers,
            foxgloveImplementor.fields,
            sort == null ? ImmutableList.of() : ImmutableList.of(sort),
            foxgloveImplementor.limit);
    final String requestJson = request.toJson();
    LOGGER.debug("{}: {}", foxgloveImplementor.table.getQualifiedName(), requestJson);
    Hook.QUERY_PLAN.run(requestJson);

    final BlockBuilder list = new BlockBuilder();
    final PhysType physType =
        PhysTypeImpl.of(implementor.getTypeFactory(), getRowType(),
            pref.prefer(JavaRowFormat.ARRAY));
    final Expression table =
        list.append("table",
            requireNonNull(
                foxgloveImplementor.table.getExpression(
                    FoxgloveTable.FoxgloveQueryable.class)));
    final Expression enumerable =
        list.append("enumerable",
            Expressions.call(table,
                FoxgloveMethod.FOXGLOVE_QUERYABLE_QUERY.method,
                Expressions.constant(requestJson)));
    list.add(Expressions.return_(null, enumerable));
    return implementor.result(physType, list.toBlock());
  }
}
