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

import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptPlanner;
import org.apache.calcite.plan.RelOptRule;
import org.apache.calcite.plan.RelOptTable;
import org.apache.calcite.plan.RelTraitSet;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.TableScan;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Relational expression representing a scan of a Foxglove resource.
 *
 * <p>Filters, projections and ordering pushed on top of it in the
 * {@link FoxgloveRel#CONVENTION} are folded into a single request.
 */
public class FoxgloveTableScan extends TableScan implements FoxgloveRel {

  private final FoxgloveTable foxgloveTable;

  FoxgloveTableScan(RelOptCluster cluster, RelTraitSet traitSet,
      RelOptTable table, FoxgloveTable foxgloveTable) {
    super(cluster, traitSet, ImmutableList.of(), table);
    this.foxgloveTable = requireNonNull(foxgloveTable, "foxgloveTable");

    assert getConvention() == FoxgloveRel.CONVENTION;
  }

  @Override public RelNode copy(RelTraitSet traitSet, List<RelNode> inputs) {
    assert inputs.isEmpty();
    return new FoxgloveTableScan(getCluster(), traitSet, table, foxgloveTable);
  }

  @Override public void register(RelOptPlanner planner) {
    planner.addRule(FoxgloveRules.TO_ENUMERABLE);
    for (RelOptRule rule : FoxgloveRules.RULES) {
      planner.addRule(rule);
    }
  }

  public FoxgloveTable getFoxgloveTable() {
    return foxgloveTable;
  }

  @Override public void implement(Implementor implementor) {
    implementor.foxgloveTable = foxgloveTable;
    implementor.table = table;
    implementor.fields.clear();
    implementor.fields.addAll(foxgloveTable.getResource().columnNames());
  }
}
