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
import org.apache.calcite.adapter.foxglove.query.SortDirective;
import org.apache.calcite.plan.Convention;
import org.apache.calcite.plan.RelOptTable;
import org.apache.calcite.rel.RelNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Relational expression that uses Foxglove calling convention.
 */
public interface FoxgloveRel extends RelNode {

  Convention CONVENTION = new Convention.Impl("FOXGLOVE", FoxgloveRel.class);

  /**
   * Callback for the implementation process.
   */
  void implement(Implementor implementor);

  /**
   * Shared context for implementing a Foxglove relational expression.
   *
   * <p>{@code fields} holds, for each output position of the expression
   * being implemented, the name of the underlying resource column.
   */
  class Implementor {
    FoxgloveTable foxgloveTable;
    RelOptTable table;

    final List<String> fields = new ArrayList<>();
    final List<Qualifier> qualifiers = new ArrayList<>();
    @Nullable SortDirective sort;
    @Nullable Integer limit;

    void visitChild(int ordinal, RelNode input) {
      assert ordinal == 0;
      ((FoxgloveRel) input).implement(this);
    }
  }
}
