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
package org.apache.calcite.adapter.foxglove.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators a {@link Qualifier} may carry.
 */
public enum Operator {
  EQ("="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),
  /** JSON containment: every key of the operand is present in the value. */
  CONTAINS("@>");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue public String symbol() {
    return symbol;
  }

  /** Whether the operator implies a lower bound on the column. */
  public boolean isLowerBound() {
    return this == GT || this == GE;
  }

  /** Whether the operator implies an upper bound on the column. */
  public boolean isUpperBound() {
    return this == LT || this == LE;
  }

  public boolean isRange() {
    return isLowerBound() || isUpperBound();
  }

  /** Returns the operator obtained by swapping the operands. */
  public Operator reverse() {
    switch (this) {
    case GT:
      return LT;
    case GE:
      return LE;
    case LT:
      return GT;
    case LE:
      return GE;
    default:
      return this;
    }
  }

  @JsonCreator public static Operator of(String symbol) {
    for (Operator op : values()) {
      if (op.symbol.equals(symbol) || op.name().equals(symbol)) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown operator: " + symbol);
  }
}
