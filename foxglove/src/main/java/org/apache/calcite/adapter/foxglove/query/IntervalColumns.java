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

import static java.util.Objects.requireNonNull;

/**
 * Describes how the time columns of a resource map onto the upstream
 * {@code start}/{@code end} window parameters.
 *
 * <p>A <em>cross-mapped</em> pair describes an interval whose overlap with
 * the window is tested upstream: any lower-bound comparison on either
 * column narrows the window start and any upper-bound comparison narrows
 * the window end. A plain pair only accepts lower bounds on the start
 * column and upper bounds on the end column. A point column (one whose
 * start and end column are the same) behaves like a plain pair.
 */
public final class IntervalColumns {

  /** What to do when only one side of the window was constrained. */
  public enum Synthesis {
    /** Leave the missing side out of the request. */
    NEVER,
    /** Fill the missing side with the epoch or the current instant. */
    WHEN_EITHER
  }

  private final String startColumn;
  private final String endColumn;
  private final String lowerParam;
  private final String upperParam;
  private final boolean crossMapped;
  private final Synthesis synthesis;

  private IntervalColumns(String startColumn, String endColumn,
      String lowerParam, String upperParam, boolean crossMapped,
      Synthesis synthesis) {
    this.startColumn = requireNonNull(startColumn, "startColumn");
    this.endColumn = requireNonNull(endColumn, "endColumn");
    this.lowerParam = requireNonNull(lowerParam, "lowerParam");
    this.upperParam = requireNonNull(upperParam, "upperParam");
    this.crossMapped = crossMapped;
    this.synthesis = requireNonNull(synthesis, "synthesis");
  }

  /** An interval whose bounds are inferred from both columns. */
  public static IntervalColumns crossMapped(String startColumn,
      String endColumn, String lowerParam, String upperParam,
      Synthesis synthesis) {
    return new IntervalColumns(startColumn, endColumn, lowerParam,
        upperParam, true, synthesis);
  }

  /** Lower bounds come from the start column, upper bounds from the end column. */
  public static IntervalColumns plain(String startColumn, String endColumn,
      String lowerParam, String upperParam, Synthesis synthesis) {
    return new IntervalColumns(startColumn, endColumn, lowerParam,
        upperParam, false, synthesis);
  }

  /** A single instant column such as a message log time. */
  public static IntervalColumns point(String column, String lowerParam,
      String upperParam, Synthesis synthesis) {
    return new IntervalColumns(column, column, lowerParam, upperParam, false,
        synthesis);
  }

  public String startColumn() {
    return startColumn;
  }

  public String endColumn() {
    return endColumn;
  }

  public String lowerParam() {
    return lowerParam;
  }

  public String upperParam() {
    return upperParam;
  }

  public boolean isCrossMapped() {
    return crossMapped;
  }

  public Synthesis synthesis() {
    return synthesis;
  }

  public boolean covers(String column) {
    return startColumn.equals(column) || endColumn.equals(column);
  }

  /** Whether a comparison on a covered column narrows the window start. */
  boolean narrowsLower(String column, Operator op) {
    if (op != Operator.EQ && !op.isLowerBound()) {
      return false;
    }
    return crossMapped || startColumn.equals(column);
  }

  /** Whether a comparison on a covered column narrows the window end. */
  boolean narrowsUpper(String column, Operator op) {
    if (op != Operator.EQ && !op.isUpperBound()) {
      return false;
    }
    return crossMapped || endColumn.equals(column);
  }
}
