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

import org.apache.calcite.adapter.foxglove.query.Containment;
import org.apache.calcite.adapter.foxglove.query.Operator;
import org.apache.calcite.adapter.foxglove.query.Qualifier;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveResource;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.rex.RexUtil;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.validate.SqlUserDefinedFunction;
import org.apache.calcite.util.DateString;
import org.apache.calcite.util.TimestampString;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Translates filter conjuncts over a Foxglove scan into {@link Qualifier}s.
 *
 * <p>Accepted forms are a column compared with a literal (either side),
 * where {@code =} applies to every non-JSON column and {@code <}, {@code <=},
 * {@code >}, {@code >=} apply to timestamp columns, and
 * {@code metadata_contains(column, 'json')} on a JSON column.
 */
class FoxgloveFilterTranslator {

  /** Name of the containment function registered by {@link FoxgloveSchema}. */
  static final String METADATA_CONTAINS = "metadata_contains";

  private final FoxgloveResource resource;
  private final List<String> fieldNames;

  /**
   * Creates a translator.
   *
   * @param resource resource being scanned
   * @param fieldNames resource column name at each input position
   */
  FoxgloveFilterTranslator(FoxgloveResource resource, List<String> fieldNames) {
    this.resource = resource;
    this.fieldNames = fieldNames;
  }

  /** Returns the qualifier equivalent to {@code conjunct}, or null. */
  @Nullable Qualifier translate(RexNode conjunct) {
    if (!(conjunct instanceof RexCall)) {
      return null;
    }
    final RexCall call = (RexCall) conjunct;
    switch (call.getKind()) {
    case EQUALS:
      return comparison(call, Operator.EQ);
    case GREATER_THAN:
      return comparison(call, Operator.GT);
    case GREATER_THAN_OR_EQUAL:
      return comparison(call, Operator.GE);
    case LESS_THAN:
      return comparison(call, Operator.LT);
    case LESS_THAN_OR_EQUAL:
      return comparison(call, Operator.LE);
    case OTHER_FUNCTION:
      return containment(call);
    default:
      return null;
    }
  }

  /**
   * Whether a pushed qualifier must still be evaluated above the scan.
   * Columns that echo request parameters are never checked by the scan.
   */
  boolean needsResidual(Qualifier qualifier) {
    return resource.isEcho(qualifier.field());
  }

  private @Nullable Qualifier comparison(RexCall call, Operator operator) {
    final RexNode left = call.getOperands().get(0);
    final RexNode right = call.getOperands().get(1);
    String column = columnName(left);
    RexLiteral literal = literal(right);
    Operator op = operator;
    if (column == null || literal == null) {
      column = columnName(right);
      literal = literal(left);
      op = operator.reverse();
    }
    if (column == null || literal == null) {
      return null;
    }
    final FoxgloveColumn target = resource.column(column);
    if (target == null) {
      return null;
    }
    if (op == Operator.EQ) {
      if (target.type() == FoxgloveColumn.Type.JSON) {
        return null;
      }
    } else if (target.type() != FoxgloveColumn.Type.TIMESTAMP) {
      return null;
    }
    final Object value = literalValue(literal);
    if (value == null) {
      return null;
    }
    return Qualifier.of(column, op, value);
  }

  private @Nullable Qualifier containment(RexCall call) {
    if (!(call.getOperator() instanceof SqlUserDefinedFunction)
        || !METADATA_CONTAINS.equals(
            call.getOperator().getName().toLowerCase(Locale.ROOT))
        || call.getOperands().size() != 2) {
      return null;
    }
    final String column = columnName(call.getOperands().get(0));
    final RexLiteral literal = literal(call.getOperands().get(1));
    if (column == null || literal == null) {
      return null;
    }
    final FoxgloveColumn target = resource.column(column);
    if (target == null || target.type() != FoxgloveColumn.Type.JSON
        || resource.fieldMap().containmentParam(column) == null) {
      return null;
    }
    final String json = literal.getValueAs(String.class);
    if (json == null || Containment.target(json) == null) {
      return null;
    }
    return Qualifier.of(column, Operator.CONTAINS, json);
  }

  private @Nullable String columnName(RexNode node) {
    RexNode e = node;
    if (e.getKind() == SqlKind.CAST && RexUtil.isLosslessCast(e)) {
      e = ((RexCall) e).getOperands().get(0);
    }
    if (e instanceof RexInputRef) {
      return fieldNames.get(((RexInputRef) e).getIndex());
    }
    return null;
  }

  private static @Nullable RexLiteral literal(RexNode node) {
    if (node instanceof RexLiteral && !((RexLiteral) node).isNull()) {
      return (RexLiteral) node;
    }
    return null;
  }

  /** Converts a literal to the value carried by a qualifier. */
  static @Nullable Object literalValue(RexLiteral literal) {
    switch (literal.getTypeName()) {
    case CHAR:
    case VARCHAR:
      return literal.getValueAs(String.class);
    case BOOLEAN:
      return literal.getValueAs(Boolean.class);
    case TINYINT:
    case SMALLINT:
    case INTEGER:
    case BIGINT:
    case DECIMAL:
      return literal.getValueAs(BigDecimal.class);
    case FLOAT:
    case REAL:
    case DOUBLE:
      return literal.getValueAs(Double.class);
    case DATE:
      DateString date = literal.getValueAs(DateString.class);
      return date == null ? null : date.toString();
    case TIMESTAMP:
      TimestampString timestamp = literal.getValueAs(TimestampString.class);
      return timestamp == null ? null : timestamp.toString();
    default:
      return null;
    }
  }
}
