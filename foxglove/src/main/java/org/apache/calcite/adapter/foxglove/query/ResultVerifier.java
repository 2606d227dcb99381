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

import org.apache.calcite.adapter.foxglove.util.Timestamps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Re-evaluates every qualifier against each row produced by the upstream.
 *
 * <p>All qualifiers are checked, including those that were pushed down:
 * the API's bound inclusiveness and matching rules do not always agree
 * with the query's. Rules:
 *
 * <ul>
 *   <li>A qualifier on a column the row does not carry is skipped; such
 *   columns are echoed from the request.</li>
 *   <li>Equality compares string forms, so {@code 42} equals {@code "42"};
 *   numbers are compared by value and time columns as instants.</li>
 *   <li>Comparisons on time columns pass when either side cannot be
 *   parsed.</li>
 *   <li>Containment requires every key and matches lists by membership.</li>
 * </ul>
 */
public class ResultVerifier {

  private final FieldMap fieldMap;

  public ResultVerifier(FieldMap fieldMap) {
    this.fieldMap = fieldMap;
  }

  /** Returns whether {@code row} satisfies every qualifier. */
  public boolean accepts(Map<String, ?> row, List<Qualifier> qualifiers) {
    for (Qualifier q : qualifiers) {
      if (!row.containsKey(q.field())) {
        continue;
      }
      if (!accepts(row.get(q.field()), q)) {
        return false;
      }
    }
    return true;
  }

  private boolean accepts(@Nullable Object actual, Qualifier q) {
    switch (q.operator()) {
    case EQ:
      if (actual == null || q.value() == null) {
        return false;
      }
      if (fieldMap.isTemporal(q.field())) {
        Instant left = Timestamps.parse(actual);
        Instant right = Timestamps.parse(q.value());
        if (left != null && right != null) {
          return left.equals(right);
        }
      }
      return looselyEqual(actual, q.value());
    case GT:
    case GE:
    case LT:
    case LE:
      return compares(actual, q);
    case CONTAINS:
      ObjectNode target = Containment.target(q.value());
      return target == null || Containment.matches(actual, target);
    default:
      throw new AssertionError(q.operator());
    }
  }

  private boolean compares(@Nullable Object actual, Qualifier q) {
    final int c;
    if (fieldMap.isTemporal(q.field())) {
      Instant left = Timestamps.parse(actual);
      Instant right = Timestamps.parse(q.value());
      if (left == null || right == null) {
        return true;
      }
      c = left.compareTo(right);
    } else {
      BigDecimal left = decimal(actual);
      BigDecimal right = decimal(q.value());
      if (left == null || right == null) {
        return true;
      }
      c = left.compareTo(right);
    }
    switch (q.operator()) {
    case GT:
      return c > 0;
    case GE:
      return c >= 0;
    case LT:
      return c < 0;
    default:
      return c <= 0;
    }
  }

  /** Equality of string forms, falling back to numeric comparison. */
  static boolean looselyEqual(Object left, Object right) {
    String l = text(left);
    String r = text(right);
    if (l.equals(r)) {
      return true;
    }
    BigDecimal ld = decimal(l);
    BigDecimal rd = decimal(r);
    return ld != null && rd != null && ld.compareTo(rd) == 0;
  }

  static String text(Object value) {
    if (value instanceof JsonNode) {
      JsonNode node = (JsonNode) value;
      return node.isValueNode() ? node.asText() : node.toString();
    }
    return String.valueOf(value);
  }

  static @Nullable BigDecimal decimal(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
    }
    String s = text(value).trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
