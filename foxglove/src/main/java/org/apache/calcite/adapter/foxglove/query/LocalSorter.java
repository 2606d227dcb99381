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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Sorts materialized rows by one column when the API could not.
 *
 * <p>Absent values compare as the empty string and so come first in
 * ascending order. Two numeric values compare by value; anything else
 * compares by its string form. On temporal columns, values that parse as
 * instants compare by instant and sort after absent values and before
 * unreadable ones, which compare by text. The sort is stable.
 */
public final class LocalSorter {

  private LocalSorter() {}

  public static <R extends Map<String, ?>> List<R> sort(List<R> rows,
      SortDirective sort) {
    return sort(rows, sort, false);
  }

  /** Sorts {@code rows}, comparing instants when the column is temporal. */
  public static <R extends Map<String, ?>> List<R> sort(List<R> rows,
      SortDirective sort, FieldMap fieldMap) {
    return sort(rows, sort, fieldMap.isTemporal(sort.field()));
  }

  private static <R extends Map<String, ?>> List<R> sort(List<R> rows,
      SortDirective sort, boolean temporal) {
    Comparator<R> comparator = temporal
        ? temporalComparator(sort.field())
        : comparator(sort.field());
    if (sort.descending()) {
      comparator = comparator.reversed();
    }
    List<R> sorted = new ArrayList<>(rows);
    sorted.sort(comparator);
    return sorted;
  }

  static <R extends Map<String, ?>> Comparator<R> comparator(String field) {
    return (a, b) -> compareValues(a.get(field), b.get(field));
  }

  static <R extends Map<String, ?>> Comparator<R> temporalComparator(
      String field) {
    return (a, b) -> compareInstants(a.get(field), b.get(field));
  }

  static int compareInstants(Object a, Object b) {
    Instant ia = instant(a);
    Instant ib = instant(b);
    int ra = rank(a, ia);
    int rb = rank(b, ib);
    if (ra != rb) {
      return Integer.compare(ra, rb);
    }
    if (ia != null && ib != null) {
      return ia.compareTo(ib);
    }
    return key(a).compareTo(key(b));
  }

  private static int rank(Object value, Instant instant) {
    if (value == null || key(value).isEmpty()) {
      return 0;
    }
    return instant != null ? 1 : 2;
  }

  private static Instant instant(Object value) {
    return value == null ? null : Timestamps.parse(key(value));
  }

  static int compareValues(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      BigDecimal da = ResultVerifier.decimal(a);
      BigDecimal db = ResultVerifier.decimal(b);
      if (da != null && db != null) {
        return da.compareTo(db);
      }
    }
    return key(a).compareTo(key(b));
  }

  private static String key(Object value) {
    return value == null ? "" : ResultVerifier.text(value);
  }
}
