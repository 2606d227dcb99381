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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of compiling a query's qualifiers and ordering for one resource.
 *
 * <p>Parameter values are strings, except for list parameters which are
 * lists of strings.
 */
public final class CompiledRequest {

  public static final String SORT_BY = "sortBy";
  public static final String SORT_ORDER = "sortOrder";

  private final ImmutableMap<String, Object> params;
  private final @Nullable SortDirective sort;
  private final boolean sortPushedDown;
  private final boolean limitPushedDown;
  private final ImmutableList<Qualifier> satisfied;

  CompiledRequest(Map<String, Object> params, @Nullable SortDirective sort,
      boolean sortPushedDown, boolean limitPushedDown,
      List<Qualifier> satisfied) {
    this.params = ImmutableMap.copyOf(params);
    this.sort = sort;
    this.sortPushedDown = sortPushedDown;
    this.limitPushedDown = limitPushedDown;
    this.satisfied = ImmutableList.copyOf(satisfied);
  }

  /** Upstream parameters, in the order they were set. */
  public Map<String, Object> params() {
    return params;
  }

  public @Nullable Object param(String name) {
    return params.get(name);
  }

  /**
   * Parameters rendered for a query string; list values are joined with
   * commas.
   */
  public Map<String, String> queryParams() {
    Map<String, String> query = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : params.entrySet()) {
      Object value = e.getValue();
      if (value instanceof List) {
        StringBuilder b = new StringBuilder();
        for (Object item : (List<?>) value) {
          if (b.length() > 0) {
            b.append(',');
          }
          b.append(item);
        }
        query.put(e.getKey(), b.toString());
      } else {
        query.put(e.getKey(), String.valueOf(value));
      }
    }
    return query;
  }

  /** The first requested sort key, whether or not it was pushed down. */
  public @Nullable SortDirective sort() {
    return sort;
  }

  /** Whether the upstream was asked to apply {@link #sort()}. */
  public boolean isSortPushedDown() {
    return sortPushedDown;
  }

  /** Whether the upstream was asked to return no more than the row cap. */
  public boolean isLimitPushedDown() {
    return limitPushedDown;
  }

  /** Qualifiers that were translated into upstream parameters. */
  public List<Qualifier> satisfied() {
    return satisfied;
  }

  @Override public String toString() {
    return "CompiledRequest{params=" + params + ", sort=" + sort
        + (sortPushedDown ? " (pushed)" : "")
        + (limitPushedDown ? ", limit pushed" : "") + '}';
  }
}
