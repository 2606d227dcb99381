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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * Read-only description of which logical columns of a resource can be
 * pushed to the upstream API and under which parameter names.
 *
 * <p>Instances are built once per resource and shared by every query.
 */
public final class FieldMap {

  private final ImmutableMap<String, String> equalityParams;
  private final ImmutableMap<String, String> listParams;
  private final ImmutableMap<String, String> sortParams;
  private final ImmutableMap<String, String> lowerBoundParams;
  private final ImmutableMap<String, String> containmentParams;
  private final ImmutableMap<String, String> defaultParams;
  private final ImmutableSet<String> temporalColumns;
  private final ImmutableSet<String> searchColumns;
  private final @Nullable IntervalColumns interval;
  private final @Nullable String limitParam;

  private FieldMap(Builder builder) {
    this.equalityParams = builder.equalityParams.build();
    this.listParams = builder.listParams.build();
    this.sortParams = builder.sortParams.build();
    this.lowerBoundParams = builder.lowerBoundParams.build();
    this.containmentParams = builder.containmentParams.build();
    this.defaultParams = builder.defaultParams.build();
    this.temporalColumns = builder.temporalColumns.build();
    this.searchColumns = builder.searchColumns.build();
    this.interval = builder.interval;
    this.limitParam = builder.limitParam;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Parameter receiving equality on {@code column}, or null. */
  public @Nullable String equalityParam(String column) {
    return equalityParams.get(column);
  }

  /** Parameter collecting every equality value on {@code column} as a list, or null. */
  public @Nullable String listParam(String column) {
    return listParams.get(column);
  }

  /** Upstream sort key for {@code column}, or null if the API cannot sort by it. */
  public @Nullable String sortParam(String column) {
    return sortParams.get(column);
  }

  /** Parameter receiving the greatest lower bound on {@code column}, or null. */
  public @Nullable String lowerBoundParam(String column) {
    return lowerBoundParams.get(column);
  }

  /** Parameter receiving containment tokens for {@code column}, or null. */
  public @Nullable String containmentParam(String column) {
    return containmentParams.get(column);
  }

  /**
   * Whether the API answers equality on {@code column} exactly, so that
   * every row it returns satisfies the equality. Search parameters match
   * more loosely.
   */
  public boolean isExactEquality(String column) {
    return (equalityParams.containsKey(column) || listParams.containsKey(column))
        && !searchColumns.contains(column);
  }

  /** Parameter capping the number of items the API returns, or null. */
  public @Nullable String limitParam() {
    return limitParam;
  }

  public Map<String, String> defaultParams() {
    return defaultParams;
  }

  public Set<String> temporalColumns() {
    return temporalColumns;
  }

  public boolean isTemporal(String column) {
    return temporalColumns.contains(column);
  }

  public @Nullable IntervalColumns interval() {
    return interval;
  }

  public Set<String> sortableColumns() {
    return sortParams.keySet();
  }

  /** Builder for {@link FieldMap}. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, String> equalityParams =
        ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> listParams =
        ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> sortParams =
        ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> lowerBoundParams =
        ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> containmentParams =
        ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> defaultParams =
        ImmutableMap.builder();
    private final ImmutableSet.Builder<String> temporalColumns =
        ImmutableSet.builder();
    private final ImmutableSet.Builder<String> searchColumns =
        ImmutableSet.builder();
    private @Nullable IntervalColumns interval;
    private @Nullable String limitParam;

    private Builder() {}

    public Builder equality(String column, String param) {
      equalityParams.put(column, param);
      return this;
    }

    /** Equality on {@code column} sent as a free-text search. */
    public Builder search(String column, String param) {
      equalityParams.put(column, param);
      searchColumns.add(column);
      return this;
    }

    public Builder limit(String param) {
      this.limitParam = param;
      return this;
    }

    public Builder list(String column, String param) {
      listParams.put(column, param);
      return this;
    }

    public Builder sort(String column, String param) {
      sortParams.put(column, param);
      return this;
    }

    public Builder lowerBound(String column, String param) {
      lowerBoundParams.put(column, param);
      temporalColumns.add(column);
      return this;
    }

    public Builder containment(String column, String param) {
      containmentParams.put(column, param);
      return this;
    }

    public Builder defaultParam(String param, String value) {
      defaultParams.put(param, value);
      return this;
    }

    public Builder temporal(String... columns) {
      temporalColumns.add(columns);
      return this;
    }

    public Builder interval(IntervalColumns interval) {
      this.interval = interval;
      temporalColumns.add(interval.startColumn(), interval.endColumn());
      return this;
    }

    public FieldMap build() {
      return new FieldMap(this);
    }
  }
}
