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
package org.apache.calcite.adapter.foxglove.resource;

import org.apache.calcite.adapter.foxglove.query.CompileHook;
import org.apache.calcite.adapter.foxglove.query.FieldMap;
import org.apache.calcite.adapter.foxglove.query.IntervalColumns;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable description of one Foxglove endpoint exposed as a table.
 *
 * <p>A resource knows its columns, how qualifiers on them translate to
 * request parameters, how an upstream item becomes a row, and which
 * columns merely echo request parameters back.
 */
public final class FoxgloveResource {

  /** How rows are obtained from the API. */
  public enum Kind {
    /** {@code GET} returning a JSON array of objects. */
    COLLECTION,
    /** {@code POST} returning a retrieval link to an MCAP container. */
    STREAM
  }

  private final String name;
  private final Kind kind;
  private final String path;
  private final FieldMap fieldMap;
  private final ImmutableList<FoxgloveColumn> columns;
  private final ImmutableMap<String, FoxgloveColumn> columnsByName;
  private final @Nullable RowMapper rowMapper;
  private final ImmutableMap<String, String> echoColumns;
  private final CompileHook hook;

  private FoxgloveResource(Builder builder) {
    this.name = builder.name;
    this.kind = builder.kind;
    this.path = requireNonNull(builder.path, "path");
    this.fieldMap = builder.fieldMap.build();
    this.columns = builder.columns.build();
    ImmutableMap.Builder<String, FoxgloveColumn> byName = ImmutableMap.builder();
    this.echoColumns = builder.echoColumns.build();
    for (FoxgloveColumn column : columns) {
      byName.put(column.name(), column);
    }
    this.columnsByName = byName.build();
    this.rowMapper = builder.rowMapper;
    this.hook = builder.hook;
    if (kind == Kind.COLLECTION && rowMapper == null) {
      throw new IllegalArgumentException("resource " + name
          + " needs a row mapper");
    }
  }

  public static Builder builder(String name, Kind kind) {
    return new Builder(name, kind);
  }

  public String name() {
    return name;
  }

  public Kind kind() {
    return kind;
  }

  /** Endpoint path relative to the API base URL. */
  public String path() {
    return path;
  }

  public FieldMap fieldMap() {
    return fieldMap;
  }

  public List<FoxgloveColumn> columns() {
    return columns;
  }

  public @Nullable FoxgloveColumn column(String columnName) {
    return columnsByName.get(columnName);
  }

  public List<String> columnNames() {
    return columns.stream().map(FoxgloveColumn::name)
        .collect(ImmutableList.toImmutableList());
  }

  public @Nullable RowMapper rowMapper() {
    return rowMapper;
  }

  /** Columns filled from request parameters, keyed by column name. */
  public Map<String, String> echoColumns() {
    return echoColumns;
  }

  public boolean isEcho(String columnName) {
    return echoColumns.containsKey(columnName);
  }

  public CompileHook hook() {
    return hook;
  }

  /** Whether the API itself can order by {@code columnName}. */
  public boolean canSortUpstream(String columnName) {
    return fieldMap.sortParam(columnName) != null;
  }

  /**
   * Whether rows can be delivered ordered by {@code columnName}. Any column
   * can be; those the API cannot order by are sorted after retrieval.
   */
  public boolean canSort(String columnName) {
    return columnsByName.containsKey(columnName);
  }

  @Override public String toString() {
    return "FoxgloveResource{" + name + ", " + kind + " " + path + "}";
  }

  /** Builder for {@link FoxgloveResource}. */
  public static final class Builder {
    private final String name;
    private final Kind kind;
    private @Nullable String path;
    private final FieldMap.Builder fieldMap = FieldMap.builder();
    private final ImmutableList.Builder<FoxgloveColumn> columns =
        ImmutableList.builder();
    private final ImmutableMap.Builder<String, String> echoColumns =
        ImmutableMap.builder();
    private @Nullable RowMapper rowMapper;
    private CompileHook hook = CompileHook.NONE;

    private Builder(String name, Kind kind) {
      this.name = requireNonNull(name, "name");
      this.kind = requireNonNull(kind, "kind");
    }

    public Builder path(String path) {
      this.path = path;
      return this;
    }

    public Builder column(String column, FoxgloveColumn.Type type) {
      columns.add(new FoxgloveColumn(column, type));
      if (type == FoxgloveColumn.Type.TIMESTAMP) {
        fieldMap.temporal(column);
      }
      return this;
    }

    public Builder equality(String column, String param) {
      fieldMap.equality(column, param);
      return this;
    }

    /** Equality on {@code column} sent as the API's free-text search. */
    public Builder search(String column, String param) {
      fieldMap.search(column, param);
      return this;
    }

    /** Parameter the API reads as the maximum number of items to return. */
    public Builder limit(String param) {
      fieldMap.limit(param);
      return this;
    }

    public Builder list(String column, String param) {
      fieldMap.list(column, param);
      return this;
    }

    public Builder sort(String column, String param) {
      fieldMap.sort(column, param);
      return this;
    }

    public Builder lowerBound(String column, String param) {
      fieldMap.lowerBound(column, param);
      return this;
    }

    public Builder containment(String column, String param) {
      fieldMap.containment(column, param);
      return this;
    }

    public Builder defaultParam(String param, String value) {
      fieldMap.defaultParam(param, value);
      return this;
    }

    public Builder interval(IntervalColumns interval) {
      fieldMap.interval(interval);
      return this;
    }

    /** Declares a column whose value is the request parameter {@code param}. */
    public Builder echo(String column, String param) {
      echoColumns.put(column, param);
      return this;
    }

    public Builder rowMapper(RowMapper rowMapper) {
      this.rowMapper = rowMapper;
      return this;
    }

    public Builder hook(CompileHook hook) {
      this.hook = hook;
      return this;
    }

    public FoxgloveResource build() {
      return new FoxgloveResource(this);
    }
  }
}
