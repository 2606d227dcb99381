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

import org.apache.calcite.adapter.foxglove.FoxgloveException;
import org.apache.calcite.adapter.foxglove.query.Qualifier;
import org.apache.calcite.adapter.foxglove.query.SortDirective;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * What a query asks of one resource: the qualifiers to honor, the columns
 * to return, the requested ordering and an optional row cap.
 *
 * <p>Serializes to JSON so that a planned query can carry it as a constant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScanRequest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<Qualifier> qualifiers;
  private final ImmutableList<String> columns;
  private final ImmutableList<SortDirective> sortKeys;
  private final @Nullable Integer limit;

  @JsonCreator public ScanRequest(
      @JsonProperty("qualifiers") @Nullable List<Qualifier> qualifiers,
      @JsonProperty("columns") @Nullable List<String> columns,
      @JsonProperty("sortKeys") @Nullable List<SortDirective> sortKeys,
      @JsonProperty("limit") @Nullable Integer limit) {
    this.qualifiers = qualifiers == null ? ImmutableList.of()
        : ImmutableList.copyOf(qualifiers);
    this.columns = columns == null ? ImmutableList.of()
        : ImmutableList.copyOf(columns);
    this.sortKeys = sortKeys == null ? ImmutableList.of()
        : ImmutableList.copyOf(sortKeys);
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
    this.limit = limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("qualifiers") public List<Qualifier> qualifiers() {
    return qualifiers;
  }

  /** Requested columns in output order; empty means every column. */
  @JsonProperty("columns") public List<String> columns() {
    return columns;
  }

  @JsonProperty("sortKeys") public List<SortDirective> sortKeys() {
    return sortKeys;
  }

  @JsonProperty("limit") public @Nullable Integer limit() {
    return limit;
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new FoxgloveException("Cannot serialize scan request", e);
    }
  }

  public static ScanRequest fromJson(String json) {
    try {
      return MAPPER.readValue(json, ScanRequest.class);
    } catch (JsonProcessingException e) {
      throw new FoxgloveException("Cannot read scan request: " + json, e);
    }
  }

  @Override public String toString() {
    return "ScanRequest{qualifiers=" + qualifiers + ", columns=" + columns
        + ", sortKeys=" + sortKeys + ", limit=" + limit + '}';
  }

  /** Builder for {@link ScanRequest}. */
  public static final class Builder {
    private final List<Qualifier> qualifiers = new ArrayList<>();
    private final List<String> columns = new ArrayList<>();
    private final List<SortDirective> sortKeys = new ArrayList<>();
    private @Nullable Integer limit;

    private Builder() {}

    public Builder qualifier(Qualifier qualifier) {
      qualifiers.add(qualifier);
      return this;
    }

    public Builder qualifiers(List<Qualifier> qualifiers) {
      this.qualifiers.addAll(qualifiers);
      return this;
    }

    public Builder columns(String... columns) {
      this.columns.addAll(ImmutableList.copyOf(columns));
      return this;
    }

    public Builder columns(List<String> columns) {
      this.columns.addAll(columns);
      return this;
    }

    public Builder sort(SortDirective sort) {
      sortKeys.add(sort);
      return this;
    }

    public Builder limit(@Nullable Integer limit) {
      this.limit = limit;
      return this;
    }

    public ScanRequest build() {
      return new ScanRequest(qualifiers, columns, sortKeys, limit);
    }
  }
}
