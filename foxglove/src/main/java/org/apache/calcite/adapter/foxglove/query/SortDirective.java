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
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Ordering on a single column.
 */
public final class SortDirective {

  private final String field;
  private final boolean descending;

  @JsonCreator public SortDirective(@JsonProperty("field") String field,
      @JsonProperty("descending") boolean descending) {
    this.field = requireNonNull(field, "field");
    this.descending = descending;
  }

  public static SortDirective asc(String field) {
    return new SortDirective(field, false);
  }

  public static SortDirective desc(String field) {
    return new SortDirective(field, true);
  }

  @JsonProperty("field") public String field() {
    return field;
  }

  @JsonProperty("descending") public boolean descending() {
    return descending;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SortDirective)) {
      return false;
    }
    SortDirective that = (SortDirective) o;
    return descending == that.descending && field.equals(that.field);
  }

  @Override public int hashCode() {
    return Objects.hash(field, descending);
  }

  @Override public String toString() {
    return field + (descending ? " DESC" : " ASC");
  }
}
