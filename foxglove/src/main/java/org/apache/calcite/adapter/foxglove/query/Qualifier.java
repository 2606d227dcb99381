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
 * A single predicate {@code field operator value} taken from a query.
 *
 * <p>The value is a scalar for comparisons and a JSON object (or its text)
 * for {@link Operator#CONTAINS}.
 */
public final class Qualifier {

  private final String field;
  private final Operator operator;
  private final @Nullable Object value;

  @JsonCreator public Qualifier(@JsonProperty("field") String field,
      @JsonProperty("operator") Operator operator,
      @JsonProperty("value") @Nullable Object value) {
    this.field = requireNonNull(field, "field");
    this.operator = requireNonNull(operator, "operator");
    this.value = value;
  }

  public static Qualifier of(String field, Operator operator,
      @Nullable Object value) {
    return new Qualifier(field, operator, value);
  }

  public static Qualifier eq(String field, @Nullable Object value) {
    return new Qualifier(field, Operator.EQ, value);
  }

  @JsonProperty("field") public String field() {
    return field;
  }

  @JsonProperty("operator") public Operator operator() {
    return operator;
  }

  @JsonProperty("value") public @Nullable Object value() {
    return value;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Qualifier)) {
      return false;
    }
    Qualifier that = (Qualifier) o;
    return field.equals(that.field)
        && operator == that.operator
        && Objects.equals(value, that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(field, operator, value);
  }

  @Override public String toString() {
    return field + " " + operator.symbol() + " " + value;
  }
}
