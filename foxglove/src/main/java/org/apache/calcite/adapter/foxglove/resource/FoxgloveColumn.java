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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A logical column of a Foxglove resource.
 */
public final class FoxgloveColumn {

  /** Logical type of a column, independent of any SQL engine. */
  public enum Type {
    VARCHAR,
    /** ISO-8601 text upstream. */
    TIMESTAMP,
    BIGINT,
    INTEGER,
    DOUBLE,
    /** Structured value, carried as a Jackson tree. */
    JSON
  }

  private final String name;
  private final Type type;

  public FoxgloveColumn(String name, Type type) {
    this.name = requireNonNull(name, "name");
    this.type = requireNonNull(type, "type");
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FoxgloveColumn)) {
      return false;
    }
    FoxgloveColumn that = (FoxgloveColumn) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override public String toString() {
    return name + ":" + type;
  }
}
