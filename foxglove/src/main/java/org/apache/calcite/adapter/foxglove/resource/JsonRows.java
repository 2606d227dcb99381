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

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accessors that read optional, possibly nested fields of upstream JSON
 * objects.
 */
final class JsonRows {

  private JsonRows() {}

  /** Follows {@code path} and returns the node, or null if any step is missing or null. */
  static @Nullable JsonNode node(JsonNode item, String... path) {
    JsonNode node = item;
    for (String name : path) {
      if (node == null || !node.isObject()) {
        return null;
      }
      node = node.get(name);
    }
    return node == null || node.isNull() ? null : node;
  }

  static @Nullable String text(JsonNode item, String... path) {
    JsonNode node = node(item, path);
    if (node == null) {
      return null;
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  static @Nullable Long longValue(JsonNode item, String... path) {
    JsonNode node = node(item, path);
    if (node == null) {
      return null;
    }
    if (node.isNumber()) {
      return node.longValue();
    }
    try {
      return Long.parseLong(node.asText().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static @Nullable Integer intValue(JsonNode item, String... path) {
    Long value = longValue(item, path);
    return value == null ? null : value.intValue();
  }

  /**
   * Returns a structured field. A missing field yields {@code absent}; an
   * explicit JSON null is kept.
   */
  static JsonNode json(JsonNode item, String field, JsonNode absent) {
    JsonNode node = item.get(field);
    return node == null ? absent : node;
  }

  /** Returns {@code first} unless it is null or empty, else {@code second}. */
  static @Nullable String coalesce(@Nullable String first,
      @Nullable String second) {
    return first != null && !first.isEmpty() ? first : second;
  }
}
