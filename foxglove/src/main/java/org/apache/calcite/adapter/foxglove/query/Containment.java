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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON containment on metadata objects, in the form
 * {@code {"key": "value", "other": ["a", "b"], "any": "*"}}.
 *
 * <p>A key must be present in the row; a list value matches any of its
 * members; {@code "*"} (or null) matches any value.
 */
public final class Containment {

  /** Target value that matches any value of a present key. */
  public static final String WILDCARD = "*";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Containment() {}

  /**
   * Reads a containment operand, given as a JSON object, a {@link Map} or
   * JSON text. Returns null if the operand is not an object.
   */
  public static @Nullable ObjectNode target(@Nullable Object value) {
    JsonNode node = toNode(value);
    return node instanceof ObjectNode ? (ObjectNode) node : null;
  }

  /**
   * Renders a target as the API's metadata query: space-separated
   * {@code key:value} tokens with list values joined by commas.
   */
  public static List<String> tokens(ObjectNode target) {
    List<String> tokens = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = target.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode v = field.getValue();
      if (v.isNull()) {
        continue;
      }
      if (v.isArray()) {
        List<String> members = new ArrayList<>();
        for (JsonNode member : v) {
          members.add(text(member));
        }
        tokens.add(field.getKey() + ":" + String.join(",", members));
      } else {
        tokens.add(field.getKey() + ":" + text(v));
      }
    }
    return tokens;
  }

  /** Evaluates containment of {@code target} in a row's metadata value. */
  public static boolean matches(@Nullable Object rowValue, ObjectNode target) {
    JsonNode row = toNode(rowValue);
    if (!(row instanceof ObjectNode)) {
      return false;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = target.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!row.has(field.getKey())) {
        return false;
      }
      JsonNode want = field.getValue();
      JsonNode actual = row.get(field.getKey());
      if (want.isNull() || (want.isTextual() && WILDCARD.equals(want.asText()))) {
        continue;
      }
      if (want.isArray()) {
        boolean member = false;
        for (JsonNode candidate : want) {
          if (text(candidate).equals(text(actual))) {
            member = true;
            break;
          }
        }
        if (!member) {
          return false;
        }
      } else if (!text(want).equals(text(actual))) {
        return false;
      }
    }
    return true;
  }

  private static @Nullable JsonNode toNode(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof JsonNode) {
      return (JsonNode) value;
    }
    if (value instanceof CharSequence) {
      try {
        return MAPPER.readTree(value.toString());
      } catch (JsonProcessingException e) {
        return null;
      }
    }
    return MAPPER.valueToTree(value);
  }

  private static String text(JsonNode node) {
    if (node.isNumber()) {
      return node.decimalValue().stripTrailingZeros().toPlainString();
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }
}
