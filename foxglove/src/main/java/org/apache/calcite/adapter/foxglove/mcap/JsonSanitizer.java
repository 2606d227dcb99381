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
package org.apache.calcite.adapter.foxglove.mcap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.Map;

/**
 * Removes NUL characters (U+0000) from every string of a decoded payload,
 * object keys included. Databases storing JSON reject the character even
 * when escaped.
 */
public final class JsonSanitizer {

  private static final char NUL = '\u0000';

  private JsonSanitizer() {}

  public static @Nullable JsonNode sanitize(@Nullable JsonNode node) {
    if (node == null) {
      return null;
    }
    if (node.isTextual()) {
      String text = node.textValue();
      String clean = sanitize(text);
      return clean.equals(text) ? node : TextNode.valueOf(clean);
    }
    if (node.isArray()) {
      ArrayNode array = JsonNodeFactory.instance.arrayNode(node.size());
      for (JsonNode element : node) {
        array.add(sanitize(element));
      }
      return array;
    }
    if (node.isObject()) {
      ObjectNode object = JsonNodeFactory.instance.objectNode();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        object.set(sanitize(field.getKey()), sanitize(field.getValue()));
      }
      return object;
    }
    return node;
  }

  /** Returns {@code text} without NUL characters; the same instance if it has none. */
  public static String sanitize(String text) {
    if (text.indexOf(NUL) < 0) {
      return text;
    }
    StringBuilder b = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c != NUL) {
        b.append(c);
      }
    }
    return b.toString();
  }
}
