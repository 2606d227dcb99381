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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link JsonSanitizer}.
 */
@Tag("unit")
public class JsonSanitizerTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test void testStrings() {
    String clean = "clean";
    assertSame(clean, JsonSanitizer.sanitize(clean));
    assertEquals("ab", JsonSanitizer.sanitize("a\u0000b\u0000"));
  }

  @Test void testNestedValues() {
    ObjectNode node = mapper.createObjectNode();
    node.put("k\u0000", "v\u0000");
    node.putArray("list").add("x\u0000y").add(3);
    node.putObject("inner").put("z", "\u0000");
    JsonNode clean = JsonSanitizer.sanitize(node);
    assertEquals("v", clean.get("k").asText());
    assertEquals("xy", clean.get("list").get(0).asText());
    assertEquals(3, clean.get("list").get(1).intValue());
    assertEquals("", clean.get("inner").get("z").asText());
    assertTrue(clean.toString().indexOf('\u0000') < 0);
  }

  @Test void testScalarsUnchanged() {
    JsonNode number = mapper.getNodeFactory().numberNode(7);
    assertSame(number, JsonSanitizer.sanitize(number));
    assertNull(JsonSanitizer.sanitize((JsonNode) null));
  }
}
