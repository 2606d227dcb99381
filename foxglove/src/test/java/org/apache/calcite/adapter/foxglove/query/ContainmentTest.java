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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Containment}.
 */
@Tag("unit")
public class ContainmentTest {

  @Test void testTargetForms() {
    assertNotNull(Containment.target("{\"a\":1}"));
    assertNotNull(Containment.target(ImmutableMap.of("a", 1)));
    assertNull(Containment.target("[1,2]"));
    assertNull(Containment.target("{broken"));
    assertNull(Containment.target(null));
  }

  @Test void testTokens() {
    ObjectNode target =
        Containment.target("{\"k\":\"v\",\"n\":2.50,\"l\":[\"a\",1],\"skip\":null}");
    assertEquals(Arrays.asList("k:v", "n:2.5", "l:a,1"),
        Containment.tokens(target));
  }

  @Test void testMatches() {
    ObjectNode target = Containment.target("{\"k\":\"v\",\"n\":2}");
    assertTrue(Containment.matches("{\"k\":\"v\",\"n\":2.0,\"x\":true}", target));
    assertFalse(Containment.matches("{\"k\":\"v\"}", target));
    assertFalse(Containment.matches("{\"k\":\"w\",\"n\":2}", target));
    assertFalse(Containment.matches("[]", target));
    assertFalse(Containment.matches(null, target));
  }

  @Test void testWildcardAndNullMatchAnyValue() {
    ObjectNode target = Containment.target("{\"k\":\"*\",\"j\":null}");
    assertTrue(Containment.matches("{\"k\":{\"nested\":1},\"j\":0}", target));
    assertFalse(Containment.matches("{\"k\":1}", target));
  }
}
