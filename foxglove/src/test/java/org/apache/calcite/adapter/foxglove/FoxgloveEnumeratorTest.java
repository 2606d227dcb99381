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
package org.apache.calcite.adapter.foxglove;

import org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FoxgloveEnumerator}.
 */
@Tag("unit")
public class FoxgloveEnumeratorTest {

  @Test void testConvert() throws Exception {
    assertEquals(1704067200000L,
        FoxgloveEnumerator.convert("2024-01-01T00:00:00Z", Type.TIMESTAMP));
    assertNull(FoxgloveEnumerator.convert("later", Type.TIMESTAMP));
    assertEquals(5L, FoxgloveEnumerator.convert("5", Type.BIGINT));
    assertEquals(5, FoxgloveEnumerator.convert(5L, Type.INTEGER));
    assertNull(FoxgloveEnumerator.convert("five", Type.INTEGER));
    assertEquals(2.5d, FoxgloveEnumerator.convert("2.5", Type.DOUBLE));
    assertEquals("{\"a\":[1]}", FoxgloveEnumerator.convert(
        new ObjectMapper().readTree("{\"a\":[1]}"), Type.JSON));
    assertEquals("30", FoxgloveEnumerator.convert(30, Type.VARCHAR));
    assertNull(FoxgloveEnumerator.convert(null, Type.VARCHAR));
  }

  @Test void testRows() {
    Map<String, Object> row = ImmutableMap.of("id", "x", "size", 3L);
    FoxgloveEnumerator single = new FoxgloveEnumerator(
        ImmutableList.of(row).iterator(), ImmutableList.of("id"),
        ImmutableList.of(Type.VARCHAR));
    assertTrue(single.moveNext());
    assertEquals("x", single.current());
    assertFalse(single.moveNext());

    FoxgloveEnumerator multi = new FoxgloveEnumerator(
        ImmutableList.of(row).iterator(), ImmutableList.of("size", "id"),
        ImmutableList.of(Type.BIGINT, Type.VARCHAR));
    assertTrue(multi.moveNext());
    assertArrayEquals(new Object[] {3L, "x"}, (Object[]) multi.current());
    assertThrows(UnsupportedOperationException.class, multi::reset);
  }
}
