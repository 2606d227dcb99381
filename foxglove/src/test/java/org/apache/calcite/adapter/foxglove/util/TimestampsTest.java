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
package org.apache.calcite.adapter.foxglove.util;

import org.apache.calcite.adapter.foxglove.MalformedTimestampException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Timestamps}.
 */
@Tag("unit")
public class TimestampsTest {

  @Test void testDateOnlyIsMidnightUtc() {
    assertEquals("2024-01-02T00:00:00Z", Timestamps.normalize("2024-01-02"));
  }

  @Test void testSpaceSeparatedWithoutOffsetIsUtc() {
    assertEquals("2024-01-02T03:04:05Z",
        Timestamps.normalize("2024-01-02 03:04:05"));
  }

  @Test void testFractionalSecondsAreDropped() {
    assertEquals("2024-01-02T03:04:05Z",
        Timestamps.normalize("2024-01-02T03:04:05.999999Z"));
  }

  @Test void testShortAndCompactOffsets() {
    assertEquals("2024-01-02T01:04:05Z",
        Timestamps.normalize("2024-01-02T03:04:05.789+02"));
    assertEquals("2024-01-01T21:34:05Z",
        Timestamps.normalize("2024-01-02T03:04:05+0530"));
    assertEquals("2024-01-02T08:04:05Z",
        Timestamps.normalize("2024-01-02T03:04:05-05:00"));
  }

  @Test void testLowerCaseSeparators() {
    assertEquals("2024-01-02T03:04:05Z",
        Timestamps.normalize("2024-01-02t03:04:05z"));
  }

  @Test void testNormalizedFormReparsesToItself() {
    String[] inputs = {
        "2024-01-02 03:04:05",
        "2024-01-02T03:04:05Z",
        "2024-01-02t03:04:05z",
        "2024-01-02 03:04:05-07",
        "2024-01-02T03:04:05+0530",
        "2024-01-02T03:04:05-05:00",
        "2024-01-02",
        "2024-01-02T03:04:05.123456Z",
        "2024-01-02 03:04:05.5+02",
    };
    for (String input : inputs) {
      String normalized = Timestamps.normalize(input);
      assertEquals(normalized,
          Timestamps.normalize(Timestamps.parse(normalized)), input);
      assertEquals(normalized, Timestamps.normalize(normalized), input);
    }
  }

  @Test void testTemporalObjects() {
    Instant instant = Instant.parse("2024-05-06T07:08:09Z");
    assertEquals(instant, Timestamps.parse(instant));
    assertEquals(instant,
        Timestamps.parse(OffsetDateTime.of(2024, 5, 6, 9, 8, 9, 0,
            ZoneOffset.ofHours(2))));
    assertEquals(instant,
        Timestamps.parse(LocalDateTime.of(2024, 5, 6, 7, 8, 9)));
    assertEquals(instant, Timestamps.parse(instant.toEpochMilli()));
  }

  @Test void testUnparsableValues() {
    assertNull(Timestamps.parse(null));
    assertNull(Timestamps.parse(""));
    assertNull(Timestamps.parse("yesterday"));
    assertNull(Timestamps.parse("2024-13-45T00:00:00Z"));
    MalformedTimestampException e =
        assertThrows(MalformedTimestampException.class,
            () -> Timestamps.normalize("not a time"));
    assertEquals("not a time", e.getValue());
  }

  @Test void testFormatTruncates() {
    assertEquals("1970-01-01T00:00:00Z", Timestamps.format(Timestamps.EPOCH));
    assertEquals("2024-01-02T03:04:05Z",
        Timestamps.format(Instant.parse("2024-01-02T03:04:05.500Z")));
  }
}
