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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FoxgloveResources} and {@link FoxgloveResource}.
 */
@Tag("unit")
public class FoxgloveResourcesTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test void testNames() {
    assertEquals(ImmutableSet.of("devices", "recordings", "recording_attachments",
        "events", "topics", "coverage", "messages"), FoxgloveResources.names());
    assertSame(FoxgloveResources.EVENTS, FoxgloveResources.get("events"));
    assertNull(FoxgloveResources.get("sites"));
  }

  @Test void testSortCapabilities() {
    FoxgloveResource recordings = FoxgloveResources.RECORDINGS;
    assertTrue(recordings.canSortUpstream("start_time"));
    assertFalse(recordings.canSortUpstream("size_bytes"));
    assertTrue(recordings.canSort("size_bytes"));
    assertTrue(recordings.canSort("metadata"));
    assertFalse(recordings.canSort("no_such_column"));

    FoxgloveResource messages = FoxgloveResources.MESSAGES;
    assertFalse(messages.canSortUpstream("timestamp"));
    assertTrue(messages.canSort("timestamp"));
    assertTrue(messages.canSort("message"));
  }

  @Test void testLimitParameters() {
    for (FoxgloveResource resource : FoxgloveResources.all()) {
      boolean pages = !resource.name().equals("coverage")
          && !resource.name().equals("messages");
      assertEquals(pages ? FoxgloveResources.LIMIT_PARAM : null,
          resource.fieldMap().limitParam(), resource.name());
    }
    assertFalse(FoxgloveResources.DEVICES.fieldMap().isExactEquality("name"));
    assertTrue(FoxgloveResources.DEVICES.fieldMap().isExactEquality("project_id"));
    assertTrue(FoxgloveResources.MESSAGES.fieldMap().isExactEquality("topic"));
  }

  @Test void testTimestampColumnsAreTemporal() {
    assertTrue(FoxgloveResources.EVENTS.fieldMap().isTemporal("created_at"));
    assertTrue(FoxgloveResources.MESSAGES.fieldMap().isTemporal("timestamp"));
    assertFalse(FoxgloveResources.EVENTS.fieldMap().isTemporal("device_id"));
  }

  @Test void testDeviceRow() throws Exception {
    Map<String, Object> row = FoxgloveResources.DEVICES.rowMapper().map(
        mapper.readTree("{\"id\":\"d\",\"name\":\"n\",\"orgId\":\"o\","
            + "\"retainRecordingsSeconds\":\"3600\",\"properties\":null}"));
    assertEquals("o", row.get("org_id"));
    assertEquals(3600, row.get("retain_recordings_seconds"));
    assertTrue(((JsonNode) row.get("properties"))
        .isNull());
    assertNull(row.get("project_id"));
  }

  @Test void testAttachmentRow() throws Exception {
    Map<String, Object> row = FoxgloveResources.RECORDING_ATTACHMENTS.rowMapper()
        .map(mapper.readTree("{\"id\":\"a\",\"recordingId\":\"r\","
            + "\"crc\":4294967295,\"size\":12,\"lakePath\":\"s3://x\"}"));
    assertEquals(4294967295L, row.get("crc"));
    assertEquals(12L, row.get("size_bytes"));
    assertEquals("s3://x", row.get("lake_path"));
  }

  @Test void testDuration() {
    assertEquals(1.5d, FoxgloveResources.durationSeconds("2024-01-01T00:00:00Z",
        "2024-01-01T00:00:01.500Z"));
    assertNull(FoxgloveResources.durationSeconds(null, "2024-01-01T00:00:00Z"));
  }

  @Test void testCollectionNeedsRowMapper() {
    assertThrows(IllegalArgumentException.class,
        () -> FoxgloveResource.builder("bad", FoxgloveResource.Kind.COLLECTION)
            .path("/bad")
            .column("id", FoxgloveColumn.Type.VARCHAR)
            .build());
  }
}
