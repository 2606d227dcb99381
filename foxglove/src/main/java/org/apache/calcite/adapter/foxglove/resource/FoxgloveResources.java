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

import org.apache.calcite.adapter.foxglove.query.CompileHooks;
import org.apache.calcite.adapter.foxglove.query.IntervalColumns;
import org.apache.calcite.adapter.foxglove.util.Timestamps;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.BIGINT;
import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.DOUBLE;
import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.INTEGER;
import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.JSON;
import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.TIMESTAMP;
import static org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn.Type.VARCHAR;
import static org.apache.calcite.adapter.foxglove.resource.JsonRows.coalesce;
import static org.apache.calcite.adapter.foxglove.resource.JsonRows.intValue;
import static org.apache.calcite.adapter.foxglove.resource.JsonRows.json;
import static org.apache.calcite.adapter.foxglove.resource.JsonRows.longValue;
import static org.apache.calcite.adapter.foxglove.resource.JsonRows.text;

/**
 * The Foxglove endpoints exposed as tables.
 */
public final class FoxgloveResources {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  /** Item cap understood by the collection endpoints that page. */
  static final String LIMIT_PARAM = "limit";

  public static final FoxgloveResource DEVICES =
      FoxgloveResource.builder("devices", FoxgloveResource.Kind.COLLECTION)
          .path("/devices")
          .column("id", VARCHAR)
          .column("name", VARCHAR)
          .column("org_id", VARCHAR)
          .column("project_id", VARCHAR)
          .column("created_at", TIMESTAMP)
          .column("updated_at", TIMESTAMP)
          .column("retain_recordings_seconds", INTEGER)
          .column("properties", JSON)
          .equality("project_id", "projectId")
          .search("name", "query")
          .limit(LIMIT_PARAM)
          .sort("id", "id")
          .sort("name", "name")
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", text(item, "id"));
            row.put("name", text(item, "name"));
            row.put("org_id", text(item, "orgId"));
            row.put("project_id", text(item, "projectId"));
            row.put("created_at", text(item, "createdAt"));
            row.put("updated_at", text(item, "updatedAt"));
            row.put("retain_recordings_seconds",
                intValue(item, "retainRecordingsSeconds"));
            row.put("properties", json(item, "properties", NODES.objectNode()));
            return row;
          })
          .build();

  public static final FoxgloveResource RECORDINGS =
      FoxgloveResource.builder("recordings", FoxgloveResource.Kind.COLLECTION)
          .path("/recordings")
          .column("id", VARCHAR)
          .column("project_id", VARCHAR)
          .column("path", VARCHAR)
          .column("size_bytes", BIGINT)
          .column("created_at", TIMESTAMP)
          .column("imported_at", TIMESTAMP)
          .column("start_time", TIMESTAMP)
          .column("end_time", TIMESTAMP)
          .column("duration", DOUBLE)
          .column("import_status", VARCHAR)
          .column("site_id", VARCHAR)
          .column("site_name", VARCHAR)
          .column("edge_site_id", VARCHAR)
          .column("edge_site_name", VARCHAR)
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("key", VARCHAR)
          .column("metadata", JSON)
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("path", "path")
          .equality("project_id", "projectId")
          .equality("import_status", "importStatus")
          .limit(LIMIT_PARAM)
          .interval(
              IntervalColumns.crossMapped("start_time", "end_time", "start",
                  "end", IntervalColumns.Synthesis.WHEN_EITHER))
          .sort("device_name", "deviceName")
          .sort("created_at", "createdAt")
          .sort("start_time", "start")
          .sort("end_time", "end")
          .sort("duration", "duration")
          .sort("path", "path")
          .sort("imported_at", "importedAt")
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", text(item, "id"));
            row.put("project_id", text(item, "projectId"));
            row.put("path", text(item, "path"));
            row.put("size_bytes", longValue(item, "size"));
            row.put("created_at", text(item, "createdAt"));
            row.put("imported_at", text(item, "importedAt"));
            row.put("start_time", text(item, "start"));
            row.put("end_time", text(item, "end"));
            row.put("duration",
                durationSeconds(text(item, "start"), text(item, "end")));
            row.put("import_status", text(item, "importStatus"));
            row.put("site_id", text(item, "site", "id"));
            row.put("site_name", text(item, "site", "name"));
            row.put("edge_site_id", text(item, "edgeSite", "id"));
            row.put("edge_site_name", text(item, "edgeSite", "name"));
            row.put("device_id", text(item, "device", "id"));
            row.put("device_name", text(item, "device", "name"));
            row.put("key", text(item, "key"));
            row.put("metadata", json(item, "metadata", NODES.arrayNode()));
            return row;
          })
          .build();

  public static final FoxgloveResource RECORDING_ATTACHMENTS =
      FoxgloveResource.builder("recording_attachments",
          FoxgloveResource.Kind.COLLECTION)
          .path("/recording-attachments")
          .column("id", VARCHAR)
          .column("recording_id", VARCHAR)
          .column("site_id", VARCHAR)
          .column("name", VARCHAR)
          .column("media_type", VARCHAR)
          .column("log_time", TIMESTAMP)
          .column("create_time", TIMESTAMP)
          .column("crc", BIGINT)
          .column("size_bytes", BIGINT)
          .column("fingerprint", VARCHAR)
          .column("lake_path", VARCHAR)
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("project_id", VARCHAR)
          .equality("recording_id", "recordingId")
          .equality("site_id", "siteId")
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("project_id", "projectId")
          .echo("device_id", "deviceId")
          .echo("device_name", "deviceName")
          .echo("project_id", "projectId")
          .limit(LIMIT_PARAM)
          .sort("log_time", "logTime")
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", text(item, "id"));
            row.put("recording_id", text(item, "recordingId"));
            row.put("site_id", text(item, "siteId"));
            row.put("name", text(item, "name"));
            row.put("media_type", text(item, "mediaType"));
            row.put("log_time", text(item, "logTime"));
            row.put("create_time", text(item, "createTime"));
            row.put("crc", longValue(item, "crc"));
            row.put("size_bytes", longValue(item, "size"));
            row.put("fingerprint", text(item, "fingerprint"));
            row.put("lake_path", text(item, "lakePath"));
            return row;
          })
          .build();

  public static final FoxgloveResource EVENTS =
      FoxgloveResource.builder("events", FoxgloveResource.Kind.COLLECTION)
          .path("/events")
          .column("id", VARCHAR)
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("start_time", TIMESTAMP)
          .column("end_time", TIMESTAMP)
          .column("metadata", JSON)
          .column("created_at", TIMESTAMP)
          .column("updated_at", TIMESTAMP)
          .column("project_id", VARCHAR)
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("project_id", "projectId")
          .interval(
              IntervalColumns.crossMapped("start_time", "end_time", "start",
                  "end", IntervalColumns.Synthesis.WHEN_EITHER))
          .lowerBound("created_at", "createdAfter")
          .lowerBound("updated_at", "updatedAfter")
          .containment("metadata", "query")
          .limit(LIMIT_PARAM)
          .sort("id", "id")
          .sort("device_id", "deviceId")
          .sort("device_name", "deviceName")
          .sort("start_time", "start")
          .sort("created_at", "createdAt")
          .sort("updated_at", "updatedAt")
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", text(item, "id"));
            row.put("device_id",
                coalesce(text(item, "device", "id"), text(item, "deviceId")));
            row.put("device_name", text(item, "device", "name"));
            row.put("start_time", text(item, "start"));
            row.put("end_time", text(item, "end"));
            row.put("metadata", json(item, "metadata", NODES.objectNode()));
            row.put("created_at", text(item, "createdAt"));
            row.put("updated_at", text(item, "updatedAt"));
            row.put("project_id", text(item, "projectId"));
            return row;
          })
          .build();

  public static final FoxgloveResource TOPICS =
      FoxgloveResource.builder("topics", FoxgloveResource.Kind.COLLECTION)
          .path("/data/topics")
          .column("topic", VARCHAR)
          .column("version", VARCHAR)
          .column("encoding", VARCHAR)
          .column("schema_name", VARCHAR)
          .column("schema_encoding", VARCHAR)
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("recording_id", VARCHAR)
          .column("recording_key", VARCHAR)
          .column("start_time", TIMESTAMP)
          .column("end_time", TIMESTAMP)
          .column("project_id", VARCHAR)
          .defaultParam("includeSchemas", "false")
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("recording_id", "recordingId")
          .equality("recording_key", "recordingKey")
          .equality("project_id", "projectId")
          .interval(
              IntervalColumns.plain("start_time", "end_time", "start", "end",
                  IntervalColumns.Synthesis.NEVER))
          .echo("device_id", "deviceId")
          .echo("device_name", "deviceName")
          .echo("recording_id", "recordingId")
          .echo("recording_key", "recordingKey")
          .echo("start_time", "start")
          .echo("end_time", "end")
          .echo("project_id", "projectId")
          .limit(LIMIT_PARAM)
          .sort("topic", "topic")
          .sort("version", "version")
          .hook(
              CompileHooks.requireSelector(
                  ImmutableList.of("recordingId", "recordingKey"),
                  ImmutableList.of("deviceId", "deviceName"),
                  CompileHooks.BoundRequirement.BOTH,
                  ImmutableList.of("recording_id", "recording_key",
                      "device_id/device_name with start_time and end_time")))
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("topic", text(item, "topic"));
            row.put("version", text(item, "version"));
            row.put("encoding", text(item, "encoding"));
            row.put("schema_name", text(item, "schemaName"));
            row.put("schema_encoding", text(item, "schemaEncoding"));
            return row;
          })
          .build();

  public static final FoxgloveResource COVERAGE =
      FoxgloveResource.builder("coverage", FoxgloveResource.Kind.COLLECTION)
          .path("/data/coverage")
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("start_time", TIMESTAMP)
          .column("end_time", TIMESTAMP)
          .column("status", VARCHAR)
          .column("import_status", VARCHAR)
          .column("tolerance", INTEGER)
          .defaultParam("includeEdgeRecordings", "true")
          .defaultParam("tolerance", "30")
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("tolerance", "tolerance")
          .interval(
              IntervalColumns.crossMapped("start_time", "end_time", "start",
                  "end", IntervalColumns.Synthesis.WHEN_EITHER))
          .echo("tolerance", "tolerance")
          .hook(
              CompileHooks.requireTimeBound(
                  ImmutableList.of("start_time", "end_time")))
          .rowMapper(item -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("device_id",
                coalesce(text(item, "device", "id"), text(item, "deviceId")));
            row.put("device_name", text(item, "device", "name"));
            row.put("start_time", text(item, "start"));
            row.put("end_time", text(item, "end"));
            row.put("status", text(item, "status"));
            row.put("import_status", text(item, "importStatus"));
            return row;
          })
          .build();

  public static final FoxgloveResource MESSAGES =
      FoxgloveResource.builder("messages", FoxgloveResource.Kind.STREAM)
          .path("/data/stream")
          .column("device_id", VARCHAR)
          .column("device_name", VARCHAR)
          .column("recording_id", VARCHAR)
          .column("recording_key", VARCHAR)
          .column("timestamp", TIMESTAMP)
          .column("topic", VARCHAR)
          .column("schema_name", VARCHAR)
          .column("channel_id", INTEGER)
          .column("schema_id", INTEGER)
          .column("sequence_id", BIGINT)
          .column("encoding", VARCHAR)
          .column("message", JSON)
          .equality("device_id", "deviceId")
          .equality("device_name", "deviceName")
          .equality("recording_id", "recordingId")
          .equality("recording_key", "recordingKey")
          .list("topic", "topics")
          .interval(
              IntervalColumns.point("timestamp", "start", "end",
                  IntervalColumns.Synthesis.NEVER))
          .echo("device_id", "deviceId")
          .echo("device_name", "deviceName")
          .echo("recording_id", "recordingId")
          .echo("recording_key", "recordingKey")
          .hook(
              CompileHooks.requireSelector(
                  ImmutableList.of("recordingId", "recordingKey"),
                  ImmutableList.of("deviceId", "deviceName"),
                  CompileHooks.BoundRequirement.ANY,
                  ImmutableList.of("recording_id", "recording_key",
                      "device_id/device_name with a timestamp bound")))
          .build();

  private static final ImmutableMap<String, FoxgloveResource> BY_NAME;

  static {
    ImmutableMap.Builder<String, FoxgloveResource> builder =
        ImmutableMap.builder();
    for (FoxgloveResource resource
        : ImmutableList.of(DEVICES, RECORDINGS, RECORDING_ATTACHMENTS, EVENTS,
            TOPICS, COVERAGE, MESSAGES)) {
      builder.put(resource.name(), resource);
    }
    BY_NAME = builder.build();
  }

  private FoxgloveResources() {}

  /** All resources, in declaration order. */
  public static List<FoxgloveResource> all() {
    return BY_NAME.values().asList();
  }

  public static Set<String> names() {
    return BY_NAME.keySet();
  }

  public static @Nullable FoxgloveResource get(String name) {
    return BY_NAME.get(name);
  }

  /** Seconds between two upstream timestamps, or null if either is unreadable. */
  static @Nullable Double durationSeconds(@Nullable String start,
      @Nullable String end) {
    Instant from = Timestamps.parse(start);
    Instant to = Timestamps.parse(end);
    if (from == null || to == null) {
      return null;
    }
    return Duration.between(from, to).toNanos() / 1e9;
  }
}
