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

import org.apache.calcite.adapter.foxglove.api.FoxgloveTransport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link FoxgloveTransport} that answers with canned bodies and
 * remembers what it was asked.
 */
public class RecordingTransport implements FoxgloveTransport {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, JsonNode> responses = new LinkedHashMap<>();
  private final Map<String, byte[]> downloads = new LinkedHashMap<>();

  public final List<String> calls = new ArrayList<>();
  public @Nullable Map<String, String> lastParams;
  public @Nullable JsonNode lastBody;

  public RecordingTransport respond(String path, String json) {
    try {
      responses.put(path, MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
    return this;
  }

  public RecordingTransport serve(String url, byte[] data) {
    downloads.put(url, data);
    return this;
  }

  @Override public JsonNode get(String path, Map<String, String> params) {
    calls.add("GET " + path);
    lastParams = new LinkedHashMap<>(params);
    return response(path);
  }

  @Override public JsonNode post(String path, JsonNode body) {
    calls.add("POST " + path);
    lastBody = body;
    return response(path);
  }

  @Override public byte[] download(String url) {
    calls.add("DOWNLOAD " + url);
    byte[] data = downloads.get(url);
    if (data == null) {
      throw new AssertionError("unexpected download " + url);
    }
    return data;
  }

  private JsonNode response(String path) {
    JsonNode node = responses.get(path);
    if (node == null) {
      throw new AssertionError("unexpected request to " + path);
    }
    return node;
  }
}
