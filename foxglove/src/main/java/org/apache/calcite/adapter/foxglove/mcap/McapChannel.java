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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Channel record: a topic whose messages share one schema and encoding.
 */
public final class McapChannel {

  /** Schema id of a channel that carries schemaless messages. */
  public static final int NO_SCHEMA = 0;

  private final int id;
  private final int schemaId;
  private final String topic;
  private final String messageEncoding;
  private final ImmutableMap<String, String> metadata;

  public McapChannel(int id, int schemaId, String topic,
      String messageEncoding, Map<String, String> metadata) {
    this.id = id;
    this.schemaId = schemaId;
    this.topic = topic;
    this.messageEncoding = messageEncoding;
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  public int id() {
    return id;
  }

  public int schemaId() {
    return schemaId;
  }

  public String topic() {
    return topic;
  }

  public String messageEncoding() {
    return messageEncoding;
  }

  public Map<String, String> metadata() {
    return metadata;
  }

  @Override public String toString() {
    return "Channel{" + id + ", " + topic + ", schema=" + schemaId + "}";
  }
}
