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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One message of an MCAP stream, resolved against its channel and schema.
 *
 * <p>Instances are created while iterating a stream and are not retained
 * by the reader.
 */
public final class MessageRecord {

  private final McapChannel channel;
  private final @Nullable McapSchema schema;
  private final long sequence;
  private final long logTimeNanos;
  private final long publishTimeNanos;
  private final byte[] payload;

  public MessageRecord(McapChannel channel, @Nullable McapSchema schema,
      long sequence, long logTimeNanos, long publishTimeNanos, byte[] payload) {
    this.channel = channel;
    this.schema = schema;
    this.sequence = sequence;
    this.logTimeNanos = logTimeNanos;
    this.publishTimeNanos = publishTimeNanos;
    this.payload = payload;
  }

  public McapChannel channel() {
    return channel;
  }

  /** Schema of the message, or null for a schemaless channel. */
  public @Nullable McapSchema schema() {
    return schema;
  }

  public int channelId() {
    return channel.id();
  }

  public int schemaId() {
    return channel.schemaId();
  }

  public String topic() {
    return channel.topic();
  }

  public @Nullable String schemaName() {
    return schema == null ? null : schema.name();
  }

  /** Encoding declared by the schema, or null when there is none. */
  public @Nullable String schemaEncoding() {
    return schema == null ? null : schema.encoding();
  }

  public String messageEncoding() {
    return channel.messageEncoding();
  }

  public long sequence() {
    return sequence;
  }

  public long logTimeNanos() {
    return logTimeNanos;
  }

  public long publishTimeNanos() {
    return publishTimeNanos;
  }

  public byte[] payload() {
    return payload;
  }

  @Override public String toString() {
    return "Message{" + channel.topic() + ", seq=" + sequence + ", t="
        + logTimeNanos + "}";
  }
}
