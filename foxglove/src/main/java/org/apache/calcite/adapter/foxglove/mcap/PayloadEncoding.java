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

import java.util.Locale;

/**
 * Payload codecs understood by {@link MessageDecoder}.
 */
public enum PayloadEncoding {
  /** Protobuf message described by a {@code FileDescriptorSet} schema. */
  PROTOBUF("protobuf"),
  /** UTF-8 JSON document. */
  JSON("json"),
  /** Anything else; the payload is not decoded. */
  UNSUPPORTED("unsupported");

  private final String label;

  PayloadEncoding(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Chooses the codec for a message from its channel's message encoding.
   * The schema encoding is consulted only when the channel declares none.
   */
  public static PayloadEncoding resolve(@Nullable String messageEncoding,
      @Nullable String schemaEncoding) {
    if (messageEncoding != null && !messageEncoding.isEmpty()) {
      return fromName(messageEncoding);
    }
    return fromName(schemaEncoding);
  }

  private static PayloadEncoding fromName(@Nullable String name) {
    if (name == null) {
      return UNSUPPORTED;
    }
    switch (name.toLowerCase(Locale.ROOT)) {
    case "protobuf":
      return PROTOBUF;
    case "json":
    case "jsonschema":
      return JSON;
    default:
      return UNSUPPORTED;
    }
  }
}
