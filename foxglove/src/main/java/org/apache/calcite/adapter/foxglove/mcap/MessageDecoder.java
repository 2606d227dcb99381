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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Decodes message payloads into JSON trees, choosing the codec from the
 * message's encoding.
 *
 * <p>Returns null for encodings without a codec. A payload that fails to
 * decode yields {@code {"_error": "<codec>_decode_failed: <reason>"}} so the
 * rest of the stream is still read. Decoded trees are passed through
 * {@link JsonSanitizer}.
 *
 * <p>Not thread-safe; use one instance per stream.
 */
public class MessageDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageDecoder.class);

  /** Field holding the diagnostic of a payload that could not be decoded. */
  public static final String ERROR_FIELD = "_error";

  private final ObjectMapper mapper;
  private final ProtobufPayloadDecoder protobuf;

  public MessageDecoder() {
    this(new ObjectMapper());
  }

  public MessageDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
    this.protobuf = new ProtobufPayloadDecoder(mapper);
  }

  public @Nullable JsonNode decode(MessageRecord record) {
    final PayloadEncoding encoding =
        PayloadEncoding.resolve(record.messageEncoding(), record.schemaEncoding());
    try {
      switch (encoding) {
      case PROTOBUF:
        McapSchema schema = record.schema();
        if (schema == null) {
          throw new PayloadDecodeFailedException(encoding,
              "channel " + record.channelId() + " has no schema");
        }
        return JsonSanitizer.sanitize(protobuf.decode(schema, record.payload()));
      case JSON:
        return JsonSanitizer.sanitize(parseJson(record.payload()));
      default:
        return null;
      }
    } catch (PayloadDecodeFailedException e) {
      LOGGER.debug("Cannot decode {} payload on {}: {}", encoding.label(),
          record.topic(), e.getMessage());
      ObjectNode error = mapper.createObjectNode();
      error.put(ERROR_FIELD, e.diagnostic());
      return error;
    }
  }

  private JsonNode parseJson(byte[] payload) {
    final JsonNode node;
    try {
      node = mapper.readTree(payload);
    } catch (IOException e) {
      throw new PayloadDecodeFailedException(PayloadEncoding.JSON,
          e.getMessage(), e);
    }
    if (node == null || node.isMissingNode()) {
      throw new PayloadDecodeFailedException(PayloadEncoding.JSON,
          "empty payload");
    }
    return node;
  }
}
