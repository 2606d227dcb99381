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
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.DynamicMessage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MessageDecoder}.
 */
@Tag("unit")
public class MessageDecoderTest {

  private final MessageDecoder decoder = new MessageDecoder();

  private static FileDescriptorProto poseFile() {
    return FileDescriptorProto.newBuilder()
        .setName("test/pose.proto")
        .setPackage("test")
        .setSyntax("proto3")
        .addMessageType(DescriptorProto.newBuilder()
            .setName("Pose")
            .addField(field("frame_id", 1, FieldDescriptorProto.Type.TYPE_STRING))
            .addField(field("x", 2, FieldDescriptorProto.Type.TYPE_DOUBLE))
            .addNestedType(DescriptorProto.newBuilder()
                .setName("Tag")
                .addField(field("label", 1, FieldDescriptorProto.Type.TYPE_STRING))))
        .build();
  }

  private static FieldDescriptorProto field(String name, int number,
      FieldDescriptorProto.Type type) {
    return FieldDescriptorProto.newBuilder()
        .setName(name)
        .setNumber(number)
        .setType(type)
        .setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL)
        .build();
  }

  private static McapSchema schema(int id, String name) {
    return new McapSchema(id, name, "protobuf",
        FileDescriptorSet.newBuilder().addFile(poseFile()).build().toByteArray());
  }

  private static MessageRecord record(McapSchema schema, String encoding,
      byte[] payload) {
    McapChannel channel = new McapChannel(1,
        schema == null ? McapChannel.NO_SCHEMA : schema.id(), "/pose", encoding,
        ImmutableMap.of());
    return new MessageRecord(channel, schema, 1, 0, 0, payload);
  }

  private static Descriptor descriptor(String name)
      throws DescriptorValidationException {
    FileDescriptor file =
        FileDescriptor.buildFrom(poseFile(), new FileDescriptor[0]);
    Descriptor pose = file.findMessageTypeByName("Pose");
    return name.equals("Pose") ? pose : pose.findNestedTypeByName(name);
  }

  @Test void testJson() {
    JsonNode node = decoder.decode(record(null, "json",
        "{\"a\":1}".getBytes(StandardCharsets.UTF_8)));
    assertNotNull(node);
    assertEquals(1, node.get("a").intValue());
  }

  @Test void testInvalidJsonBecomesError() {
    JsonNode node = decoder.decode(record(null, "json",
        "{\"a\":".getBytes(StandardCharsets.UTF_8)));
    assertTrue(node.get(MessageDecoder.ERROR_FIELD).asText()
        .startsWith("json_decode_failed: "));
  }

  @Test void testJsonIsSanitized() {
    JsonNode node = decoder.decode(record(null, "json",
        "{\"a\\u0000\":\"b\\u0000c\"}".getBytes(StandardCharsets.UTF_8)));
    assertEquals("bc", node.get("a").asText());
  }

  @Test void testUnsupportedEncodingIsNotDecoded() {
    assertNull(decoder.decode(record(null, "ros1", new byte[] {1, 2})));
    assertNull(decoder.decode(record(null, "cdr", new byte[0])));
  }

  @Test void testProtobuf() throws Exception {
    Descriptor pose = descriptor("Pose");
    byte[] payload = DynamicMessage.newBuilder(pose)
        .setField(pose.findFieldByName("frame_id"), "map")
        .setField(pose.findFieldByName("x"), 1.5d)
        .build().toByteArray();
    JsonNode node = decoder.decode(record(schema(3, "test.Pose"), "protobuf", payload));
    assertEquals("map", node.get("frame_id").asText());
    assertEquals(1.5d, node.get("x").doubleValue());
  }

  @Test void testProtobufNestedTypeAndDefaults() throws Exception {
    Descriptor tag = descriptor("Tag");
    byte[] payload = DynamicMessage.newBuilder(tag).build().toByteArray();
    JsonNode node =
        decoder.decode(record(schema(4, "test.Pose.Tag"), "protobuf", payload));
    assertEquals("", node.get("label").asText());
    assertFalse(node.has(MessageDecoder.ERROR_FIELD));
  }

  @Test void testCorruptProtobufBecomesError() {
    JsonNode node = decoder.decode(record(schema(5, "test.Pose"), "protobuf",
        new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF}));
    assertTrue(node.get(MessageDecoder.ERROR_FIELD).asText()
        .startsWith("protobuf_decode_failed: "));
  }

  @Test void testUnknownMessageTypeBecomesError() {
    JsonNode node = decoder.decode(record(schema(6, "test.Missing"), "protobuf",
        new byte[0]));
    assertTrue(node.get(MessageDecoder.ERROR_FIELD).asText()
        .contains("test.Missing"));
    // the failure is remembered per schema
    node = decoder.decode(record(schema(6, "test.Missing"), "protobuf",
        new byte[0]));
    assertTrue(node.has(MessageDecoder.ERROR_FIELD));
  }

  @Test void testSchemaEncodingFallback() {
    McapSchema schema = new McapSchema(7, "x", "jsonschema", new byte[0]);
    JsonNode node = decoder.decode(record(schema, "",
        "[1,2]".getBytes(StandardCharsets.UTF_8)));
    assertEquals(2, node.size());
  }

  @Test void testChannelEncodingWinsOverSchemaEncoding() {
    McapSchema schema = new McapSchema(8, "x", "jsonschema", new byte[0]);
    assertNull(decoder.decode(record(schema, "cbor", new byte[] {(byte) 0xA0})));
    assertNull(decoder.decode(record(schema, "ros1", new byte[] {1})));
    assertEquals(PayloadEncoding.UNSUPPORTED,
        PayloadEncoding.resolve("cbor", "jsonschema"));
    assertEquals(PayloadEncoding.JSON, PayloadEncoding.resolve(null, "jsonschema"));
  }

  @Test void testProtobufWithoutSchemaBecomesError() {
    JsonNode node = decoder.decode(record(null, "protobuf", new byte[0]));
    assertTrue(node.has(MessageDecoder.ERROR_FIELD));
  }
}
