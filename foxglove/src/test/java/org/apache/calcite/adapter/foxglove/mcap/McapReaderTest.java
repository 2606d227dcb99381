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

import org.apache.calcite.adapter.foxglove.FoxgloveException;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link McapReader}.
 */
@Tag("unit")
public class McapReaderTest {

  private static final byte[] EMPTY = new byte[0];

  private static List<MessageRecord> read(byte[] data) {
    return ImmutableList.copyOf(new McapReader(data).messages());
  }

  @Test void testRejectsBadMagic() {
    assertThrows(FoxgloveException.class,
        () -> new McapReader("PK\u0003\u0004".getBytes(StandardCharsets.ISO_8859_1)));
    assertThrows(FoxgloveException.class, () -> new McapReader(EMPTY));
  }

  @Test void testSkipsMessagesOnUnknownChannels() {
    McapTestWriter writer = new McapTestWriter().header()
        .schema(1, "a.A", "jsonschema", EMPTY)
        .schema(2, "b.B", "jsonschema", EMPTY)
        .schema(3, "c.C", "protobuf", EMPTY)
        .channel(1, 1, "/a", "json")
        .channel(2, 2, "/b", "json")
        .channel(3, 3, "/c", "protobuf");
    for (int i = 0; i < 10; i++) {
      int channel = i < 2 ? 9 : 1 + i % 3;
      writer.message(channel, i, 1_000L * i, "{}");
    }
    List<MessageRecord> messages = read(writer.dataEnd().finish());
    assertEquals(8, messages.size());
    MessageRecord first = messages.get(0);
    assertEquals(2, first.sequence());
    assertEquals("/c", first.topic());
    assertEquals("c.C", first.schemaName());
    assertEquals("protobuf", first.schemaEncoding());
    assertEquals(3, first.channelId());
    assertEquals(3, first.schemaId());
    assertEquals(2_000L, first.logTimeNanos());
  }

  @Test void testSchemalessChannel() {
    byte[] data = new McapTestWriter()
        .channel(5, McapChannel.NO_SCHEMA, "/raw", "json")
        .message(5, 1, 7L, "{\"x\":1}")
        .finish();
    MessageRecord record = read(data).get(0);
    assertNull(record.schema());
    assertNull(record.schemaName());
    assertArrayEquals("{\"x\":1}".getBytes(StandardCharsets.UTF_8),
        record.payload());
  }

  @Test void testMissingSchemaSkipsMessage() {
    byte[] data = new McapTestWriter()
        .channel(1, 4, "/a", "protobuf")
        .message(1, 1, 1L, EMPTY)
        .finish();
    assertEquals(0, read(data).size());
  }

  @Test void testChunks() {
    for (String compression : new String[] {"", "zstd", "lz4"}) {
      byte[] data = new McapTestWriter().header()
          .chunk(compression, c -> c
              .schema(1, "a.A", "jsonschema", EMPTY)
              .channel(1, 1, "/a", "json")
              .message(1, 1, 10L, "{\"n\":1}")
              .message(1, 2, 20L, "{\"n\":2}"))
          .chunk(compression, c -> c.message(1, 3, 30L, "{\"n\":3}"))
          .dataEnd()
          .finish();
      List<Long> sequences = new ArrayList<>();
      for (MessageRecord record : read(data)) {
        sequences.add(record.sequence());
      }
      assertEquals(ImmutableList.of(1L, 2L, 3L), sequences, compression);
    }
  }

  @Test void testUnknownOpcodesAndIndexRecordsAreSkipped() {
    byte[] data = new McapTestWriter()
        .record(0x80, new byte[] {1, 2, 3})
        .channel(1, 0, "/a", "json")
        .record(McapOpcode.METADATA.code, new byte[] {0, 0, 0, 0})
        .message(1, 1, 1L, "{}")
        .record(0xFE, EMPTY)
        .message(1, 2, 2L, "{}")
        .finish();
    assertEquals(2, read(data).size());
  }

  @Test void testStopsAtDataEnd() {
    byte[] data = new McapTestWriter()
        .channel(1, 0, "/a", "json")
        .message(1, 1, 1L, "{}")
        .dataEnd()
        .message(1, 2, 2L, "{}")
        .finish();
    assertEquals(1, read(data).size());
  }

  @Test void testUnsupportedCompressionSkipsChunk() {
    McapTestWriter writer = new McapTestWriter()
        .channel(1, 0, "/a", "json");
    writer.record(McapOpcode.CHUNK.code, new McapTestWriter.Fields()
        .u64(0).u64(0).u64(2).u32(0).string("brotli").u64(2)
        .raw(new byte[] {1, 2}).bytes());
    writer.message(1, 9, 9L, "{}");
    List<MessageRecord> messages = read(writer.finish());
    assertEquals(1, messages.size());
    assertEquals(9, messages.get(0).sequence());
  }

  @Test void testCorruptZstdChunkSkipped() {
    McapTestWriter writer = new McapTestWriter()
        .channel(1, 0, "/a", "json");
    writer.record(McapOpcode.CHUNK.code, new McapTestWriter.Fields()
        .u64(0).u64(0).u64(64).u32(0).string("zstd").u64(4)
        .raw(new byte[] {9, 9, 9, 9}).bytes());
    writer.message(1, 1, 1L, "{}");
    assertEquals(1, read(writer.finish()).size());
  }

  @Test void testCorruptLz4ChunkSkipped() {
    McapTestWriter writer = new McapTestWriter()
        .channel(1, 0, "/a", "json");
    writer.record(McapOpcode.CHUNK.code, new McapTestWriter.Fields()
        .u64(0).u64(0).u64(64).u32(0).string("lz4").u64(4)
        .raw(new byte[] {9, 9, 9, 9}).bytes());
    writer.message(1, 1, 1L, "{}");
    assertEquals(1, read(writer.finish()).size());
  }

  @Test void testOverlongRecordEndsStream() {
    McapTestWriter writer = new McapTestWriter()
        .channel(1, 0, "/a", "json")
        .message(1, 1, 1L, "{}");
    byte[] data = writer.finish();
    byte[] truncated = new byte[data.length - McapReader.MAGIC.length - 1];
    System.arraycopy(data, 0, truncated, 0, truncated.length);
    Iterator<MessageRecord> messages = new McapReader(truncated).messages();
    assertFalse(messages.hasNext());
  }
}
