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

import com.github.luben.zstd.Zstd;

import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import java.util.zip.CRC32;

/**
 * Writes small MCAP streams for tests.
 */
public class McapTestWriter {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  public McapTestWriter header() {
    return record(McapOpcode.HEADER.code, new Fields().string("").string("test").bytes());
  }

  public McapTestWriter schema(int id, String name, String encoding, byte[] data) {
    return record(McapOpcode.SCHEMA.code, new Fields().u16(id).string(name)
        .string(encoding).u32(data.length).raw(data).bytes());
  }

  public McapTestWriter channel(int id, int schemaId, String topic,
      String messageEncoding) {
    return record(McapOpcode.CHANNEL.code, new Fields().u16(id).u16(schemaId)
        .string(topic).string(messageEncoding).u32(0).bytes());
  }

  public McapTestWriter message(int channelId, long sequence, long logTimeNanos,
      byte[] payload) {
    return record(McapOpcode.MESSAGE.code, new Fields().u16(channelId)
        .u32(sequence).u64(logTimeNanos).u64(logTimeNanos).raw(payload).bytes());
  }

  public McapTestWriter message(int channelId, long sequence, long logTimeNanos,
      String payload) {
    return message(channelId, sequence, logTimeNanos,
        payload.getBytes(StandardCharsets.UTF_8));
  }

  /** Writes the records produced by {@code body} as one chunk. */
  public McapTestWriter chunk(String compression, Consumer<McapTestWriter> body) {
    McapTestWriter inner = new McapTestWriter();
    body.accept(inner);
    byte[] records = inner.out.toByteArray();
    CRC32 crc = new CRC32();
    crc.update(records, 0, records.length);
    byte[] compressed = compress(compression, records);
    return record(McapOpcode.CHUNK.code, new Fields().u64(0).u64(0)
        .u64(records.length).u32(crc.getValue()).string(compression)
        .u64(compressed.length).raw(compressed).bytes());
  }

  public McapTestWriter record(int opcode, byte[] content) {
    out.write(opcode);
    byte[] length = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN)
        .putLong(content.length).array();
    out.write(length, 0, length.length);
    out.write(content, 0, content.length);
    return this;
  }

  public McapTestWriter dataEnd() {
    return record(McapOpcode.DATA_END.code, new Fields().u32(0).bytes());
  }

  /** Returns the stream, wrapped in leading and trailing magic. */
  public byte[] finish() {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    stream.write(McapReader.MAGIC, 0, McapReader.MAGIC.length);
    byte[] body = out.toByteArray();
    stream.write(body, 0, body.length);
    stream.write(McapReader.MAGIC, 0, McapReader.MAGIC.length);
    return stream.toByteArray();
  }

  private static byte[] compress(String compression, byte[] records) {
    switch (compression) {
    case "":
      return records;
    case "zstd":
      return Zstd.compress(records);
    case "lz4":
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      try (FramedLZ4CompressorOutputStream lz4 =
               new FramedLZ4CompressorOutputStream(buffer)) {
        lz4.write(records);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return buffer.toByteArray();
    default:
      return records;
    }
  }

  /** Little-endian field encoder. */
  static class Fields {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    Fields u16(int value) {
      return raw(ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN)
          .putShort((short) value).array());
    }

    Fields u32(long value) {
      return raw(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN)
          .putInt((int) value).array());
    }

    Fields u64(long value) {
      return raw(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN)
          .putLong(value).array());
    }

    Fields string(String value) {
      byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
      return u32(bytes.length).raw(bytes);
    }

    Fields raw(byte[] bytes) {
      out.write(bytes, 0, bytes.length);
      return this;
    }

    byte[] bytes() {
      return out.toByteArray();
    }
  }
}
