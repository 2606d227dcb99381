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

import com.google.common.collect.AbstractIterator;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Reads the messages of a buffered MCAP stream.
 *
 * <p>Records are consumed in file order. Schema and channel records are
 * remembered as they are met; chunk records are expanded in place; record
 * kinds that carry no messages, and unknown opcodes, are skipped. Iteration
 * stops at the data-end or footer record.
 *
 * <p>A record that cannot be parsed, or a message whose channel or schema is
 * unknown, is skipped and iteration continues. A record whose declared
 * length runs past the end of its buffer ends that buffer, since the
 * framing of what follows cannot be trusted.
 *
 * <p>The iterator returned by {@link #messages()} is single-use.
 */
public class McapReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(McapReader.class);

  /** Bytes every MCAP stream starts (and ends) with. */
  static final byte[] MAGIC = {
      (byte) 0x89, 'M', 'C', 'A', 'P', '0', '\r', '\n'
  };

  private static final int RECORD_PREFIX = 1 + 8;

  private final byte[] data;

  /**
   * Creates a reader over a complete stream.
   *
   * @throws FoxgloveException if the data does not start with the MCAP magic
   */
  public McapReader(byte[] data) {
    if (data.length < MAGIC.length
        || !Arrays.equals(Arrays.copyOf(data, MAGIC.length), MAGIC)) {
      throw new FoxgloveException("Stream is not an MCAP container ("
          + data.length + " bytes, bad magic)");
    }
    this.data = data;
  }

  /** Returns a lazy iterator over the messages of the stream. */
  public Iterator<MessageRecord> messages() {
    ByteBuffer buffer = ByteBuffer.wrap(data, MAGIC.length,
        data.length - MAGIC.length).slice().order(ByteOrder.LITTLE_ENDIAN);
    return new MessageIterator(buffer);
  }

  /** Walks the record tree, yielding resolved messages. */
  private static class MessageIterator extends AbstractIterator<MessageRecord> {
    private final Deque<ByteBuffer> buffers = new ArrayDeque<>();
    private final Map<Integer, McapSchema> schemas = new HashMap<>();
    private final Map<Integer, McapChannel> channels = new HashMap<>();
    private int emitted;
    private int skipped;

    MessageIterator(ByteBuffer root) {
      buffers.push(root);
    }

    @Override protected @Nullable MessageRecord computeNext() {
      while (!buffers.isEmpty()) {
        final ByteBuffer buffer = buffers.peek();
        if (!buffer.hasRemaining()) {
          buffers.pop();
          continue;
        }
        if (buffer.remaining() < RECORD_PREFIX) {
          LOGGER.warn("Ignoring {} trailing bytes of a truncated MCAP record",
              buffer.remaining());
          buffers.pop();
          continue;
        }
        final int code = buffer.get() & 0xFF;
        final long length = buffer.getLong();
        if (length < 0 || length > buffer.remaining()) {
          LOGGER.warn("MCAP record with opcode 0x{} declares {} bytes but only {}"
              + " remain; abandoning the enclosing section",
              Integer.toHexString(code), length, buffer.remaining());
          buffers.pop();
          continue;
        }
        final ByteBuffer content = slice(buffer, (int) length);
        final McapOpcode opcode = McapOpcode.of(code);
        if (opcode == null) {
          LOGGER.debug("Skipping MCAP record with unknown opcode 0x{}",
              Integer.toHexString(code));
          continue;
        }
        try {
          switch (opcode) {
          case SCHEMA:
            McapSchema schema = readSchema(content);
            schemas.put(schema.id(), schema);
            break;
          case CHANNEL:
            McapChannel channel = readChannel(content);
            channels.put(channel.id(), channel);
            break;
          case MESSAGE:
            MessageRecord message = readMessage(content);
            if (message != null) {
              emitted++;
              return message;
            }
            skipped++;
            break;
          case CHUNK:
            buffers.push(readChunk(content));
            break;
          case DATA_END:
          case FOOTER:
            buffers.clear();
            break;
          default:
            break;
          }
        } catch (ContainerSegmentUnreadableException e) {
          skipped++;
          LOGGER.warn("Skipping unreadable MCAP {} record: {}", opcode,
              e.getMessage());
        }
      }
      LOGGER.debug("MCAP stream yielded {} messages, skipped {} records",
          emitted, skipped);
      return endOfData();
    }

    private @Nullable MessageRecord readMessage(ByteBuffer content) {
      try {
        final int channelId = content.getShort() & 0xFFFF;
        final long sequence = content.getInt() & 0xFFFFFFFFL;
        final long logTime = content.getLong();
        final long publishTime = content.getLong();
        final McapChannel channel = channels.get(channelId);
        if (channel == null) {
          LOGGER.debug("Skipping message on unknown channel {}", channelId);
          return null;
        }
        McapSchema schema = null;
        if (channel.schemaId() != McapChannel.NO_SCHEMA) {
          schema = schemas.get(channel.schemaId());
          if (schema == null) {
            LOGGER.debug("Skipping message on channel {} with unknown schema {}",
                channelId, channel.schemaId());
            return null;
          }
        }
        return new MessageRecord(channel, schema, sequence, logTime,
            publishTime, bytes(content, content.remaining()));
      } catch (BufferUnderflowException e) {
        throw new ContainerSegmentUnreadableException("truncated message", e);
      }
    }
  }

  static McapSchema readSchema(ByteBuffer content) {
    try {
      final int id = content.getShort() & 0xFFFF;
      final String name = string(content);
      final String encoding = string(content);
      final byte[] schemaData = bytes(content, length32(content));
      return new McapSchema(id, name, encoding, schemaData);
    } catch (BufferUnderflowException e) {
      throw new ContainerSegmentUnreadableException("truncated schema", e);
    }
  }

  static McapChannel readChannel(ByteBuffer content) {
    try {
      final int id = content.getShort() & 0xFFFF;
      final int schemaId = content.getShort() & 0xFFFF;
      final String topic = string(content);
      final String messageEncoding = string(content);
      final ByteBuffer entries = slice(content, length32(content));
      final Map<String, String> metadata = new LinkedHashMap<>();
      while (entries.hasRemaining()) {
        metadata.put(string(entries), string(entries));
      }
      return new McapChannel(id, schemaId, topic, messageEncoding, metadata);
    } catch (BufferUnderflowException e) {
      throw new ContainerSegmentUnreadableException("truncated channel", e);
    }
  }

  /** Returns the (decompressed) records section of a chunk. */
  static ByteBuffer readChunk(ByteBuffer content) {
    final String compression;
    final long uncompressedSize;
    final long crc;
    final byte[] records;
    try {
      content.getLong(); // message start time
      content.getLong(); // message end time
      uncompressedSize = content.getLong();
      crc = content.getInt() & 0xFFFFFFFFL;
      compression = string(content);
      long recordsLength = content.getLong();
      if (recordsLength < 0 || recordsLength > content.remaining()) {
        throw new ContainerSegmentUnreadableException("chunk records length "
            + recordsLength + " exceeds record size");
      }
      records = bytes(content, (int) recordsLength);
    } catch (BufferUnderflowException e) {
      throw new ContainerSegmentUnreadableException("truncated chunk", e);
    }
    final byte[] expanded =
        ChunkDecompressor.decompress(compression, records, uncompressedSize);
    if (crc != 0) {
      CRC32 crc32 = new CRC32();
      crc32.update(expanded, 0, expanded.length);
      if (crc32.getValue() != crc) {
        throw new ContainerSegmentUnreadableException("chunk CRC mismatch");
      }
    }
    return ByteBuffer.wrap(expanded).order(ByteOrder.LITTLE_ENDIAN);
  }

  private static int length32(ByteBuffer buffer) {
    long length = buffer.getInt() & 0xFFFFFFFFL;
    if (length > buffer.remaining()) {
      throw new BufferUnderflowException();
    }
    return (int) length;
  }

  private static String string(ByteBuffer buffer) {
    return new String(bytes(buffer, length32(buffer)), StandardCharsets.UTF_8);
  }

  private static byte[] bytes(ByteBuffer buffer, int length) {
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /** Returns the next {@code length} bytes as a view and advances past them. */
  private static ByteBuffer slice(ByteBuffer buffer, int length) {
    if (length > buffer.remaining()) {
      throw new BufferUnderflowException();
    }
    ByteBuffer view = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
    view.limit(length);
    buffer.position(buffer.position() + length);
    return view;
  }
}
