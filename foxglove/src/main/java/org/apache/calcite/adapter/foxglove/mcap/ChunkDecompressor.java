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
import com.github.luben.zstd.ZstdException;
import com.google.common.io.ByteStreams;

import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Expands the records section of an MCAP chunk.
 *
 * <p>Supported compressions are none (empty string), {@code zstd} and
 * {@code lz4} (LZ4 frame format).
 */
final class ChunkDecompressor {

  private ChunkDecompressor() {}

  static byte[] decompress(String compression, byte[] records,
      long uncompressedSize) {
    if (uncompressedSize < 0 || uncompressedSize > Integer.MAX_VALUE) {
      throw new ContainerSegmentUnreadableException(
          "chunk too large to decompress: " + uncompressedSize + " bytes");
    }
    switch (compression) {
    case "":
      return records;
    case "zstd":
      try {
        return Zstd.decompress(records, (int) uncompressedSize);
      } catch (ZstdException e) {
        throw new ContainerSegmentUnreadableException(
            "zstd chunk is corrupt: " + e.getMessage(), e);
      }
    case "lz4":
      try (InputStream in =
               new FramedLZ4CompressorInputStream(new ByteArrayInputStream(records))) {
        return ByteStreams.toByteArray(in);
      } catch (IOException e) {
        throw new ContainerSegmentUnreadableException(
            "lz4 chunk is corrupt: " + e.getMessage(), e);
      }
    default:
      throw new ContainerSegmentUnreadableException(
          "unsupported chunk compression '" + compression + "'");
    }
  }
}
