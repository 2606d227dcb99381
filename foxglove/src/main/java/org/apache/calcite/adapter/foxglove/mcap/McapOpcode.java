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
 * Record opcodes of the MCAP container format.
 */
public enum McapOpcode {
  HEADER(0x01),
  FOOTER(0x02),
  SCHEMA(0x03),
  CHANNEL(0x04),
  MESSAGE(0x05),
  CHUNK(0x06),
  MESSAGE_INDEX(0x07),
  CHUNK_INDEX(0x08),
  ATTACHMENT(0x09),
  ATTACHMENT_INDEX(0x0A),
  STATISTICS(0x0B),
  METADATA(0x0C),
  METADATA_INDEX(0x0D),
  SUMMARY_OFFSET(0x0E),
  DATA_END(0x0F);

  private static final McapOpcode[] BY_CODE = new McapOpcode[256];

  static {
    for (McapOpcode opcode : values()) {
      BY_CODE[opcode.code] = opcode;
    }
  }

  public final int code;

  McapOpcode(int code) {
    this.code = code;
  }

  /** Returns the opcode with the given code, or null if it is not known. */
  public static @Nullable McapOpcode of(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }
}
