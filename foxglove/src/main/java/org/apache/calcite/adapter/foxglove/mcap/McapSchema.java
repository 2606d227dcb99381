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

/**
 * Schema record: describes how the payloads of channels using it are
 * encoded.
 */
public final class McapSchema {

  private final int id;
  private final String name;
  private final String encoding;
  private final byte[] data;

  public McapSchema(int id, String name, String encoding, byte[] data) {
    this.id = id;
    this.name = name;
    this.encoding = encoding;
    this.data = data;
  }

  public int id() {
    return id;
  }

  /** Fully-qualified type name, for example {@code foxglove.SceneUpdate}. */
  public String name() {
    return name;
  }

  /** Schema encoding, such as {@code protobuf} or {@code jsonschema}. */
  public String encoding() {
    return encoding;
  }

  /** Encoded schema; a serialized {@code FileDescriptorSet} for protobuf. */
  public byte[] data() {
    return data;
  }

  @Override public String toString() {
    return "Schema{" + id + ", " + name + ", " + encoding + "}";
  }
}
