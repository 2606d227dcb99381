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
package org.apache.calcite.adapter.foxglove;

import org.apache.calcite.adapter.foxglove.query.Containment;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * SQL functions registered by {@link FoxgloveSchema}.
 */
public final class FoxgloveFunctions {

  private FoxgloveFunctions() {}

  /**
   * Returns whether a JSON metadata object contains every key of
   * {@code target}. A target value of {@code "*"} or null only requires the
   * key; an array value matches any of its elements.
   *
   * <p>Usage: {@code metadata_contains(metadata, '{"site":"lab"}')}
   */
  public static boolean metadataContains(@Nullable String metadata,
      @Nullable String target) {
    if (metadata == null || target == null) {
      return false;
    }
    final ObjectNode wanted = Containment.target(target);
    if (wanted == null) {
      throw new IllegalArgumentException(
          "metadata_contains: target is not a JSON object: " + target);
    }
    return Containment.matches(metadata, wanted);
  }
}
