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

import org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn;
import org.apache.calcite.adapter.foxglove.util.Timestamps;
import org.apache.calcite.linq4j.Enumerator;

import com.fasterxml.jackson.databind.JsonNode;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Enumerator over the rows of a Foxglove scan, converting each value to the
 * representation Calcite uses for its SQL type.
 *
 * <p>Timestamps become epoch milliseconds and JSON values become their text.
 * A value that cannot be converted becomes null.
 */
class FoxgloveEnumerator implements Enumerator<Object> {
  private static final Logger LOGGER = LoggerFactory.getLogger(FoxgloveEnumerator.class);

  private final Iterator<Map<String, Object>> rows;
  private final List<String> fields;
  private final List<FoxgloveColumn.Type> types;
  private @Nullable Object current;

  FoxgloveEnumerator(Iterator<Map<String, Object>> rows, List<String> fields,
      List<FoxgloveColumn.Type> types) {
    this.rows = rows;
    this.fields = fields;
    this.types = types;
  }

  @Override public Object current() {
    return current;
  }

  @Override public boolean moveNext() {
    if (!rows.hasNext()) {
      current = null;
      return false;
    }
    final Map<String, Object> row = rows.next();
    if (fields.size() == 1) {
      current = convert(row.get(fields.get(0)), types.get(0));
    } else {
      final Object[] values = new Object[fields.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = convert(row.get(fields.get(i)), types.get(i));
      }
      current = values;
    }
    return true;
  }

  @Override public void reset() {
    throw new UnsupportedOperationException("reset not supported");
  }

  @Override public void close() {
    current = null;
  }

  static @Nullable Object convert(@Nullable Object value,
      FoxgloveColumn.Type type) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case TIMESTAMP:
      Instant instant = Timestamps.parse(value);
      if (instant == null) {
        LOGGER.debug("Unreadable timestamp '{}'", value);
        return null;
      }
      return instant.toEpochMilli();
    case BIGINT:
      return value instanceof Number ? (Object) ((Number) value).longValue()
          : Longs.tryParse(value.toString().trim());
    case INTEGER:
      return value instanceof Number ? (Object) ((Number) value).intValue()
          : Ints.tryParse(value.toString().trim());
    case DOUBLE:
      return value instanceof Number ? (Object) ((Number) value).doubleValue()
          : Doubles.tryParse(value.toString().trim());
    case JSON:
      return value instanceof JsonNode ? value.toString() : String.valueOf(value);
    case VARCHAR:
    default:
      return value instanceof JsonNode && ((JsonNode) value).isValueNode()
          ? ((JsonNode) value).asText() : value.toString();
    }
  }
}
