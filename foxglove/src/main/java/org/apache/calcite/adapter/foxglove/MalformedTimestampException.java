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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a value supplied for a time column cannot be read as an
 * instant. Not retryable; the query has to be rewritten.
 */
public class MalformedTimestampException extends FoxgloveException {

  private final @Nullable Object value;

  public MalformedTimestampException(@Nullable Object value) {
    super("Cannot parse timestamp " + describe(value));
    this.value = value;
  }

  public MalformedTimestampException(String context, @Nullable Object value) {
    super(context + ": cannot parse timestamp " + describe(value));
    this.value = value;
  }

  /** Returns the offending value. */
  public @Nullable Object getValue() {
    return value;
  }

  private static String describe(@Nullable Object value) {
    return value instanceof CharSequence ? "'" + value + "'" : String.valueOf(value);
  }
}
