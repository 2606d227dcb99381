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
package org.apache.calcite.adapter.foxglove.query;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * Accumulates the bounds of a time window while qualifiers are compiled.
 *
 * <p>Each side only ever narrows: the lower bound keeps the latest instant
 * seen and the upper bound the earliest. {@code lower <= upper} is not
 * enforced; an empty window simply yields no rows.
 */
public final class RangeState {

  private @Nullable Instant lower;
  private @Nullable Instant upper;

  public @Nullable Instant lower() {
    return lower;
  }

  public @Nullable Instant upper() {
    return upper;
  }

  public boolean hasLower() {
    return lower != null;
  }

  public boolean hasUpper() {
    return upper != null;
  }

  public boolean isEmpty() {
    return lower == null && upper == null;
  }

  public void tightenLower(Instant candidate) {
    if (lower == null || candidate.isAfter(lower)) {
      lower = candidate;
    }
  }

  public void tightenUpper(Instant candidate) {
    if (upper == null || candidate.isBefore(upper)) {
      upper = candidate;
    }
  }

  /** Fills an absent side with the epoch (lower) or {@code now} (upper). */
  public void fillMissing(Instant epoch, Instant now) {
    if (lower == null) {
      lower = epoch;
    }
    if (upper == null) {
      upper = now;
    }
  }

  @Override public String toString() {
    return "[" + lower + ", " + upper + "]";
  }
}
