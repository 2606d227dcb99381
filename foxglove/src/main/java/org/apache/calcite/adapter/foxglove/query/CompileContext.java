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

import org.apache.calcite.adapter.foxglove.util.Timestamps;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Mutable state of one {@link QualifierCompiler#compile} call, as seen by a
 * {@link CompileHook}.
 */
public final class CompileContext {

  private final String resource;
  private final Map<String, Object> params;
  private final RangeState range;
  private final Clock clock;

  CompileContext(String resource, Map<String, Object> params,
      RangeState range, Clock clock) {
    this.resource = resource;
    this.params = params;
    this.range = range;
    this.clock = clock;
  }

  public String resource() {
    return resource;
  }

  public boolean hasParam(String name) {
    return params.containsKey(name);
  }

  public boolean hasAnyParam(Iterable<String> names) {
    for (String name : names) {
      if (params.containsKey(name)) {
        return true;
      }
    }
    return false;
  }

  public RangeState range() {
    return range;
  }

  /** Completes a half-open window with the epoch or the current instant. */
  public void synthesizeMissingBound() {
    range.fillMissing(Timestamps.EPOCH,
        clock.instant().truncatedTo(ChronoUnit.SECONDS));
  }
}
