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

import org.apache.calcite.adapter.foxglove.MissingRequiredSelectorException;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Factory methods for the {@link CompileHook}s used by the built-in
 * resources.
 */
public final class CompileHooks {

  /** How much of the time window a scoping selector needs. */
  public enum BoundRequirement {
    /** Both bounds must come from the query. */
    BOTH,
    /** At least one bound; the other is synthesized. */
    ANY
  }

  private CompileHooks() {}

  /**
   * Requires at least one time bound. Used for endpoints whose window is
   * mandatory and has no sensible default.
   */
  public static CompileHook requireTimeBound(List<String> alternatives) {
    final ImmutableList<String> alts = ImmutableList.copyOf(alternatives);
    return context -> {
      if (context.range().isEmpty()) {
        throw new MissingRequiredSelectorException(context.resource(),
            "a time window is required", alts);
      }
    };
  }

  /**
   * Requires either an identifying parameter (such as a recording id), or a
   * scoping parameter (such as a device) together with a time window.
   *
   * @param identifyingParams parameters that select the data on their own
   * @param scopingParams parameters that select data within a window
   * @param requirement how much of the window a scoping selector needs
   * @param alternatives human-readable description of valid selectors
   */
  public static CompileHook requireSelector(List<String> identifyingParams,
      List<String> scopingParams, BoundRequirement requirement,
      List<String> alternatives) {
    final ImmutableList<String> identifying = ImmutableList.copyOf(identifyingParams);
    final ImmutableList<String> scoping = ImmutableList.copyOf(scopingParams);
    final ImmutableList<String> alts = ImmutableList.copyOf(alternatives);
    return context -> {
      if (context.hasAnyParam(identifying)) {
        return;
      }
      if (!context.hasAnyParam(scoping)) {
        throw new MissingRequiredSelectorException(context.resource(),
            "no identifying selector given", alts);
      }
      RangeState range = context.range();
      switch (requirement) {
      case BOTH:
        if (!range.hasLower() || !range.hasUpper()) {
          throw new MissingRequiredSelectorException(context.resource(),
              "both window bounds are required when selecting by " + scoping,
              alts);
        }
        break;
      case ANY:
        if (range.isEmpty()) {
          throw new MissingRequiredSelectorException(context.resource(),
              "a time bound is required when selecting by " + scoping, alts);
        }
        context.synthesizeMissingBound();
        break;
      default:
        throw new AssertionError(requirement);
      }
    };
  }
}
