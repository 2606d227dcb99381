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

import org.apache.calcite.adapter.foxglove.MalformedTimestampException;
import org.apache.calcite.adapter.foxglove.util.Timestamps;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates query qualifiers and ordering into the parameters of an
 * upstream request, following a resource's {@link FieldMap}.
 *
 * <ul>
 *   <li>Equality on a mapped column sets its parameter; when a column is
 *   qualified twice the last value wins.</li>
 *   <li>Comparisons on the resource's interval columns narrow a
 *   {@link RangeState}; a missing side may be synthesized.</li>
 *   <li>Lower bounds on single-ended columns keep the latest instant.</li>
 *   <li>Containment on a metadata column becomes a token query.</li>
 *   <li>Only the first sort key is considered, and only pushed when the
 *   API can sort by that column.</li>
 *   <li>A row cap is passed on only when the API's answer needs no further
 *   filtering or ordering: every qualifier is an exact equality and the
 *   ordering, if any, was pushed.</li>
 * </ul>
 *
 * <p>Pushing a qualifier never removes it from local verification; see
 * {@link ResultVerifier}.
 */
public class QualifierCompiler {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(QualifierCompiler.class);

  private final Clock clock;

  public QualifierCompiler() {
    this(Clock.systemUTC());
  }

  public QualifierCompiler(Clock clock) {
    this.clock = clock;
  }

  public CompiledRequest compile(String resource, List<Qualifier> qualifiers,
      List<SortDirective> sortKeys, FieldMap fieldMap) {
    return compile(resource, qualifiers, sortKeys, fieldMap, CompileHook.NONE);
  }

  /**
   * Compiles a request.
   *
   * @throws MalformedTimestampException if a pushed time bound is unreadable
   * @throws org.apache.calcite.adapter.foxglove.MissingRequiredSelectorException
   *     if {@code hook} rejects the request
   */
  public CompiledRequest compile(String resource, List<Qualifier> qualifiers,
      List<SortDirective> sortKeys, FieldMap fieldMap, CompileHook hook) {
    return compile(resource, qualifiers, sortKeys, null, fieldMap, hook);
  }

  /**
   * Compiles a request that wants at most {@code limit} rows.
   *
   * @throws MalformedTimestampException if a pushed time bound is unreadable
   * @throws org.apache.calcite.adapter.foxglove.MissingRequiredSelectorException
   *     if {@code hook} rejects the request
   */
  public CompiledRequest compile(String resource, List<Qualifier> qualifiers,
      List<SortDirective> sortKeys, @Nullable Integer limit, FieldMap fieldMap,
      CompileHook hook) {
    final Map<String, Object> params = new LinkedHashMap<>(fieldMap.defaultParams());
    final RangeState range = new RangeState();
    final Map<String, Instant> lowerBounds = new LinkedHashMap<>();
    final Map<String, List<String>> tokens = new LinkedHashMap<>();
    final List<Qualifier> satisfied = new ArrayList<>();
    final IntervalColumns interval = fieldMap.interval();

    for (Qualifier q : qualifiers) {
      final String field = q.field();
      final Operator op = q.operator();
      if (op == Operator.CONTAINS) {
        String param = fieldMap.containmentParam(field);
        ObjectNode target = Containment.target(q.value());
        if (param != null && target != null) {
          tokens.computeIfAbsent(param, k -> new ArrayList<>())
              .addAll(Containment.tokens(target));
          satisfied.add(q);
        }
        continue;
      }
      if (interval != null && interval.covers(field)) {
        boolean lower = interval.narrowsLower(field, op);
        boolean upper = interval.narrowsUpper(field, op);
        if (lower || upper) {
          Instant instant = instant(resource, q);
          if (lower) {
            range.tightenLower(instant);
          }
          if (upper) {
            range.tightenUpper(instant);
          }
          satisfied.add(q);
          continue;
        }
      }
      String lowerParam = fieldMap.lowerBoundParam(field);
      if (lowerParam != null && (op == Operator.EQ || op.isLowerBound())) {
        Instant instant = instant(resource, q);
        Instant current = lowerBounds.get(lowerParam);
        if (current == null || instant.isAfter(current)) {
          lowerBounds.put(lowerParam, instant);
        }
        satisfied.add(q);
        continue;
      }
      if (op != Operator.EQ || q.value() == null) {
        continue;
      }
      String listParam = fieldMap.listParam(field);
      if (listParam != null) {
        @SuppressWarnings("unchecked")
        List<String> values = (List<String>) params.computeIfAbsent(listParam,
            k -> new ArrayList<String>());
        String value = render(q.value());
        if (!values.contains(value)) {
          values.add(value);
        }
        satisfied.add(q);
        continue;
      }
      String param = fieldMap.equalityParam(field);
      if (param != null) {
        params.put(param, render(q.value()));
        satisfied.add(q);
      }
    }

    for (Map.Entry<String, List<String>> e : tokens.entrySet()) {
      if (!e.getValue().isEmpty()) {
        params.put(e.getKey(), String.join(" ", e.getValue()));
      }
    }
    for (Map.Entry<String, Instant> e : lowerBounds.entrySet()) {
      params.put(e.getKey(), Timestamps.format(e.getValue()));
    }

    final CompileContext context =
        new CompileContext(resource, params, range, clock);
    if (interval != null
        && interval.synthesis() == IntervalColumns.Synthesis.WHEN_EITHER
        && range.hasLower() != range.hasUpper()) {
      context.synthesizeMissingBound();
    }
    hook.apply(context);
    if (interval != null) {
      if (range.lower() != null) {
        params.put(interval.lowerParam(), Timestamps.format(range.lower()));
      }
      if (range.upper() != null) {
        params.put(interval.upperParam(), Timestamps.format(range.upper()));
      }
    }

    SortDirective sort = sortKeys.isEmpty() ? null : sortKeys.get(0);
    boolean sortPushedDown = false;
    if (sort != null) {
      String sortParam = fieldMap.sortParam(sort.field());
      if (sortParam != null) {
        params.put(CompiledRequest.SORT_BY, sortParam);
        params.put(CompiledRequest.SORT_ORDER, sort.descending() ? "desc" : "asc");
        sortPushedDown = true;
      }
      if (sortKeys.size() > 1) {
        LOGGER.debug("{}: only the first of {} sort keys is used", resource,
            sortKeys.size());
      }
    }

    boolean limitPushedDown = false;
    final String limitParam = fieldMap.limitParam();
    if (limit != null && limit > 0 && limitParam != null) {
      if ((sort == null || sortPushedDown)
          && allExactEqualities(qualifiers, satisfied, fieldMap)) {
        params.put(limitParam, String.valueOf(limit));
        limitPushedDown = true;
      } else {
        LOGGER.debug("{}: limit {} kept local, upstream rows need filtering"
            + " or ordering", resource, limit);
      }
    }

    CompiledRequest request = new CompiledRequest(params, sort, sortPushedDown,
        limitPushedDown, satisfied);
    LOGGER.debug("{}: compiled {} qualifiers into {}", resource,
        qualifiers.size(), request);
    return request;
  }

  private static boolean allExactEqualities(List<Qualifier> qualifiers,
      List<Qualifier> satisfied, FieldMap fieldMap) {
    if (satisfied.size() != qualifiers.size()) {
      return false;
    }
    for (Qualifier q : qualifiers) {
      if (q.operator() != Operator.EQ || !fieldMap.isExactEquality(q.field())) {
        return false;
      }
    }
    return true;
  }

  private static Instant instant(String resource, Qualifier q) {
    Instant instant = Timestamps.parse(q.value());
    if (instant == null) {
      throw new MalformedTimestampException(
          resource + "." + q.field() + " " + q.operator().symbol(), q.value());
    }
    return instant;
  }

  /** Renders a literal as a request parameter. */
  static String render(@Nullable Object value) {
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).stripTrailingZeros().toPlainString();
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue())
          .stripTrailingZeros().toPlainString();
    }
    return String.valueOf(value);
  }
}
