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
package org.apache.calcite.adapter.foxglove.util;

import org.apache.calcite.adapter.foxglove.MalformedTimestampException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the timestamp shapes seen in queries and API responses into UTC
 * instants and into the API's wire form, {@code yyyy-MM-ddTHH:mm:ssZ}.
 *
 * <p>Values without a zone are UTC, never the JVM's default zone. Accepted
 * inputs are {@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime},
 * {@link LocalDateTime}, {@link LocalDate}, {@link Date}, a {@link Number}
 * of epoch milliseconds (the form Calcite uses for {@code TIMESTAMP}), and
 * ISO 8601 text where the date and time may be separated by a space and the
 * offset may be {@code Z}, {@code +hh}, {@code +hhmm} or {@code +hh:mm}.
 */
public final class Timestamps {

  /** Lower bound used when a query only constrains the end of a window. */
  public static final Instant EPOCH = Instant.EPOCH;

  private static final DateTimeFormatter WIRE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  private static final Pattern DATE_ONLY =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern OFFSET_SUFFIX =
      Pattern.compile("(Z|[+-]\\d{2}(?::?\\d{2})?)$");
  private static final Pattern SHORT_OFFSET =
      Pattern.compile("([+-]\\d{2})$");
  private static final Pattern COMPACT_OFFSET =
      Pattern.compile("([+-]\\d{2})(\\d{2})$");

  private Timestamps() {}

  /**
   * Returns the wire form of a timestamp, truncated to whole seconds.
   *
   * @throws MalformedTimestampException if the value cannot be parsed
   */
  public static String normalize(@Nullable Object value) {
    Instant instant = parse(value);
    if (instant == null) {
      throw new MalformedTimestampException(value);
    }
    return format(instant);
  }

  /** Formats an instant in wire form, dropping sub-second precision. */
  public static String format(Instant instant) {
    return WIRE_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * Parses a timestamp, returning null instead of throwing when the value
   * has no recognizable form.
   */
  public static @Nullable Instant parse(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof Number) {
      return Instant.ofEpochMilli(((Number) value).longValue());
    }
    return parseText(value.toString());
  }

  private static @Nullable Instant parseText(String raw) {
    String s = raw.trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      if (DATE_ONLY.matcher(s).matches()) {
        return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      if (s.indexOf('T') < 0 && s.indexOf('t') < 0) {
        int space = s.indexOf(' ');
        if (space < 0) {
          return null;
        }
        s = s.substring(0, space) + 'T' + s.substring(space + 1).trim();
      }
      s = s.toUpperCase(Locale.ROOT);
      String time = s.substring(s.indexOf('T') + 1);
      if (!OFFSET_SUFFIX.matcher(time).find()) {
        return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
      }
      Matcher shortOffset = SHORT_OFFSET.matcher(s);
      if (shortOffset.find()) {
        s = s + ":00";
      } else {
        Matcher compact = COMPACT_OFFSET.matcher(s);
        if (compact.find()) {
          s = s.substring(0, compact.start()) + compact.group(1) + ':'
              + compact.group(2);
        }
      }
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
      return null;
    }
  }
}
