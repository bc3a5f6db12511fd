// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.valuedump;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import javax.annotation.Nullable;

/** Renders date and time values as UTC {@code ZonedDateTime.of} expressions. */
final class TimeLiterals {

  private TimeLiterals() {}

  /**
   * Returns the literal for {@code value}, or null if it is not a recognized date/time value. A
   * {@link LocalDateTime}, which has no zone, is taken to be in UTC.
   */
  @Nullable
  static String format(Object value) {
    ZonedDateTime utc = toUtc(value);
    if (utc == null) {
      return null;
    }
    return String.format(
        "ZonedDateTime.of(%d, %d, %d, %d, %d, %d, %d, ZoneOffset.UTC)",
        utc.getYear(),
        utc.getMonthValue(),
        utc.getDayOfMonth(),
        utc.getHour(),
        utc.getMinute(),
        utc.getSecond(),
        utc.getNano());
  }

  @Nullable
  private static ZonedDateTime toUtc(Object value) {
    if (value instanceof Instant) {
      return ((Instant) value).atZone(ZoneOffset.UTC);
    } else if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC);
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).atZoneSameInstant(ZoneOffset.UTC);
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).atZone(ZoneOffset.UTC);
    } else if (value instanceof Date) {
      // java.sql.Date does not support toInstant().
      return Instant.ofEpochMilli(((Date) value).getTime()).atZone(ZoneOffset.UTC);
    }
    return null;
  }
}
