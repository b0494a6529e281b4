// Copyright 2019 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.corp.gtech.ads.datacatalyst.components.experimentoutcomespipeline.transform;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.joda.time.Instant;

/**
 * Utility class for converting command line and staging table date strings to and from the
 * midnight UTC Instants used by the model.
 */
public final class DateUtil {
  private static final DateTimeFormatter OPTION_DATE_FORMAT =
      DateTimeFormatter.ofPattern("dd/MM/yyyy");
  private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
  // Length of a yyyy-MM-dd prefix.
  private static final int ISO_DATE_LENGTH = 10;

  private DateUtil() {
  }

  // Returns the given dateString in dd/MM/yyyy format as an Instant. Dies if the input is invalid.
  private static Instant parseOptionDateStringOrDie(String dateString) {
    try {
      return toInstant(LocalDate.parse(dateString, OPTION_DATE_FORMAT));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          String.format("Invalid date [%s], expected dd/MM/yyyy", dateString), e);
    }
  }

  // Returns the given startDateString in dd/MM/yyyy format as an Instant. If the input is null or
  // empty, returns the Epoch Instant. Dies if the input is invalid.
  public static Instant parseStartDateStringToInstant(String startDateString) {
    Instant startInstant = new Instant(0);
    if (startDateString != null && !startDateString.isEmpty()) {
      startInstant = parseOptionDateStringOrDie(startDateString);
    }
    return startInstant;
  }

  // Returns the given endDateString in dd/MM/yyyy format as an Instant. If the input is null or
  // empty, returns the maximum possible Instant. Dies if the input is invalid.
  public static Instant parseEndDateStringToInstant(String endDateString) {
    Instant endInstant = new Instant(Long.MAX_VALUE);
    if (endDateString != null && !endDateString.isEmpty()) {
      endInstant = parseOptionDateStringOrDie(endDateString);
    }
    return endInstant;
  }

  // Returns a staging table DATE (yyyy-MM-dd) or TIMESTAMP (yyyy-MM-dd hh:mm:ss[.ffffff] UTC)
  // value as the Instant of midnight UTC on that day. Returns null for null or empty input and
  // dies if the input is not a date.
  public static Instant parseStagingDate(String column, Object value) {
    if (value == null || value.toString().trim().isEmpty()) {
      return null;
    }
    String dateString = value.toString().trim();
    try {
      if (dateString.length() > ISO_DATE_LENGTH) {
        dateString = dateString.substring(0, ISO_DATE_LENGTH);
      }
      return toInstant(LocalDate.parse(dateString));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          String.format("Column [%s] has invalid date value [%s]", column, value), e);
    }
  }

  // Returns the given Instant as a yyyy-MM-dd string, or null for a null Instant.
  public static String formatDate(Instant instant) {
    if (instant == null) {
      return null;
    }
    return LocalDate.ofEpochDay(Math.floorDiv(instant.getMillis(), MILLIS_PER_DAY)).toString();
  }

  private static Instant toInstant(LocalDate date) {
    return new Instant(date.toEpochDay() * MILLIS_PER_DAY);
  }
}
