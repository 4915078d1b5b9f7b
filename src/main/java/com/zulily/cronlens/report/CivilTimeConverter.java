/*
 * Copyright (C) 2014 zulily, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.zulily.cronlens.report;

import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.crontab.Occurrence;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts UTC occurrences to the local clock of a display time zone.
 * <p>
 * Every occurrence is anchored to the same reference date, so the offset applied is the one in
 * force on that date regardless of when a report is produced. Occurrences shown for other times of
 * year may differ from the local clock by the zone's seasonal adjustment.
 */
public final class CivilTimeConverter {
  private final DateTimeZone timeZone;
  private final LocalDate referenceDate;

  public CivilTimeConverter(final DateTimeZone timeZone, final LocalDate referenceDate) {
    this.timeZone = checkNotNull(timeZone, "timeZone");
    this.referenceDate = checkNotNull(referenceDate, "referenceDate");
  }

  public static CivilTimeConverter fromConfiguration(final Configuration configuration) {
    checkNotNull(configuration, "configuration");

    return new CivilTimeConverter(configuration.getTimeZone(), configuration.getReferenceDate());
  }

  /**
   * @param occurrence An hour and minute on the UTC clock
   * @return The same instant on the display zone's clock
   */
  public CivilTime toCivilTime(final Occurrence occurrence) {
    checkNotNull(occurrence, "occurrence");

    final DateTime local = new DateTime(
      referenceDate.getYear(),
      referenceDate.getMonthOfYear(),
      referenceDate.getDayOfMonth(),
      occurrence.getHour(),
      occurrence.getMinute(),
      DateTimeZone.UTC
    ).withZone(timeZone);

    return new CivilTime(local.getHourOfDay(), local.getMinuteOfHour());
  }

  public DateTimeZone getTimeZone() {
    return timeZone;
  }

  public LocalDate getReferenceDate() {
    return referenceDate;
  }

  /**
   * @return A short label for the zone as of the reference date, i.e. "MST"
   */
  public String getZoneLabel() {
    return timeZone.getShortName(referenceDate.toDateTimeAtStartOfDay(DateTimeZone.UTC).getMillis(), Locale.ENGLISH);
  }
}
