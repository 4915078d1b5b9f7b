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

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import com.zulily.cronlens.Utils;
import com.zulily.cronlens.crontab.OccurrenceExpander;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Describes the hour and minute fields of a recurring job in plain English, i.e.
 * <p>
 * hours "*", minutes "0-59/30" -> "Once every thirty minutes"
 * hours "9-17", minutes "0" -> "At minute 0 from 9:00 AM to 5:59 PM"
 * <p>
 * Descriptions never fail: text that cannot be interpreted is quoted back verbatim.
 */
public final class PatternDescriber {

  static final String ALL_DAY = "all day";
  static final String EVERY_MINUTE = "every minute";
  static final String ONCE_A_MINUTE = "once a minute";
  static final String ONCE_EVERY = "once every";

  private static final ImmutableMap<Integer, String> INTERVAL_PHRASES = ImmutableMap.<Integer, String>builder()
    .put(1, ONCE_A_MINUTE)
    .put(2, "once every two minutes")
    .put(5, "once every five minutes")
    .put(10, "once every ten minutes")
    .put(15, "once every fifteen minutes")
    .put(30, "once every thirty minutes")
    .put(60, "once an hour")
    .build();

  private static final ImmutableMap<String, Integer> INTERVAL_WORDS = ImmutableMap.of(
    "two", 2,
    "five", 5,
    "ten", 10,
    "fifteen", 15,
    "thirty", 30
  );

  private static final Pattern EVERY_N_MINUTES = Pattern.compile("once every (\\w+) minutes");

  private PatternDescriber() {
  }

  /**
   * @param hours   The hours field, "*" when null or blank
   * @param minutes The minutes field, "0" when null or blank
   * @return A sentence fragment describing when the job runs
   */
  public static String describe(final String hours, final String minutes) {
    final String hourClause = describeHours(defaultIfBlank(hours, OccurrenceExpander.DEFAULT_HOURS));
    final String minuteClause = describeMinutes(defaultIfBlank(minutes, OccurrenceExpander.DEFAULT_MINUTES));

    if (ALL_DAY.equals(hourClause)) {

      if (EVERY_MINUTE.equals(minuteClause) || minuteClause.startsWith(ONCE_A_MINUTE)) {
        return "Once a minute";
      }

      // "all day" adds nothing to an interval
      if (minuteClause.startsWith(ONCE_EVERY)) {
        return capitalize(minuteClause);
      }

      return capitalize(minuteClause) + " " + ALL_DAY;
    }

    if (minuteClause.startsWith(ONCE_A_MINUTE)) {
      return "Once a minute " + hourClause;
    }

    return capitalize(minuteClause) + " " + hourClause;
  }

  static String describeHours(final String hours) {
    if ("*".equals(hours) || "0-23".equals(hours)) {
      return ALL_DAY;
    }

    if (hours.indexOf('-') >= 0) {
      // Any step is ignored, "9-17/2" reads as the whole window
      final String range = Utils.FORWARD_SLASH_SPLITTER.splitToList(hours).get(0);
      final List<String> endpoints = Utils.HYPHEN_SPLITTER.splitToList(range);

      if (endpoints.size() == 2) {
        final Integer start = Ints.tryParse(endpoints.get(0));
        final Integer end = Ints.tryParse(endpoints.get(1));

        if (isHour(start) && isHour(end)) {
          return "from " + TimeFormat.twelveHour(start, 0) + " to " + TimeFormat.twelveHour(end, 59);
        }
      }

      return "during hours " + hours;
    }

    final Integer hour = Ints.tryParse(hours);

    if (hour != null) {
      return "at " + hour + " o'clock";
    }

    return "during hours " + hours;
  }

  static String describeMinutes(final String minutes) {
    if ("*".equals(minutes)) {
      return EVERY_MINUTE;
    }

    if (minutes.indexOf('/') >= 0) {
      final Integer interval = Ints.tryParse(minutes.substring(minutes.indexOf('/') + 1).trim());

      if (interval == null) {
        return "with pattern " + minutes;
      }

      final String phrase = INTERVAL_PHRASES.get(interval);

      return phrase != null ? phrase : "once every " + interval + " minutes";
    }

    if (minutes.indexOf('-') >= 0) {
      return "every minute during " + minutes;
    }

    if (minutes.indexOf(',') >= 0) {
      final int count = Utils.COMMA_SPLITTER.splitToList(minutes).size();

      return count <= 3 ? "at minutes " + minutes : "at " + count + " specific times";
    }

    final Integer minute = Ints.tryParse(minutes);

    if (minute != null) {
      return "at minute " + minute;
    }

    return "with minute pattern " + minutes;
  }

  /**
   * Ranks descriptions so that the most frequent patterns are listed first
   *
   * @param description A description produced by {@link #describe(String, String)}
   * @return 1000 for once a minute, 1000/N for once every N minutes, 10 for hourly, 1 otherwise
   */
  public static double frequencyScore(final String description) {
    final String lower = description.toLowerCase(Locale.ROOT);

    if (lower.contains(ONCE_A_MINUTE)) {
      return 1000;
    }

    if (lower.contains("once every two minutes")) {
      return 500;
    }

    final Matcher matcher = EVERY_N_MINUTES.matcher(lower);

    if (matcher.find()) {
      Integer interval = Ints.tryParse(matcher.group(1));

      if (interval == null) {
        interval = INTERVAL_WORDS.get(matcher.group(1));
      }

      if (interval != null && interval > 0) {
        return 1000.0 / interval;
      }
    }

    if (lower.contains("once an hour") || (lower.contains(ONCE_EVERY) && lower.contains("hour"))) {
      return 10;
    }

    return 1;
  }

  private static boolean isHour(final Integer value) {
    return value != null && value >= 0 && value <= 23;
  }

  private static String defaultIfBlank(final String value, final String defaultValue) {
    return Utils.isNullOrEmpty(value) ? defaultValue : value.trim();
  }

  private static String capitalize(final String clause) {
    return clause.isEmpty() ? clause : Character.toUpperCase(clause.charAt(0)) + clause.substring(1);
  }
}
