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
package com.zulily.cronlens.crontab;

import com.google.common.collect.ImmutableSortedSet;

import static com.zulily.cronlens.Utils.isNullOrEmpty;
import static com.zulily.cronlens.Utils.warn;

/**
 * Combines the hour and minute fields of a schedule into every (hour, minute)
 * pair at which it fires in one UTC day.
 * <p>
 * Malformed upstream schedule data never aborts a report: any field that cannot be
 * read results in a fallback expansion holding the single midnight occurrence.
 */
public final class OccurrenceExpander {

  public static final String DEFAULT_HOURS = "*";
  public static final String DEFAULT_MINUTES = "0";

  private OccurrenceExpander() {
  }

  /**
   * @param hours   The hours field, "*" when null or blank
   * @param minutes The minutes field, "0" when null or blank
   * @return The occurrences of the schedule, or a midnight fallback
   */
  public static Expansion expand(final String hours, final String minutes) {
    final String hourExpression = defaultIfBlank(hours, DEFAULT_HOURS);
    final String minuteExpression = defaultIfBlank(minutes, DEFAULT_MINUTES);

    try {

      final ImmutableSortedSet<Integer> hourValues = CronField.parse(hourExpression, ExpressionPart.Hours);
      final ImmutableSortedSet<Integer> minuteValues = CronField.parse(minuteExpression, ExpressionPart.Minutes);

      final ImmutableSortedSet.Builder<Occurrence> occurrences = ImmutableSortedSet.naturalOrder();

      for (final Integer hour : hourValues) {
        for (final Integer minute : minuteValues) {
          occurrences.add(new Occurrence(hour, minute));
        }
      }

      return Expansion.of(occurrences.build());

    } catch (IllegalArgumentException e) {
      warn("[hours: {0} minutes: {1}] Interpretation error, using midnight: {2}", hourExpression, minuteExpression, e.getMessage());

      return Expansion.fallback(e.getMessage());
    }
  }

  static String defaultIfBlank(final String value, final String defaultValue) {
    return isNullOrEmpty(value) ? defaultValue : value.trim();
  }
}
